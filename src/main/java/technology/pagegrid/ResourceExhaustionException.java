package technology.pagegrid;

/**
 * 单页的工作集（线段、交点）超过上限，或单页处理超时。只影响当前页。
 */
public class ResourceExhaustionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ResourceExhaustionException(String message) {
        super(message);
    }

    public ResourceExhaustionException(String message, Throwable cause) {
        super(message, cause);
    }

}
