package technology.pagegrid;

import java.io.IOException;

/**
 * 页面来源无法为某一页提供字符、路径或块时抛出。
 */
public class ExtractionFailureException extends IOException {

    private static final long serialVersionUID = 1L;

    public ExtractionFailureException(String message) {
        super(message);
    }

    public ExtractionFailureException(Throwable cause) {
        super(cause);
    }

    public ExtractionFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
