package technology.pagegrid;

import java.io.IOException;

/**
 * 页码越界，或页面为空/无法读取。调用方直接得到该异常，没有部分结果。
 */
public class InvalidPageException extends IOException {

    private static final long serialVersionUID = 1L;

    public InvalidPageException(String message) {
        super(message);
    }

    public InvalidPageException(Throwable cause) {
        super(cause);
    }

    public InvalidPageException(String message, Throwable cause) {
        super(message, cause);
    }

}
