package lark.core.error;

public class LarkException extends RuntimeException {

    public LarkException(String message) {
        super(message);
    }

    public LarkException(String message, Throwable cause) {
        super(message, cause);
    }
}
