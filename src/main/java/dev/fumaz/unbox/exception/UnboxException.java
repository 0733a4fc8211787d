package dev.fumaz.unbox.exception;

/**
 * Base unchecked exception for container failures.
 */
public class UnboxException extends RuntimeException {

    public UnboxException(String message) {
        super(message);
    }

    public UnboxException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnboxException(Throwable cause) {
        super(cause);
    }
}
