package dev.fumaz.unbox.exception;

/**
 * Signals that a factory, configuration function or invoked method failed with a checked exception.
 */
public class ProvisionException extends UnboxException {

    public ProvisionException(String message) {
        super(message);
    }

    public ProvisionException(String message, Throwable cause) {
        super(message, cause);
    }

    public ProvisionException(Throwable cause) {
        super(cause);
    }
}
