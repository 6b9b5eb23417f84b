package qrlab;

/**
 * Base of every recoverable failure raised inside the library. Facades turn these into structured results.
 */
public abstract class QrLabException extends RuntimeException {

    protected QrLabException(String message) {
        super(message);
    }

    protected QrLabException(String message, Throwable cause) {
        super(message, cause);
    }
}
