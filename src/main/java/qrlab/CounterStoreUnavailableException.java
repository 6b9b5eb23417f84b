package qrlab;

/**
 * The rate-limit counter store could not be reached.
 */
public class CounterStoreUnavailableException extends QrLabException {

    public CounterStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
