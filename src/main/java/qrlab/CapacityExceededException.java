package qrlab;

/**
 * Data does not fit in any QR version at the requested error-correction level.
 */
public class CapacityExceededException extends QrLabException {

    public CapacityExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
