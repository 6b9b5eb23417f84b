package qrlab;

/**
 * Image bytes that no registered reader understands.
 */
public class ImageReadException extends QrLabException {

    public ImageReadException(String message) {
        super(message);
    }

    public ImageReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
