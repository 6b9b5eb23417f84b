package qrlab;

/**
 * Input that cannot be repaired by defaulting, e.g. empty or over-length QR data.
 */
public class InvalidInputException extends QrLabException {

    public InvalidInputException(String message) {
        super(message);
    }
}
