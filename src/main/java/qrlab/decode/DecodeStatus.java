package qrlab.decode;

public enum DecodeStatus {
    FOUND,
    /** the image was read but holds no decodable symbol */
    NOT_FOUND,
    /** the bytes are not an image, no engine ran */
    UNREADABLE,
    /** an engine failed unexpectedly */
    FAILED
}
