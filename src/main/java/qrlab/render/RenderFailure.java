package qrlab.render;

public record RenderFailure(Reason reason, String message) {

    public enum Reason {
        /** empty or over-length data */
        INVALID_INPUT,
        /** data does not fit at the chosen error correction level */
        CAPACITY_EXCEEDED,
        /** logo or background could not be decoded */
        IMAGE_ERROR,
        INTERNAL
    }
}
