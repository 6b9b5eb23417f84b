package qrlab.render;

/**
 * Vertical anchor of a caption.
 */
public enum TextPosition implements StyleOption {
    TOP("top"),
    CENTER("center"),
    BOTTOM("bottom");

    private final String wireName;

    TextPosition(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
