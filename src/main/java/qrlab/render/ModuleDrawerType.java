package qrlab.render;

/**
 * Shape painted for each dark module.
 */
public enum ModuleDrawerType implements StyleOption {
    SQUARE("square"),
    ROUNDED("rounded"),
    CIRCLE("circle"),
    GAPPED_SQUARE("gapped_square");

    private final String wireName;

    ModuleDrawerType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
