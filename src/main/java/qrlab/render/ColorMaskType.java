package qrlab.render;

/**
 * How dark modules are coloured.
 */
public enum ColorMaskType implements StyleOption {
    SOLID("solid"),
    RADIAL_GRADIENT("radial_gradient"),
    SQUARE_GRADIENT("square_gradient"),
    HORIZONTAL_GRADIENT("horizontal_gradient"),
    VERTICAL_GRADIENT("vertical_gradient");

    private final String wireName;

    ColorMaskType(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }
}
