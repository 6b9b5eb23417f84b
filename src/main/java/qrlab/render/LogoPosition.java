package qrlab.render;

import java.awt.Point;

/**
 * Where a logo is pasted. Corner positions anchor at the quarter lines of the canvas, not its edges, so the
 * logo stays clear of the finder patterns.
 */
public enum LogoPosition implements StyleOption {
    CENTER("center"),
    TOP_LEFT("top-left"),
    TOP_RIGHT("top-right"),
    BOTTOM_LEFT("bottom-left"),
    BOTTOM_RIGHT("bottom-right");

    private final String wireName;

    LogoPosition(String wireName) {
        this.wireName = wireName;
    }

    @Override
    public String wireName() {
        return wireName;
    }

    /**
     * Top-left corner of a {@code logoWidth x logoHeight} logo on a {@code width x height} canvas.
     */
    public Point origin(int width, int height, int logoWidth, int logoHeight) {
        switch (this) {
            case TOP_LEFT:
                return new Point(width / 4, height / 4);
            case TOP_RIGHT:
                return new Point(width * 3 / 4 - logoWidth, height / 4);
            case BOTTOM_LEFT:
                return new Point(width / 4, height * 3 / 4 - logoHeight);
            case BOTTOM_RIGHT:
                return new Point(width * 3 / 4 - logoWidth, height * 3 / 4 - logoHeight);
            case CENTER:
            default:
                return new Point((width - logoWidth) / 2, (height - logoHeight) / 2);
        }
    }
}
