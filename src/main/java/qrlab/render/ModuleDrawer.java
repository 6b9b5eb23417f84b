package qrlab.render;

import java.awt.Shape;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Rectangle2D;
import java.awt.geom.RoundRectangle2D;

/**
 * Outline of one dark module whose cell starts at {@code (x, y)} and is {@code size} pixels wide.
 */
@FunctionalInterface
public interface ModuleDrawer {

    /** share of the cell a gapped square covers */
    double GAP_RATIO = 0.8;

    Shape shape(double x, double y, double size);

    /**
     * @param cornerRadius 0 to 10, rounded corners use a radius of {@code cornerRadius / 10} of half a module
     */
    static ModuleDrawer of(ModuleDrawerType type, int cornerRadius) {
        switch (type) {
            case ROUNDED:
                double ratio = cornerRadius / 10.0;
                return (x, y, size) -> new RoundRectangle2D.Double(x, y, size, size, size * ratio, size * ratio);
            case CIRCLE:
                return (x, y, size) -> new Ellipse2D.Double(x, y, size, size);
            case GAPPED_SQUARE:
                return (x, y, size) -> {
                    double inset = size * (1 - GAP_RATIO) / 2;
                    return new Rectangle2D.Double(x + inset, y + inset, size * GAP_RATIO, size * GAP_RATIO);
                };
            case SQUARE:
            default:
                return (x, y, size) -> new Rectangle2D.Double(x, y, size, size);
        }
    }
}
