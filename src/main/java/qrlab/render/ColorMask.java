package qrlab.render;

import java.awt.Color;

/**
 * Colour of a dark-module pixel at {@code (x, y)} on a {@code width x height} canvas.
 * Light pixels always get the back colour.
 */
@FunctionalInterface
public interface ColorMask {

    /** gradient end colour is the fill colour darkened by this factor */
    double DARKEN_FACTOR = 0.3;

    Color colorAt(int x, int y, int width, int height);

    static ColorMask of(ColorMaskType type, Color fill) {
        var far = darken(fill, DARKEN_FACTOR);
        switch (type) {
            case RADIAL_GRADIENT:
                return (x, y, width, height) -> {
                    double half = width / 2.0;
                    double distance = Math.hypot(x - half, y - half) / (Math.sqrt(2) * half);
                    return interpolate(fill, far, distance);
                };
            case SQUARE_GRADIENT:
                return (x, y, width, height) -> {
                    double half = width / 2.0;
                    return interpolate(fill, far, Math.max(Math.abs(x - half), Math.abs(y - half)) / half);
                };
            case HORIZONTAL_GRADIENT:
                return (x, y, width, height) -> interpolate(fill, far, (double) x / width);
            case VERTICAL_GRADIENT:
                return (x, y, width, height) -> interpolate(fill, far, (double) y / height);
            case SOLID:
            default:
                return (x, y, width, height) -> fill;
        }
    }

    /** each channel multiplied by {@code 1 - factor}, rounded down */
    static Color darken(Color color, double factor) {
        return new Color(
                (int) (color.getRed() * (1 - factor)),
                (int) (color.getGreen() * (1 - factor)),
                (int) (color.getBlue() * (1 - factor)));
    }

    static Color interpolate(Color from, Color to, double t) {
        double clamped = Math.max(0, Math.min(1, t));
        return new Color(
                (int) (from.getRed() + (to.getRed() - from.getRed()) * clamped),
                (int) (from.getGreen() + (to.getGreen() - from.getGreen()) * clamped),
                (int) (from.getBlue() + (to.getBlue() - from.getBlue()) * clamped));
    }
}
