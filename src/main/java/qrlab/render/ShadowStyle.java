package qrlab.render;

/**
 * Drop shadow offset down and right by {@code offset} pixels.
 *
 * @param opacity 0.1 to 1.0
 */
public record ShadowStyle(int offset, String color, double opacity) {
}
