package qrlab.render;

/**
 * Solid frame around the image. The canvas grows by {@code width} on every side.
 */
public record BorderStyle(int width, String color) {
}
