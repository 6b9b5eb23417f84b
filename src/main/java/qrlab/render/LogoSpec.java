package qrlab.render;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * @param image    encoded logo bytes, any format ImageIO reads
 * @param size     side of the white backing square in pixels, empty for 20% of the QR size
 * @param position paste anchor
 */
public record LogoSpec(byte[] image, OptionalInt size, LogoPosition position) {

    public LogoSpec {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(position, "position");
    }

    public int sizeFor(int canvasSize) {
        return size.orElse((int) (canvasSize * 0.2));
    }
}
