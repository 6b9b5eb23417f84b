package qrlab.render;

import java.awt.image.BufferedImage;
import java.util.Base64;

/**
 * A finished QR image, both as pixels and as PNG bytes.
 */
public record RenderedQr(BufferedImage image, byte[] png, RenderMetadata metadata) {

    public static final String FORMAT = "PNG";

    public String base64() {
        return Base64.getEncoder().encodeToString(png);
    }

    public String dataUrl() {
        return "data:image/png;base64," + base64();
    }
}
