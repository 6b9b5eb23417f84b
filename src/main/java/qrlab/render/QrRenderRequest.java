package qrlab.render;

import java.util.Objects;
import java.util.Optional;

/**
 * Fully validated render parameters. Built by {@link QrStyleValidator}, so every value is already in range.
 *
 * @param data            payload, 1 to 2953 characters
 * @param size            output side in pixels before decorations, 100 to 2000
 * @param border          quiet zone in modules, 0 to 20
 * @param fillColor       {@code #RRGGBB}
 * @param backColor       {@code #RRGGBB}
 * @param cornerRadius    0 to 10, only used by {@link ModuleDrawerType#ROUNDED}
 * @param background      encoded image laid under the QR code
 */
public record QrRenderRequest(
        String data,
        int size,
        int border,
        ErrorCorrection errorCorrection,
        String fillColor,
        String backColor,
        ModuleDrawerType moduleDrawer,
        ColorMaskType colorMask,
        int cornerRadius,
        Optional<LogoSpec> logo,
        Optional<byte[]> background,
        Optional<Decorations> decorations
) {

    public QrRenderRequest {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(errorCorrection, "errorCorrection");
        Objects.requireNonNull(fillColor, "fillColor");
        Objects.requireNonNull(backColor, "backColor");
        Objects.requireNonNull(moduleDrawer, "moduleDrawer");
        Objects.requireNonNull(colorMask, "colorMask");
        Objects.requireNonNull(logo, "logo");
        Objects.requireNonNull(background, "background");
        Objects.requireNonNull(decorations, "decorations");
    }

    /** Plain black-on-white square modules with the usual defaults. */
    public static QrRenderRequest basic(String data) {
        return new QrRenderRequest(data, QrStyleValidator.DEFAULT_SIZE, QrStyleValidator.DEFAULT_BORDER, ErrorCorrection.M,
                QrStyleValidator.BLACK, QrStyleValidator.WHITE, ModuleDrawerType.SQUARE, ColorMaskType.SOLID, 0,
                Optional.empty(), Optional.empty(), Optional.empty());
    }
}
