package qrlab.render;

/**
 * What was applied to a rendered image.
 *
 * @param width   final width including decorations
 * @param height  final height including decorations
 * @param version QR symbol version picked by the encoder, 1 to 40
 */
public record RenderMetadata(
        String data,
        ErrorCorrection errorCorrection,
        ModuleDrawerType moduleDrawer,
        ColorMaskType colorMask,
        boolean hasLogo,
        boolean hasBackground,
        boolean hasDecorations,
        int width,
        int height,
        int version
) {
}
