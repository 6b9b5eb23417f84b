package qrlab.render;

import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.qrcode.encoder.ByteMatrix;
import com.google.zxing.qrcode.encoder.Encoder;
import com.google.zxing.qrcode.encoder.QRCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qrlab.CapacityExceededException;
import qrlab.ImageReadException;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Font;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;

/**
 * Paints a styled QR code from a validated request.
 *
 * <p>The symbol is first drawn at 10 pixels per module with a quiet zone of {@code border} modules, then
 * resampled to the requested size. Logo, background and decorations are applied on the resized canvas.
 * Thread safe, holds no state.
 */
public class QrRenderEngine {
    private static final Logger log = LoggerFactory.getLogger(QrRenderEngine.class);

    static final int MODULE_PIXELS = 10;
    static final int CAPTION_MARGIN = 10;

    /**
     * @throws CapacityExceededException when the data does not fit in version 40 at the requested level
     * @throws ImageReadException        when the logo or background bytes cannot be decoded
     */
    public RenderedQr render(QrRenderRequest request) {
        var code = encode(request.data(), request.errorCorrection());
        var canvas = paint(code.getMatrix(), request);
        canvas = LanczosResampler.resize(canvas, request.size(), request.size());

        if (request.logo().isPresent()) {
            addLogo(canvas, request.logo().get());
        }
        if (request.background().isPresent()) {
            canvas = addBackground(canvas, request.background().get());
        }
        if (request.decorations().isPresent()) {
            canvas = decorate(canvas, request.decorations().get());
        }

        var metadata = new RenderMetadata(
                request.data(),
                request.errorCorrection(),
                request.moduleDrawer(),
                request.colorMask(),
                request.logo().isPresent(),
                request.background().isPresent(),
                request.decorations().isPresent(),
                canvas.getWidth(),
                canvas.getHeight(),
                code.getVersion().getVersionNumber());
        log.debug("rendered version {} at {}x{}, drawer {}, mask {}", metadata.version(), canvas.getWidth(),
                canvas.getHeight(), request.moduleDrawer().wireName(), request.colorMask().wireName());
        return new RenderedQr(canvas, toPng(canvas), metadata);
    }

    static QRCode encode(String data, ErrorCorrection errorCorrection) {
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        // always write the ECI marker, readers guess the charset of unmarked byte segments
        hints.put(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
        try {
            return Encoder.encode(data, errorCorrection.level(), hints);
        } catch (WriterException e) {
            throw new CapacityExceededException(
                    "Data does not fit in a QR code at error correction level " + errorCorrection.wireName(), e);
        }
    }

    private BufferedImage paint(ByteMatrix matrix, QrRenderRequest request) {
        int modules = matrix.getWidth();
        int border = request.border();
        int side = (modules + 2 * border) * MODULE_PIXELS;

        // coverage of each pixel by dark modules, 0 is fully light
        var coverage = new BufferedImage(side, side, BufferedImage.TYPE_BYTE_GRAY);
        var drawer = ModuleDrawer.of(request.moduleDrawer(), request.cornerRadius());
        var g = coverage.createGraphics();
        try {
            if (request.moduleDrawer() != ModuleDrawerType.SQUARE) {
                g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            }
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, side, side);
            g.setColor(Color.WHITE);
            for (int y = 0; y < modules; y++) {
                for (int x = 0; x < modules; x++) {
                    if (matrix.get(x, y) == 1) {
                        g.fill(drawer.shape((x + border) * MODULE_PIXELS, (y + border) * MODULE_PIXELS, MODULE_PIXELS));
                    }
                }
            }
        } finally {
            g.dispose();
        }

        var mask = ColorMask.of(request.colorMask(), Color.decode(request.fillColor()));
        var back = Color.decode(request.backColor());
        var raster = coverage.getRaster();
        var out = new BufferedImage(side, side, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < side; y++) {
            for (int x = 0; x < side; x++) {
                int covered = raster.getSample(x, y, 0);
                if (covered == 0) {
                    out.setRGB(x, y, back.getRGB());
                } else {
                    out.setRGB(x, y, blend(back, mask.colorAt(x, y, side, side), covered / 255.0));
                }
            }
        }
        return out;
    }

    private static int blend(Color back, Color front, double alpha) {
        int r = (int) Math.round(back.getRed() + (front.getRed() - back.getRed()) * alpha);
        int g = (int) Math.round(back.getGreen() + (front.getGreen() - back.getGreen()) * alpha);
        int b = (int) Math.round(back.getBlue() + (front.getBlue() - back.getBlue()) * alpha);
        return 0xFF000000 | (r << 16) | (g << 8) | b;
    }

    /**
     * Shrinks the logo to fit a {@code logoSize} square, never enlarging it, centres it on an opaque white
     * square of that size and pastes the square onto the canvas.
     */
    private void addLogo(BufferedImage canvas, LogoSpec spec) {
        var logo = readImage(spec.image(), "logo");
        int box = spec.sizeFor(canvas.getWidth());
        double scale = Math.min(1.0, Math.min((double) box / logo.getWidth(), (double) box / logo.getHeight()));
        int width = Math.max(1, (int) Math.round(logo.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(logo.getHeight() * scale));
        var fitted = LanczosResampler.resize(logo, width, height);

        var backing = new BufferedImage(box, box, BufferedImage.TYPE_INT_ARGB);
        var g = backing.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, box, box);
            g.drawImage(fitted, (box - width) / 2, (box - height) / 2, null);
        } finally {
            g.dispose();
        }

        var origin = spec.position().origin(canvas.getWidth(), canvas.getHeight(), box, box);
        g = canvas.createGraphics();
        try {
            g.drawImage(backing, origin.x, origin.y, null);
        } finally {
            g.dispose();
        }
        log.debug("logo {}x{} in {}px box at {},{}", width, height, box, origin.x, origin.y);
    }

    private BufferedImage addBackground(BufferedImage canvas, byte[] encoded) {
        var background = LanczosResampler.resize(readImage(encoded, "background"), canvas.getWidth(), canvas.getHeight());
        var g = background.createGraphics();
        try {
            g.drawImage(canvas, 0, 0, null);
        } finally {
            g.dispose();
        }
        return background;
    }

    private BufferedImage decorate(BufferedImage canvas, Decorations decorations) {
        var out = canvas;
        if (decorations.border().isPresent()) {
            out = addBorder(out, decorations.border().get());
        }
        if (decorations.shadow().isPresent()) {
            out = addShadow(out, decorations.shadow().get());
        }
        if (decorations.caption().isPresent()) {
            addCaption(out, decorations.caption().get());
        }
        return out;
    }

    private BufferedImage addBorder(BufferedImage src, BorderStyle border) {
        int width = border.width();
        var out = new BufferedImage(src.getWidth() + 2 * width, src.getHeight() + 2 * width, BufferedImage.TYPE_INT_ARGB);
        var g = out.createGraphics();
        try {
            g.setColor(Color.decode(border.color()));
            g.fillRect(0, 0, out.getWidth(), out.getHeight());
            g.drawImage(src, width, width, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private BufferedImage addShadow(BufferedImage src, ShadowStyle shadow) {
        int offset = shadow.offset();
        var out = new BufferedImage(src.getWidth() + offset, src.getHeight() + offset, BufferedImage.TYPE_INT_ARGB);
        var color = Color.decode(shadow.color());
        var g = out.createGraphics();
        try {
            g.setColor(new Color(color.getRed(), color.getGreen(), color.getBlue(),
                    (int) Math.round(shadow.opacity() * 255)));
            g.fillRect(offset, offset, src.getWidth(), src.getHeight());
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private void addCaption(BufferedImage canvas, CaptionStyle caption) {
        var g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, caption.size()));
            g.setColor(Color.decode(caption.color()));
            var metrics = g.getFontMetrics();
            int textWidth = metrics.stringWidth(caption.text());
            int textHeight = metrics.getAscent() + metrics.getDescent();
            int x = (canvas.getWidth() - textWidth) / 2;
            int top;
            switch (caption.position()) {
                case TOP:
                    top = CAPTION_MARGIN;
                    break;
                case CENTER:
                    top = (canvas.getHeight() - textHeight) / 2;
                    break;
                case BOTTOM:
                default:
                    top = canvas.getHeight() - textHeight - CAPTION_MARGIN;
                    break;
            }
            g.drawString(caption.text(), x, top + metrics.getAscent());
        } finally {
            g.dispose();
        }
    }

    private static BufferedImage readImage(byte[] encoded, String what) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(encoded));
        } catch (IOException | RuntimeException e) {
            throw new ImageReadException("Could not read " + what + " image", e);
        }
        if (image == null) {
            throw new ImageReadException("Could not read " + what + " image");
        }
        return image;
    }

    static byte[] toPng(BufferedImage image) {
        var out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, RenderedQr.FORMAT, out);
        } catch (IOException e) {
            throw new UncheckedIOException("encode PNG", e);
        }
        return out.toByteArray();
    }
}
