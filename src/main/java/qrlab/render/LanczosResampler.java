package qrlab.render;

import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import qrlab.decode.MatConversions;
import qrlab.decode.OpenCvLoader;

import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * High quality resize. Lanczos through OpenCV when its natives are loaded, Java2D bicubic otherwise.
 * The result is always {@link BufferedImage#TYPE_INT_ARGB}.
 */
public final class LanczosResampler {

    private LanczosResampler() {
    }

    public static BufferedImage resize(BufferedImage src, int width, int height) {
        if (src.getWidth() == width && src.getHeight() == height) {
            return toArgb(src);
        }
        if (OpenCvLoader.isAvailable()) {
            var out = new Mat();
            Imgproc.resize(MatConversions.toAbgrMat(src), out, new Size(width, height), 0, 0, Imgproc.INTER_LANCZOS4);
            return toArgb(MatConversions.toBufferedImage(out));
        }
        var out = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        var g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(src, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    static BufferedImage toArgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_ARGB) {
            return src;
        }
        var out = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_ARGB);
        var g = out.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
