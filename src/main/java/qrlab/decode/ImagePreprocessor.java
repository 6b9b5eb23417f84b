package qrlab.decode;

import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Image transforms used by the decode cascade. Every method returns a new Mat and leaves its input untouched.
 *
 * <p>When a work path is given and DEBUG is enabled for this class, each intermediate image is written there
 * so a failing scan can be inspected step by step.
 */
public class ImagePreprocessor {
    private static final Logger log = LoggerFactory.getLogger(ImagePreprocessor.class);

    private final Path workPath;

    /**
     * @param workPath directory for debug images, may be null
     */
    public ImagePreprocessor(Path workPath) {
        this.workPath = workPath;
        if (workPath != null) {
            try {
                Files.createDirectories(workPath);
            } catch (IOException e) {
                throw new IllegalStateException("create workPath " + workPath, e);
            }
        }
    }

    public ImagePreprocessor() {
        this(null);
    }

    /**
     * Grayscale copy made with Java2D, usable without OpenCV. Transparent areas become white so a logo
     * on a transparent PNG does not turn into a black blob.
     */
    public static BufferedImage toGrayImage(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            return image;
        }
        var gray = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        var g = gray.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return gray;
    }

    public Mat grayscale(Mat src) {
        var gray = new Mat();
        if (src.channels() == 1) {
            src.copyTo(gray);
        } else if (src.channels() == 4) {
            Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGRA2GRAY);
        } else {
            Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGR2GRAY);
        }
        dump("grayscale", gray);
        return gray;
    }

    /**
     * Upscales with cubic interpolation until both sides are at least {@code minDimension}. Larger images
     * are returned as a copy.
     */
    public Mat upscaleToMinDimension(Mat src, int minDimension) {
        var out = new Mat();
        int height = src.rows();
        int width = src.cols();
        if (height < minDimension || width < minDimension) {
            double scale = Math.max((double) minDimension / height, (double) minDimension / width);
            Imgproc.resize(src, out, new Size((int) (width * scale), (int) (height * scale)), 0, 0, Imgproc.INTER_CUBIC);
            log.debug("upscaled {}x{} to {}x{}", width, height, out.cols(), out.rows());
        } else {
            src.copyTo(out);
        }
        dump("upscale", out);
        return out;
    }

    /** Binary threshold with the level picked by Otsu's method. Expects a single channel image. */
    public Mat otsuThreshold(Mat gray) {
        var out = new Mat();
        Imgproc.threshold(gray, out, 0, 255, Imgproc.THRESH_BINARY + Imgproc.THRESH_OTSU);
        dump("otsu", out);
        return out;
    }

    public Mat adaptiveThreshold(Mat gray, int blockSize, double c) {
        var out = new Mat();
        Imgproc.adaptiveThreshold(gray, out, 255, Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C, Imgproc.THRESH_BINARY, blockSize, c);
        dump("adaptive", out);
        return out;
    }

    /** Closing with a square kernel fills small gaps between dark modules. */
    public Mat morphologyClose(Mat gray, int kernelSize) {
        var kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(kernelSize, kernelSize));
        var out = new Mat();
        Imgproc.morphologyEx(gray, out, Imgproc.MORPH_CLOSE, kernel);
        dump("close", out);
        return out;
    }

    /**
     * Blacks out a centred disc, radius a sixth of the smaller side, after upscaling to {@code minDimension}.
     * Helps detectors that get confused by a logo pasted over the middle of the symbol.
     */
    public Mat maskCenter(Mat gray, int minDimension) {
        var out = upscaleToMinDimension(gray, minDimension);
        var center = new Point(out.cols() / 2.0, out.rows() / 2.0);
        int radius = Math.min(out.cols(), out.rows()) / 6;
        Imgproc.circle(out, center, radius, new Scalar(0), -1);
        dump("center-mask", out);
        return out;
    }

    /**
     * Edge map for finder pattern search: blur, optional fixed binary threshold, Canny.
     */
    public Mat finderEdges(Mat gray, boolean threshold) {
        var out = new Mat();
        Imgproc.GaussianBlur(gray, out, new Size(5, 5), 0);
        dump("GaussianBlur", out);
        if (threshold) {
            Imgproc.threshold(out, out, 100, 255, Imgproc.THRESH_BINARY);
            dump("threshold", out);
        }
        Imgproc.Canny(out, out, 112, 255);
        dump("Canny", out);
        return out;
    }

    public void dump(String name, Mat mat) {
        if (workPath != null && log.isDebugEnabled()) {
            Imgcodecs.imwrite(workPath.resolve(name + ".png").toString(), mat);
        }
    }

    public Path workPath() {
        return workPath;
    }
}
