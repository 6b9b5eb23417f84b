package qrlab.decode;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Copies pixels between {@link BufferedImage} and OpenCV {@link Mat} without an encode round trip.
 * Callers must check {@link OpenCvLoader#isAvailable()} first.
 */
public final class MatConversions {

    private MatConversions() {
    }

    /** 3-channel BGR Mat. Transparent pixels are flattened onto white. */
    public static Mat toBgrMat(BufferedImage image) {
        var bgr = image.getType() == BufferedImage.TYPE_3BYTE_BGR ? image : redraw(image, BufferedImage.TYPE_3BYTE_BGR);
        var mat = new Mat(bgr.getHeight(), bgr.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData());
        return mat;
    }

    /** 4-channel Mat in the byte order of {@link BufferedImage#TYPE_4BYTE_ABGR}. */
    public static Mat toAbgrMat(BufferedImage image) {
        var abgr = image.getType() == BufferedImage.TYPE_4BYTE_ABGR ? image : copy(image, BufferedImage.TYPE_4BYTE_ABGR);
        var mat = new Mat(abgr.getHeight(), abgr.getWidth(), CvType.CV_8UC4);
        mat.put(0, 0, ((DataBufferByte) abgr.getRaster().getDataBuffer()).getData());
        return mat;
    }

    /**
     * Inverse of the {@code to*Mat} methods: 1 channel gives a gray image, 3 channels BGR, 4 channels ABGR.
     */
    public static BufferedImage toBufferedImage(Mat mat) {
        int type;
        switch (mat.channels()) {
            case 1:
                type = BufferedImage.TYPE_BYTE_GRAY;
                break;
            case 3:
                type = BufferedImage.TYPE_3BYTE_BGR;
                break;
            case 4:
                type = BufferedImage.TYPE_4BYTE_ABGR;
                break;
            default:
                throw new IllegalArgumentException("unsupported channel count " + mat.channels());
        }
        var image = new BufferedImage(mat.cols(), mat.rows(), type);
        mat.get(0, 0, ((DataBufferByte) image.getRaster().getDataBuffer()).getData());
        return image;
    }

    private static BufferedImage redraw(BufferedImage src, int type) {
        var out = new BufferedImage(src.getWidth(), src.getHeight(), type);
        var g = out.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, src.getWidth(), src.getHeight());
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static BufferedImage copy(BufferedImage src, int type) {
        var out = new BufferedImage(src.getWidth(), src.getHeight(), type);
        var g = out.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
