package qrlab.decode.engine;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.objdetect.QRCodeDetector;
import qrlab.decode.BoundingBox;
import qrlab.decode.DecodedSymbol;
import qrlab.decode.EngineKind;
import qrlab.decode.MatConversions;
import qrlab.decode.OpenCvLoader;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.List;

/**
 * OpenCV's built-in QR detector. Used on the preprocessed images of the decode cascade.
 */
public class OpenCvDetectorEngine implements BarcodeEngine {

    @Override
    public List<DecodedSymbol> decode(BufferedImage image) {
        var src = image.getType() == BufferedImage.TYPE_BYTE_GRAY
                ? grayMat(image)
                : MatConversions.toBgrMat(image);
        var points = new Mat();
        var text = new QRCodeDetector().detectAndDecode(src, points);
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        var box = corners(points);
        if (box != null) {
            box = box.clampTo(image.getWidth(), image.getHeight());
        }
        return List.of(DecodedSymbol.qr(text, box, EngineKind.OPENCV));
    }

    private static Mat grayMat(BufferedImage gray) {
        var mat = new Mat(gray.getHeight(), gray.getWidth(), CvType.CV_8UC1);
        mat.put(0, 0, ((DataBufferByte) gray.getRaster().getDataBuffer()).getData());
        return mat;
    }

    /** The detector reports the four symbol corners as 32-bit float pairs. */
    static BoundingBox corners(Mat points) {
        if (points.empty() || CvType.depth(points.type()) != CvType.CV_32F) {
            return null;
        }
        var buffer = new float[(int) points.total() * points.channels()];
        points.get(0, 0, buffer);
        int count = buffer.length / 2;
        if (count == 0) {
            return null;
        }
        var xs = new float[count];
        var ys = new float[count];
        for (int i = 0; i < count; i++) {
            xs[i] = buffer[2 * i];
            ys[i] = buffer[2 * i + 1];
        }
        return BoundingBox.enclosing(xs, ys);
    }

    @Override
    public EngineKind kind() {
        return EngineKind.OPENCV;
    }

    @Override
    public boolean isAvailable() {
        return OpenCvLoader.isAvailable();
    }
}
