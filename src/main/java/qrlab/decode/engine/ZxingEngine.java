package qrlab.decode.engine;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.LuminanceSource;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.ResultPoint;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.GlobalHistogramBinarizer;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.multi.qrcode.QRCodeMultiReader;
import com.google.zxing.qrcode.detector.FinderPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qrlab.decode.BoundingBox;
import qrlab.decode.DecodedSymbol;
import qrlab.decode.EngineKind;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Primary engine. Finds every QR symbol ZXing can see and reports where it is.
 *
 * <p>The hybrid binarizer handles uneven lighting; the global histogram binarizer is tried second because it
 * copes better with low-contrast prints.
 */
public class ZxingEngine implements BarcodeEngine {
    private static final Logger log = LoggerFactory.getLogger(ZxingEngine.class);

    /** finder pattern centre to symbol edge, in modules */
    private static final double FINDER_HALF_WIDTH = 3.5;

    private static final Map<DecodeHintType, Object> HINTS = new EnumMap<>(DecodeHintType.class);

    static {
        HINTS.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
        HINTS.put(DecodeHintType.POSSIBLE_FORMATS, List.of(BarcodeFormat.QR_CODE));
    }

    @Override
    public List<DecodedSymbol> decode(BufferedImage image) {
        LuminanceSource source = new BufferedImageLuminanceSource(image);
        var bitmaps = List.of(
                new BinaryBitmap(new HybridBinarizer(source)),
                new BinaryBitmap(new GlobalHistogramBinarizer(source))
        );
        for (var bitmap : bitmaps) {
            var symbols = decodeBitmap(bitmap);
            if (!symbols.isEmpty()) {
                return symbols;
            }
        }
        return List.of();
    }

    private List<DecodedSymbol> decodeBitmap(BinaryBitmap bitmap) {
        Result[] results;
        try {
            results = new QRCodeMultiReader().decodeMultiple(bitmap, HINTS);
        } catch (NotFoundException e) {
            return List.of();
        }
        var symbols = new ArrayList<DecodedSymbol>(results.length);
        for (var result : results) {
            if (result.getBarcodeFormat() != BarcodeFormat.QR_CODE) {
                log.debug("skip {} symbol", result.getBarcodeFormat());
                continue;
            }
            var box = boundingBox(result.getResultPoints());
            if (box != null) {
                box = box.clampTo(bitmap.getWidth(), bitmap.getHeight());
            }
            symbols.add(DecodedSymbol.qr(result.getText(), box, EngineKind.ZXING));
        }
        return symbols;
    }

    /**
     * ZXing reports finder pattern centres (plus the alignment pattern when present), so the enclosing box is
     * widened by half a finder pattern to reach the symbol edge.
     */
    static BoundingBox boundingBox(ResultPoint[] points) {
        if (points == null) {
            return null;
        }
        var xs = new float[points.length];
        var ys = new float[points.length];
        int count = 0;
        float moduleSize = 0;
        for (var point : points) {
            if (point == null) {
                continue;
            }
            xs[count] = point.getX();
            ys[count] = point.getY();
            count++;
            if (point instanceof FinderPattern) {
                moduleSize = Math.max(moduleSize, ((FinderPattern) point).getEstimatedModuleSize());
            }
        }
        if (count == 0) {
            return null;
        }
        var box = BoundingBox.enclosing(Arrays.copyOf(xs, count), Arrays.copyOf(ys, count));
        return box.grow((int) Math.ceil(moduleSize * FINDER_HALF_WIDTH));
    }

    @Override
    public EngineKind kind() {
        return EngineKind.ZXING;
    }
}
