package qrlab.decode.engine;

import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.ReaderException;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.qrcode.QRCodeReader;

import java.awt.image.BufferedImage;
import java.util.EnumMap;
import java.util.Map;

/**
 * Single-symbol ZXing read of a straightened clip.
 */
public class ZxingClipDecoder implements ClipDecoder {

    private static final Map<DecodeHintType, Object> HINTS = new EnumMap<>(DecodeHintType.class);

    static {
        HINTS.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
    }

    @Override
    public String decode(BufferedImage clip) {
        var luminanceSource = new BufferedImageLuminanceSource(clip);
        var binaryBitmap = new BinaryBitmap(new HybridBinarizer(luminanceSource));
        try {
            return new QRCodeReader().decode(binaryBitmap, HINTS).getText();
        } catch (ReaderException e) {
            return null;
        }
    }
}
