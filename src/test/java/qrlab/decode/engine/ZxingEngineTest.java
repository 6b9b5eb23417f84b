package qrlab.decode.engine;

import com.google.zxing.ResultPoint;
import org.junit.jupiter.api.Test;
import qrlab.TestImages;
import qrlab.decode.BoundingBox;
import qrlab.decode.EngineKind;
import qrlab.decode.SymbolFormat;

import java.awt.Color;

import static org.junit.jupiter.api.Assertions.*;

class ZxingEngineTest {

    private final ZxingEngine engine = new ZxingEngine();

    @Test
    void testDecodesRenderedCode() {
        var symbols = engine.decode(TestImages.qrImage("tel:+15551234567"));

        assertEquals(1, symbols.size());
        var symbol = symbols.get(0);
        assertEquals("tel:+15551234567", symbol.text());
        assertEquals(SymbolFormat.QR, symbol.format());
        assertEquals(EngineKind.ZXING, symbol.sourceEngine());
        assertTrue(symbol.boundingBox().isPresent());
    }

    @Test
    void testNothingOnBlankImage() {
        assertTrue(engine.decode(TestImages.solid(200, 200, Color.WHITE)).isEmpty());
    }

    @Test
    void testBoundingBox_plainPointsNotGrown() {
        ResultPoint[] points = {new ResultPoint(20, 80), null, new ResultPoint(20, 20), new ResultPoint(80, 20)};
        assertEquals(new BoundingBox(20, 20, 60, 60), ZxingEngine.boundingBox(points));
    }

    @Test
    void testBoundingBox_reachesSymbolEdge() {
        var symbols = engine.decode(TestImages.qrImage("edge"));
        var box = symbols.get(0).boundingBox().orElseThrow();
        // 300px, 4 module quiet zone: the symbol starts well inside the image
        assertTrue(box.x() > 0 && box.y() > 0, "box " + box);
        assertTrue(box.width() > 150, "box covers the whole symbol, not just finder centres: " + box);
    }

    @Test
    void testBoundingBox_noPoints() {
        assertNull(ZxingEngine.boundingBox(null));
        assertNull(ZxingEngine.boundingBox(new ResultPoint[]{null}));
    }
}
