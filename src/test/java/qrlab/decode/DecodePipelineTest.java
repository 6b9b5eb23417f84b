package qrlab.decode;

import org.junit.jupiter.api.Test;
import qrlab.TestImages;
import qrlab.decode.engine.BarcodeEngine;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class DecodePipelineTest {

    private static final String WIFI = "WIFI:S:MyNetwork;T:WPA;P:secret123;H:false;;";

    private final List<EngineKind> calls = new ArrayList<>();

    private BarcodeEngine fake(EngineKind kind, Function<BufferedImage, List<DecodedSymbol>> body) {
        return new BarcodeEngine() {
            @Override
            public List<DecodedSymbol> decode(BufferedImage image) {
                calls.add(kind);
                return body.apply(image);
            }

            @Override
            public EngineKind kind() {
                return kind;
            }
        };
    }

    private DecodePipeline pipeline(BarcodeEngine... engines) {
        return new DecodePipeline(List.of(engines), null, new ImagePreprocessor(), 200, true);
    }

    private final BufferedImage blank = TestImages.solid(120, 120, Color.WHITE);

    @Test
    void testFirstEngineWithResultWins() {
        var pipeline = pipeline(
                fake(EngineKind.ZXING, image -> List.of()),
                fake(EngineKind.FINDER_PATTERN, image -> List.of(DecodedSymbol.qr("hello", null, EngineKind.FINDER_PATTERN))),
                fake(EngineKind.OPENCV, image -> fail("should not be reached")));

        var result = pipeline.decode(blank);

        assertEquals(DecodeStatus.FOUND, result.status());
        assertEquals(List.of("hello"), result.texts());
        assertEquals(EngineKind.FINDER_PATTERN, result.symbols().get(0).sourceEngine());
        assertEquals(List.of(EngineKind.ZXING, EngineKind.FINDER_PATTERN), calls);
    }

    @Test
    void testEnginesSeeGrayscale() {
        var pipeline = pipeline(fake(EngineKind.ZXING, image -> {
            assertEquals(BufferedImage.TYPE_BYTE_GRAY, image.getType());
            return List.of();
        }));
        pipeline.decode(TestImages.solid(50, 50, Color.RED));
        assertEquals(1, calls.size());
    }

    @Test
    void testNonQrSymbolsAreIgnored() {
        var pipeline = pipeline(fake(EngineKind.ZXING, image -> List.of(
                new DecodedSymbol("1234567890128", SymbolFormat.OTHER, Optional.empty(), EngineKind.ZXING))));

        var result = pipeline.decode(blank);

        assertEquals(DecodeStatus.NOT_FOUND, result.status());
        assertEquals(DecodeResult.NOT_FOUND_MESSAGE, result.errorMessage());
    }

    @Test
    void testEngineFaultBecomesFailedResult() {
        var pipeline = pipeline(fake(EngineKind.ZXING, image -> {
            throw new IllegalStateException("boom");
        }));

        var result = pipeline.decode(blank);

        assertEquals(DecodeStatus.FAILED, result.status());
        assertEquals("Error processing image: boom", result.errorMessage());
        assertTrue(result.symbols().isEmpty());
    }

    @Test
    void testUnavailableEngineIsSkipped() {
        var missing = new BarcodeEngine() {
            @Override
            public List<DecodedSymbol> decode(BufferedImage image) {
                throw new AssertionError("unavailable engine was called");
            }

            @Override
            public EngineKind kind() {
                return EngineKind.OPENCV;
            }

            @Override
            public boolean isAvailable() {
                return false;
            }
        };
        var pipeline = pipeline(missing, fake(EngineKind.ZXING, image -> List.of()));

        assertEquals(1, pipeline.engines().size());
        assertEquals(DecodeStatus.NOT_FOUND, pipeline.decode(blank).status());
    }

    @Test
    void testNullImageIsUnreadable() {
        assertEquals(DecodeStatus.UNREADABLE, pipeline().decode((BufferedImage) null).status());
    }

    @Test
    void testGarbageBytesAreUnreadable() {
        var result = DecodePipeline.create().decode("not an image at all".getBytes(StandardCharsets.UTF_8));
        assertEquals(DecodeStatus.UNREADABLE, result.status());
        assertEquals(DecodeResult.UNREADABLE_MESSAGE, result.errorMessage());
    }

    @Test
    void testBlankImageHasNoCode() {
        var result = DecodePipeline.create().decode(TestImages.png(TestImages.solid(300, 300, Color.WHITE)));
        assertEquals(DecodeStatus.NOT_FOUND, result.status());
        assertEquals(DecodeResult.NOT_FOUND_MESSAGE, result.errorMessage());
    }

    @Test
    void testRenderedCodeRoundTrip() {
        var result = DecodePipeline.create().decode(TestImages.qrPng(WIFI));

        assertTrue(result.isSuccess(), () -> "unexpected " + result);
        assertEquals(List.of(WIFI), result.texts());
        var box = result.symbols().get(0).boundingBox().orElseThrow();
        assertFalse(box.isEmpty());
        assertTrue(box.x() >= 0 && box.x() + box.width() <= 300, "box inside image: " + box);
    }

    @Test
    void testBase64DataUrl() {
        var encoded = Base64.getEncoder().encodeToString(TestImages.qrPng("https://example.com"));
        var result = DecodePipeline.create().decodeBase64("data:image/png;base64," + encoded);
        assertEquals(List.of("https://example.com"), result.texts());
    }

    @Test
    void testTwoCodesInOneImage() {
        var image = TestImages.sideBySide(TestImages.qrImage("first"), TestImages.qrImage("second"), 40);

        var result = DecodePipeline.create().decode(image);

        assertTrue(result.isSuccess());
        assertEquals(2, result.symbols().size());
        assertTrue(result.texts().containsAll(List.of("first", "second")));
    }

    @Test
    void testDecodeAllKeepsOrderAndIsolatesFailures() {
        var results = DecodePipeline.create().decodeAll(List.of(
                TestImages.qrPng("one"),
                new byte[]{1, 2, 3},
                TestImages.qrPng("three")));

        assertEquals(3, results.size());
        assertEquals(List.of("one"), results.get(0).texts());
        assertEquals(DecodeStatus.UNREADABLE, results.get(1).status());
        assertEquals(List.of("three"), results.get(2).texts());
    }

    @Test
    void testToSourceCoordinatesScalesBoxes() {
        var symbols = List.of(DecodedSymbol.qr("x", new BoundingBox(100, 100, 200, 200), EngineKind.OPENCV));

        var mapped = DecodePipeline.toSourceCoordinates(symbols, 0.5, 160, 160);

        assertEquals(new BoundingBox(50, 50, 100, 100), mapped.get(0).boundingBox().orElseThrow());
    }
}
