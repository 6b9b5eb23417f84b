package qrlab.decode;

import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qrlab.ImageReadException;
import qrlab.config.QrLabConfig;
import qrlab.decode.engine.BarcodeEngine;
import qrlab.decode.engine.FinderPatternEngine;
import qrlab.decode.engine.OpenCvDetectorEngine;
import qrlab.decode.engine.ZxingClipDecoder;
import qrlab.decode.engine.ZxingEngine;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Decodes QR symbols with a fixed fallback chain: each engine in order on the grayscale image, then a cascade
 * of preprocessed variants fed to the cascade engine. The first step that yields a QR symbol wins.
 *
 * <p>Never throws for bad input. Unreadable bytes, empty scans and engine faults all come back as a
 * {@link DecodeResult}.
 */
public class DecodePipeline {
    private static final Logger log = LoggerFactory.getLogger(DecodePipeline.class);

    static final int CENTER_MASK_DIMENSION = 500;
    static final int ADAPTIVE_BLOCK_SIZE = 11;
    static final double ADAPTIVE_C = 2;
    static final int CLOSE_KERNEL = 3;

    private final List<BarcodeEngine> engines;
    private final BarcodeEngine cascadeEngine;
    private final ImagePreprocessor preprocessor;
    private final int minDimension;
    private final boolean extendedPasses;

    /**
     * @param engines        tried in order on the grayscale image, unavailable ones are dropped
     * @param cascadeEngine  engine for the preprocessed variants, null disables the cascade
     * @param preprocessor   Mat transforms for the cascade
     * @param minDimension   images smaller than this are upscaled before Otsu
     * @param extendedPasses also run adaptive threshold, morphology and centre mask
     */
    public DecodePipeline(List<BarcodeEngine> engines, BarcodeEngine cascadeEngine, ImagePreprocessor preprocessor,
                          int minDimension, boolean extendedPasses) {
        this.engines = engines.stream().filter(this::usable).collect(Collectors.toUnmodifiableList());
        this.cascadeEngine = cascadeEngine != null && usable(cascadeEngine) ? cascadeEngine : null;
        this.preprocessor = preprocessor;
        this.minDimension = minDimension;
        this.extendedPasses = extendedPasses;
    }

    /**
     * Default chain: ZXing, then the finder-pattern engine, then the cascade with OpenCV's detector when its
     * natives are loaded, ZXing otherwise.
     */
    public static DecodePipeline create(QrLabConfig config) {
        var preprocessor = new ImagePreprocessor(config.debugDirectory().orElse(null));
        var primary = new ZxingEngine();
        var fallback = new FinderPatternEngine(new ZxingClipDecoder(), preprocessor);
        var detector = new OpenCvDetectorEngine();
        BarcodeEngine cascade = detector.isAvailable() ? detector : primary;
        return new DecodePipeline(List.of(primary, fallback), cascade, preprocessor,
                config.minDecodeDimension(), config.extendedPasses());
    }

    public static DecodePipeline create() {
        return create(QrLabConfig.defaults());
    }

    private boolean usable(BarcodeEngine engine) {
        if (!engine.isAvailable()) {
            log.warn("decode engine {} unavailable, skipped", engine.kind());
            return false;
        }
        return true;
    }

    public DecodeResult decode(byte[] imageBytes) {
        BufferedImage image;
        try {
            image = ImageLoader.read(imageBytes);
        } catch (ImageReadException e) {
            log.info("unreadable image: {}", e.getCause() == null ? e.getMessage() : e.getCause().toString());
            return DecodeResult.unreadable();
        }
        return decode(image);
    }

    public DecodeResult decodeBase64(String encoded) {
        byte[] bytes;
        try {
            bytes = ImageLoader.decodeBase64(encoded);
        } catch (ImageReadException e) {
            log.info("invalid base64 payload");
            return DecodeResult.unreadable();
        }
        return decode(bytes);
    }

    /** One result per input, in input order. A bad image does not affect the others. */
    public List<DecodeResult> decodeAll(List<byte[]> images) {
        var results = new ArrayList<DecodeResult>(images.size());
        for (var bytes : images) {
            results.add(decode(bytes));
        }
        return results;
    }

    public DecodeResult decode(BufferedImage image) {
        if (image == null) {
            return DecodeResult.unreadable();
        }
        try {
            var gray = ImagePreprocessor.toGrayImage(image);
            for (var engine : engines) {
                var symbols = qrOnly(engine.decode(gray));
                if (!symbols.isEmpty()) {
                    log.info("{} found {} symbol(s)", engine.kind(), symbols.size());
                    return DecodeResult.found(symbols);
                }
                log.debug("{} found nothing", engine.kind());
            }
            if (cascadeEngine != null && OpenCvLoader.isAvailable()) {
                var symbols = cascade(image);
                if (!symbols.isEmpty()) {
                    return DecodeResult.found(symbols);
                }
            }
            log.info("no QR symbol in {}x{} image", image.getWidth(), image.getHeight());
            return DecodeResult.notFound();
        } catch (RuntimeException e) {
            log.error("decode failed", e);
            return DecodeResult.failed(String.valueOf(e.getMessage()));
        }
    }

    private List<DecodedSymbol> cascade(BufferedImage image) {
        var color = MatConversions.toBgrMat(image);
        // computed once, shared by the later passes
        var gray = new Mat[1];
        Supplier<Mat> grayscale = () -> {
            if (gray[0] == null) {
                gray[0] = preprocessor.grayscale(color);
            }
            return gray[0];
        };

        var passes = new ArrayList<Pass>();
        passes.add(new Pass("direct", () -> color));
        passes.add(new Pass("grayscale", grayscale));
        passes.add(new Pass("otsu", () -> preprocessor.otsuThreshold(
                preprocessor.upscaleToMinDimension(grayscale.get(), minDimension))));
        if (extendedPasses) {
            passes.add(new Pass("adaptive", () ->
                    preprocessor.adaptiveThreshold(grayscale.get(), ADAPTIVE_BLOCK_SIZE, ADAPTIVE_C)));
            passes.add(new Pass("close", () -> preprocessor.morphologyClose(grayscale.get(), CLOSE_KERNEL)));
            passes.add(new Pass("center-mask", () -> preprocessor.maskCenter(grayscale.get(), CENTER_MASK_DIMENSION)));
        }

        for (var pass : passes) {
            var mat = pass.image().get();
            var symbols = qrOnly(cascadeEngine.decode(MatConversions.toBufferedImage(mat)));
            if (!symbols.isEmpty()) {
                log.info("cascade pass {} found {} symbol(s) with {}", pass.name(), symbols.size(), cascadeEngine.kind());
                return toSourceCoordinates(symbols, (double) image.getWidth() / mat.cols(),
                        image.getWidth(), image.getHeight());
            }
            log.debug("cascade pass {} found nothing", pass.name());
        }
        return List.of();
    }

    /** Boxes found on a resized pass image are mapped back onto the input. */
    static List<DecodedSymbol> toSourceCoordinates(List<DecodedSymbol> symbols, double factor, int width, int height) {
        if (factor == 1.0) {
            return symbols;
        }
        return symbols.stream()
                .map(s -> new DecodedSymbol(s.text(), s.format(),
                        s.boundingBox().map(box -> box.scale(factor).clampTo(width, height)), s.sourceEngine()))
                .collect(Collectors.toList());
    }

    private static List<DecodedSymbol> qrOnly(List<DecodedSymbol> symbols) {
        return symbols.stream().filter(DecodedSymbol::isQr).collect(Collectors.toList());
    }

    List<BarcodeEngine> engines() {
        return engines;
    }

    private record Pass(String name, Supplier<Mat> image) {
    }
}
