package qrlab.decode;

import qrlab.config.QrLabConfig;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Cuts a preview of a decoded symbol out of the source image. Small symbols are padded out around their
 * centre so the preview is never smaller than {@code minDimension} on its shorter side, image bounds
 * permitting.
 */
public class SymbolCropper {

    private final int minDimension;

    public SymbolCropper(int minDimension) {
        if (minDimension <= 0) {
            throw new IllegalArgumentException("minDimension must be > 0");
        }
        this.minDimension = minDimension;
    }

    public static SymbolCropper create(QrLabConfig config) {
        return new SymbolCropper(config.cropMinDimension());
    }

    public Optional<BufferedImage> crop(BufferedImage image, DecodedSymbol symbol) {
        return symbol.boundingBox().flatMap(box -> crop(image, box));
    }

    public Optional<BufferedImage> crop(BufferedImage image, BoundingBox box) {
        var region = cropRegion(box, image.getWidth(), image.getHeight());
        if (region.isEmpty()) {
            return Optional.empty();
        }
        var view = image.getSubimage(region.x(), region.y(), region.width(), region.height());
        // detach from the source raster
        var copy = new BufferedImage(region.width(), region.height(),
                image.getType() == BufferedImage.TYPE_CUSTOM ? BufferedImage.TYPE_INT_ARGB : image.getType());
        var g = copy.createGraphics();
        try {
            g.drawImage(view, 0, 0, null);
        } finally {
            g.dispose();
        }
        return Optional.of(copy);
    }

    public BoundingBox cropRegion(BoundingBox box, int imageWidth, int imageHeight) {
        return box.expandToMinSide(minDimension).clampTo(imageWidth, imageHeight);
    }
}
