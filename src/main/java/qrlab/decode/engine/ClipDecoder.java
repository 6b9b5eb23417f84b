package qrlab.decode.engine;

import java.awt.image.BufferedImage;

@FunctionalInterface
public interface ClipDecoder {
    /**
     * Decodes a clip that has already been cut out and straightened around one symbol.
     *
     * @param clip image containing a single symbol
     * @return symbol text, or null when the clip could not be decoded so the caller can try the next candidate
     */
    String decode(BufferedImage clip);
}
