package qrlab.decode.engine;

import qrlab.decode.DecodedSymbol;
import qrlab.decode.EngineKind;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * A decoder the pipeline can try. Implementations never throw for "nothing found", they return an empty list.
 */
public interface BarcodeEngine {

    /**
     * @param image image to scan, not modified
     * @return symbols in the order the engine reports them, empty when none was found
     */
    List<DecodedSymbol> decode(BufferedImage image);

    EngineKind kind();

    /** False when a native dependency is missing on this platform. Checked once when the pipeline is built. */
    default boolean isAvailable() {
        return true;
    }
}
