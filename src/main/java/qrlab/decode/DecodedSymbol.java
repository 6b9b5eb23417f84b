package qrlab.decode;

import java.util.Objects;
import java.util.Optional;

/**
 * One symbol found in an image.
 */
public record DecodedSymbol(String text, SymbolFormat format, Optional<BoundingBox> boundingBox, EngineKind sourceEngine) {

    public DecodedSymbol {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(boundingBox, "boundingBox");
        Objects.requireNonNull(sourceEngine, "sourceEngine");
    }

    public static DecodedSymbol qr(String text, BoundingBox box, EngineKind engine) {
        return new DecodedSymbol(text, SymbolFormat.QR, Optional.ofNullable(box), engine);
    }

    public boolean isQr() {
        return format == SymbolFormat.QR;
    }
}
