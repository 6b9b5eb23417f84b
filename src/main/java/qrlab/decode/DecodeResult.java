package qrlab.decode;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of a decode call. Either {@code symbols} is non-empty or {@code errorMessage} explains why not.
 */
public record DecodeResult(DecodeStatus status, List<DecodedSymbol> symbols, String errorMessage) {

    public static final String NOT_FOUND_MESSAGE =
            "No QR code found in the image. Try using a clearer image with better contrast.";
    public static final String UNREADABLE_MESSAGE = "Could not read the image file";

    public DecodeResult {
        Objects.requireNonNull(status, "status");
        symbols = List.copyOf(symbols);
        if (status == DecodeStatus.FOUND && symbols.isEmpty()) {
            throw new IllegalArgumentException("FOUND without symbols");
        }
        if (status != DecodeStatus.FOUND && errorMessage == null) {
            throw new IllegalArgumentException(status + " without message");
        }
    }

    public static DecodeResult found(List<DecodedSymbol> symbols) {
        return new DecodeResult(DecodeStatus.FOUND, symbols, null);
    }

    public static DecodeResult notFound() {
        return new DecodeResult(DecodeStatus.NOT_FOUND, List.of(), NOT_FOUND_MESSAGE);
    }

    public static DecodeResult unreadable() {
        return new DecodeResult(DecodeStatus.UNREADABLE, List.of(), UNREADABLE_MESSAGE);
    }

    public static DecodeResult failed(String detail) {
        return new DecodeResult(DecodeStatus.FAILED, List.of(), "Error processing image: " + detail);
    }

    public boolean isSuccess() {
        return status == DecodeStatus.FOUND;
    }

    public List<String> texts() {
        return symbols.stream().map(DecodedSymbol::text).collect(Collectors.toList());
    }
}
