package qrlab.render;

import java.util.Objects;
import java.util.Optional;

/**
 * Optional finishing touches, applied in declaration order: border, shadow, caption.
 */
public record Decorations(Optional<BorderStyle> border, Optional<ShadowStyle> shadow, Optional<CaptionStyle> caption) {

    public Decorations {
        Objects.requireNonNull(border, "border");
        Objects.requireNonNull(shadow, "shadow");
        Objects.requireNonNull(caption, "caption");
    }

    public boolean isEmpty() {
        return border.isEmpty() && shadow.isEmpty() && caption.isEmpty();
    }
}
