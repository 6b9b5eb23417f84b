package qrlab.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qrlab.InvalidInputException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Turns loosely typed styling options into a {@link QrRenderRequest}. Out-of-range numbers are clamped,
 * malformed colours and unknown option names fall back to defaults. Only the payload itself can be rejected.
 *
 * <p>Option keys use the snake_case names of the public API: {@code data}, {@code size}, {@code border},
 * {@code error_correction}, {@code fill_color}, {@code back_color}, {@code module_drawer}, {@code color_mask},
 * {@code corner_radius}, {@code logo} (bytes), {@code logo_size}, {@code logo_position}, {@code background}
 * (bytes) and {@code custom_styling} (a nested map with {@code border_width}, {@code border_color},
 * {@code shadow}, {@code shadow_offset}, {@code shadow_color}, {@code shadow_opacity}, {@code text},
 * {@code text_color}, {@code text_size}, {@code text_position}).
 */
public class QrStyleValidator {
    private static final Logger log = LoggerFactory.getLogger(QrStyleValidator.class);

    public static final int MAX_DATA_LENGTH = 2953;
    public static final int DEFAULT_SIZE = 300;
    public static final int DEFAULT_BORDER = 4;
    public static final String BLACK = "#000000";
    public static final String WHITE = "#FFFFFF";

    static final int MAX_CAPTION_LENGTH = 100;

    public QrRenderRequest validate(Map<String, ?> options) {
        var data = options.get("data");
        if (data == null || data.toString().isBlank()) {
            throw new InvalidInputException("QR data must not be empty");
        }
        var text = data.toString();
        if (text.length() > MAX_DATA_LENGTH) {
            throw new InvalidInputException("QR data exceeds maximum length of " + MAX_DATA_LENGTH + " characters");
        }

        return new QrRenderRequest(
                text,
                clamp(intOption(options, "size", DEFAULT_SIZE), 100, 2000),
                clamp(intOption(options, "border", DEFAULT_BORDER), 0, 20),
                option(ErrorCorrection.values(), options.get("error_correction"), ErrorCorrection.M, "error_correction"),
                normalizeColor(options.get("fill_color"), BLACK),
                normalizeColor(options.get("back_color"), WHITE),
                option(ModuleDrawerType.values(), options.get("module_drawer"), ModuleDrawerType.SQUARE, "module_drawer"),
                option(ColorMaskType.values(), options.get("color_mask"), ColorMaskType.SOLID, "color_mask"),
                clamp(intOption(options, "corner_radius", 0), 0, 10),
                logo(options),
                bytes(options.get("background")),
                decorations(options.get("custom_styling"))
        );
    }

    private Optional<LogoSpec> logo(Map<?, ?> options) {
        return bytes(options.get("logo")).map(image -> {
            var size = options.get("logo_size") == null
                    ? OptionalInt.empty()
                    : OptionalInt.of(clamp(intOption(options, "logo_size", 60), 20, 200));
            var position = option(LogoPosition.values(), options.get("logo_position"), LogoPosition.CENTER, "logo_position");
            return new LogoSpec(image, size, position);
        });
    }

    private Optional<Decorations> decorations(Object raw) {
        if (!(raw instanceof Map)) {
            if (raw != null) {
                log.warn("custom_styling ignored, expected a map but got {}", raw.getClass().getSimpleName());
            }
            return Optional.empty();
        }
        var styling = (Map<?, ?>) raw;

        Optional<BorderStyle> border = Optional.empty();
        var borderWidth = clamp(intOption(styling, "border_width", 0), 0, 50);
        if (borderWidth > 0) {
            border = Optional.of(new BorderStyle(borderWidth, normalizeColor(styling.get("border_color"), BLACK)));
        }

        Optional<ShadowStyle> shadow = Optional.empty();
        if (truthy(styling.get("shadow"))) {
            shadow = Optional.of(new ShadowStyle(
                    clamp(intOption(styling, "shadow_offset", 5), 1, 20),
                    normalizeColor(styling.get("shadow_color"), BLACK),
                    Math.max(0.1, Math.min(1.0, doubleOption(styling, "shadow_opacity", 0.3)))));
        }

        Optional<CaptionStyle> caption = Optional.empty();
        var text = styling.get("text");
        if (text != null && !text.toString().isEmpty()) {
            var value = text.toString();
            caption = Optional.of(new CaptionStyle(
                    value.length() > MAX_CAPTION_LENGTH ? value.substring(0, MAX_CAPTION_LENGTH) : value,
                    normalizeColor(styling.get("text_color"), BLACK),
                    clamp(intOption(styling, "text_size", 20), 10, 50),
                    option(TextPosition.values(), styling.get("text_position"), TextPosition.BOTTOM, "text_position")));
        }

        var decorations = new Decorations(border, shadow, caption);
        return decorations.isEmpty() ? Optional.empty() : Optional.of(decorations);
    }

    /**
     * Canonical {@code #RRGGBB}: adds a missing {@code #}, drops non-hex characters, expands {@code #RGB}
     * and upper-cases. Anything that does not end up with 3 or 6 digits becomes {@code fallback}.
     */
    public static String normalizeColor(Object raw, String fallback) {
        if (raw == null) {
            return fallback;
        }
        var digits = raw.toString().chars()
                .filter(c -> Character.digit(c, 16) >= 0)
                .mapToObj(c -> String.valueOf((char) c))
                .collect(Collectors.joining());
        if (digits.length() == 3) {
            var expanded = new StringBuilder(6);
            for (char c : digits.toCharArray()) {
                expanded.append(c).append(c);
            }
            digits = expanded.toString();
        } else if (digits.length() != 6) {
            log.debug("malformed colour '{}', using {}", raw, fallback);
            return fallback;
        }
        return "#" + digits.toUpperCase(Locale.ROOT);
    }

    /** Every value a client may pick, as wire names. */
    public Map<String, Object> availableStyles() {
        var styles = new LinkedHashMap<String, Object>();
        styles.put("module_drawers", wireNames(ModuleDrawerType.values()));
        styles.put("color_masks", wireNames(ColorMaskType.values()));
        styles.put("error_corrections", wireNames(ErrorCorrection.values()));
        styles.put("logo_positions", wireNames(LogoPosition.values()));
        styles.put("text_positions", wireNames(TextPosition.values()));
        styles.put("default_colors", Map.of(
                "fill_colors", List.of("#000000", "#1A1A1A", "#333333", "#666666", "#999999"),
                "back_colors", List.of("#FFFFFF", "#F8F9FA", "#E9ECEF", "#DEE2E6", "#CED4DA")));
        var gradients = new LinkedHashMap<String, List<String>>();
        gradients.put("blue", List.of("#1E3C72", "#2A5298"));
        gradients.put("green", List.of("#11998E", "#38EF7D"));
        gradients.put("purple", List.of("#667EEA", "#764BA2"));
        gradients.put("orange", List.of("#F093FB", "#F5576C"));
        gradients.put("red", List.of("#FF9A9E", "#FECFEF"));
        styles.put("gradient_colors", gradients);
        return styles;
    }

    private static List<String> wireNames(StyleOption[] values) {
        return Arrays.stream(values).map(StyleOption::wireName).collect(Collectors.toList());
    }

    static <E extends StyleOption> E option(E[] values, Object raw, E fallback, String name) {
        if (raw == null) {
            return fallback;
        }
        var wanted = raw.toString().trim();
        for (var value : values) {
            if (value.wireName().equalsIgnoreCase(wanted)) {
                return value;
            }
        }
        log.warn("unknown {} '{}', using {}", name, raw, fallback.wireName());
        return fallback;
    }

    static int intOption(Map<?, ?> options, String name, int fallback) {
        var raw = options.get(name);
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Number) {
            // saturate instead of wrapping, the caller clamps to the real range
            long value = ((Number) raw).longValue();
            return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
        }
        var text = raw.toString().trim();
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            try {
                return (int) Double.parseDouble(text);
            } catch (NumberFormatException e2) {
                log.warn("{} '{}' is not a number, using {}", name, raw, fallback);
                return fallback;
            }
        }
    }

    static double doubleOption(Map<?, ?> options, String name, double fallback) {
        var raw = options.get(name);
        if (raw == null) {
            return fallback;
        }
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            log.warn("{} '{}' is not a number, using {}", name, raw, fallback);
            return fallback;
        }
    }

    private static boolean truthy(Object raw) {
        if (raw instanceof Boolean) {
            return (Boolean) raw;
        }
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue() != 0;
        }
        return raw != null && Boolean.parseBoolean(raw.toString().trim());
    }

    private static Optional<byte[]> bytes(Object raw) {
        if (raw instanceof byte[] && ((byte[]) raw).length > 0) {
            return Optional.of((byte[]) raw);
        }
        return Optional.empty();
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
