package qrlab.content;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Guesses what a decoded payload is from its prefix. First match wins, so the order of the checks matters:
 * WiFi records and {@code mailto:} links go first because their bodies often contain {@code @} and dots.
 */
public final class ContentClassifier {

    static final String WIFI_PREFIX = "WIFI:";

    private ContentClassifier() {
    }

    public static ContentInfo classify(String data) {
        Objects.requireNonNull(data, "data");
        if (data.startsWith(WIFI_PREFIX)) {
            return new ContentInfo(data, ContentType.WIFI, Optional.of(WifiConfig.parse(data)));
        }
        return new ContentInfo(data, typeOf(data), Optional.empty());
    }

    static ContentType typeOf(String data) {
        if (data.startsWith("mailto:")) {
            return ContentType.EMAIL;
        }
        if (data.startsWith("http://") || data.startsWith("https://") || data.startsWith("www.")) {
            return ContentType.URL;
        }
        if (isEmail(data)) {
            return ContentType.EMAIL;
        }
        if (data.startsWith("tel:")) {
            return ContentType.PHONE;
        }
        if (data.startsWith("sms:")) {
            return ContentType.SMS;
        }
        if (data.startsWith("BEGIN:VCARD")) {
            return ContentType.VCARD;
        }
        var lower = data.toLowerCase(Locale.ROOT);
        if (lower.contains("geo:") || lower.contains("latitude")) {
            return ContentType.GEO;
        }
        return ContentType.TEXT;
    }

    /** an {@code @} followed by a domain part with a dot, up to the next {@code @} */
    private static boolean isEmail(String data) {
        int at = data.indexOf('@');
        if (at < 0) {
            return false;
        }
        int next = data.indexOf('@', at + 1);
        var domain = next < 0 ? data.substring(at + 1) : data.substring(at + 1, next);
        return domain.contains(".");
    }
}
