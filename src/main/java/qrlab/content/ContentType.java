package qrlab.content;

import java.util.Locale;

/**
 * Kind of payload carried by a decoded symbol.
 */
public enum ContentType {
    URL,
    EMAIL,
    PHONE,
    WIFI,
    SMS,
    VCARD,
    GEO,
    TEXT;

    /** lower-case name used in API payloads */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
