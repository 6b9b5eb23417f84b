package qrlab.content;

import java.util.Objects;
import java.util.Optional;

/**
 * Classification of a decoded payload.
 *
 * @param wifi parsed network record, present only for {@link ContentType#WIFI}
 */
public record ContentInfo(String data, ContentType type, Optional<WifiConfig> wifi) {

    public ContentInfo {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(wifi, "wifi");
    }

    public int length() {
        return data.length();
    }

    public boolean is(ContentType candidate) {
        return type == candidate;
    }
}
