package qrlab.content;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fields of a {@code WIFI:S:name;T:WPA;P:secret;H:false;;} record. Keys the payload does not carry are absent.
 */
public record WifiConfig(Map<String, String> fields) {

    public WifiConfig {
        fields = Map.copyOf(fields);
    }

    static WifiConfig parse(String data) {
        var fields = new LinkedHashMap<String, String>();
        var body = data.substring(ContentClassifier.WIFI_PREFIX.length());
        for (var part : body.split(";")) {
            int colon = part.indexOf(':');
            if (colon > 0) {
                fields.put(part.substring(0, colon), part.substring(colon + 1));
            }
        }
        return new WifiConfig(fields);
    }

    public Optional<String> ssid() {
        return Optional.ofNullable(fields.get("S"));
    }

    public Optional<String> security() {
        return Optional.ofNullable(fields.get("T"));
    }

    public Optional<String> password() {
        return Optional.ofNullable(fields.get("P"));
    }

    public Optional<String> hidden() {
        return Optional.ofNullable(fields.get("H"));
    }
}
