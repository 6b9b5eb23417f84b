package qrlab.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Runtime settings.
 *
 * <p>Resolution order, last wins: classpath {@code qrlab.properties}, environment variables
 * ({@code QRLAB_DECODE_MIN_DIMENSION} for {@code decode.min-dimension}), system properties
 * ({@code -Dqrlab.decode.min-dimension=...}).
 *
 * @param redisUrl           counter store location
 * @param redisTimeout       command timeout for the counter store
 * @param minDecodeDimension images smaller than this are upscaled before thresholding
 * @param cropMinDimension   symbol crops are enlarged until their smaller side reaches this
 * @param extendedPasses     run adaptive threshold, morphology and logo-mask passes after Otsu
 * @param debugDir           where intermediate decode images go when DEBUG is on, may be null
 * @param maxUploadBytes     upper bound the upload layer enforces before decoding
 */
public record QrLabConfig(
        String redisUrl,
        Duration redisTimeout,
        int minDecodeDimension,
        int cropMinDimension,
        boolean extendedPasses,
        Path debugDir,
        long maxUploadBytes
) {
    private static final Logger log = LoggerFactory.getLogger(QrLabConfig.class);

    public static final String RESOURCE = "qrlab.properties";
    private static final String PREFIX = "qrlab.";
    private static final List<String> KEYS = List.of(
            "redis.url", "redis.timeout-ms", "decode.min-dimension", "decode.crop-min-dimension",
            "decode.extended-passes", "decode.debug-dir", "upload.max-file-size");

    public QrLabConfig {
        if (redisUrl == null || redisUrl.isBlank()) throw new IllegalArgumentException("redis.url must be set");
        if (redisTimeout == null || redisTimeout.isNegative()) throw new IllegalArgumentException("redis.timeout-ms must be >= 0");
        if (minDecodeDimension <= 0) throw new IllegalArgumentException("decode.min-dimension must be > 0");
        if (cropMinDimension <= 0) throw new IllegalArgumentException("decode.crop-min-dimension must be > 0");
        if (maxUploadBytes <= 0) throw new IllegalArgumentException("upload.max-file-size must be > 0");
    }

    public static QrLabConfig defaults() {
        return new QrLabConfig("redis://localhost:6379", Duration.ofSeconds(2), 200, 100, true, null, 16L * 1024 * 1024);
    }

    public Optional<Path> debugDirectory() {
        return Optional.ofNullable(debugDir);
    }

    public static QrLabConfig load() {
        var props = new Properties();
        try (InputStream in = QrLabConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                log.debug("{} not on classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("read " + RESOURCE, e);
        }
        return from(props, System.getenv(), System.getProperties());
    }

    static QrLabConfig from(Properties file, Map<String, String> env, Properties system) {
        var merged = new Properties();
        merged.putAll(file);
        for (var name : KEYS) {
            var envValue = env.get(envName(name));
            if (envValue != null) {
                merged.setProperty(name, envValue);
            }
        }
        for (var name : system.stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                merged.setProperty(name.substring(PREFIX.length()), system.getProperty(name));
            }
        }

        var d = defaults();
        var debugDir = merged.getProperty("decode.debug-dir", "").trim();
        return new QrLabConfig(
                merged.getProperty("redis.url", d.redisUrl()).trim(),
                Duration.ofMillis(longValue(merged, "redis.timeout-ms", d.redisTimeout().toMillis())),
                (int) longValue(merged, "decode.min-dimension", d.minDecodeDimension()),
                (int) longValue(merged, "decode.crop-min-dimension", d.cropMinDimension()),
                Boolean.parseBoolean(merged.getProperty("decode.extended-passes", String.valueOf(d.extendedPasses())).trim()),
                debugDir.isEmpty() ? null : Path.of(debugDir),
                longValue(merged, "upload.max-file-size", d.maxUploadBytes())
        );
    }

    /** {@code decode.min-dimension} -> {@code QRLAB_DECODE_MIN_DIMENSION} */
    static String envName(String property) {
        return "QRLAB_" + property.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static long longValue(Properties props, String key, long fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + raw, e);
        }
    }
}
