package qrlab.decode;

import nu.pattern.OpenCV;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the bundled OpenCV natives once. Components that need OpenCV ask {@link #isAvailable()} first and
 * step aside when the platform has no matching native library.
 */
public final class OpenCvLoader {
    private static final Logger log = LoggerFactory.getLogger(OpenCvLoader.class);

    private static final boolean AVAILABLE = load();

    private OpenCvLoader() {
    }

    public static boolean isAvailable() {
        return AVAILABLE;
    }

    private static boolean load() {
        try {
            OpenCV.loadLocally();
            return true;
        } catch (Throwable e) {
            log.warn("OpenCV natives unavailable, OpenCV passes disabled: {}", e.toString());
            return false;
        }
    }
}
