package guraa.sitephoto.visual;

import lombok.extern.slf4j.Slf4j;
import nu.pattern.OpenCV;

/**
 * Loads the bundled OpenCV native library once per JVM.
 */
@Slf4j
public final class OpenCvLoader {

    private static volatile boolean loaded;

    private OpenCvLoader() {
        // Utility class, no instances allowed
    }

    /**
     * Load the native library if it is not loaded yet.
     *
     * @throws UnsatisfiedLinkError if no native build matches this platform
     */
    public static void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (OpenCvLoader.class) {
            if (!loaded) {
                OpenCV.loadLocally();
                loaded = true;
                log.info("OpenCV native library loaded");
            }
        }
    }

    /**
     * @return true if the native library could be loaded
     */
    public static boolean isAvailable() {
        try {
            ensureLoaded();
            return true;
        } catch (UnsatisfiedLinkError | RuntimeException e) {
            log.error("OpenCV native library could not be loaded: {}", e.getMessage());
            return false;
        }
    }
}
