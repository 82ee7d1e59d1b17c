package guraa.sitephoto.util;

import org.apache.commons.io.FilenameUtils;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Helpers for building safe store path components.
 */
public final class FileNameUtils {

    public static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "bmp", "tif", "tiff", "webp");

    private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9_-]+");
    private static final int CAPTION_SLUG_LENGTH = 40;

    private FileNameUtils() {
        // Utility class, no instances allowed
    }

    /**
     * Reduce a value to a single safe path component.
     *
     * @param value The raw value, e.g. a site or task label
     * @param fallback Returned when nothing usable is left
     * @return A component made of letters, digits, '_' and '-'
     */
    public static String safeComponent(String value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String cleaned = UNSAFE.matcher(value.trim()).replaceAll("_");
        cleaned = trimUnderscores(cleaned);
        return cleaned.isEmpty() ? fallback : cleaned;
    }

    /**
     * Clean a file name, keeping a lower-cased extension.
     *
     * @param fileName The raw file name
     * @param defaultExtension Used when the name has no extension
     * @return A safe file name
     */
    public static String safeFileName(String fileName, String defaultExtension) {
        String name = FilenameUtils.getName(fileName == null ? "" : fileName);
        String base = safeComponent(FilenameUtils.getBaseName(name), "photo");
        String extension = safeComponent(FilenameUtils.getExtension(name), "").toLowerCase(Locale.ROOT);
        if (extension.isEmpty()) {
            extension = defaultExtension;
        }
        return base + "." + extension;
    }

    /**
     * Turn a caption into a short slug: runs of unsafe characters become '_', cut to 40 characters.
     */
    public static String captionSlug(String caption) {
        if (caption == null) {
            return "photo";
        }
        String slug = UNSAFE.matcher(caption.trim()).replaceAll("_");
        if (slug.length() > CAPTION_SLUG_LENGTH) {
            slug = slug.substring(0, CAPTION_SLUG_LENGTH);
        }
        return slug.isEmpty() ? "photo" : slug;
    }

    /**
     * Name for a collision: {@code name.jpg} becomes {@code name-<counter>.jpg}.
     */
    public static String withCounter(String fileName, int counter) {
        String base = FilenameUtils.getBaseName(fileName);
        String extension = FilenameUtils.getExtension(fileName);
        return extension.isEmpty() ? base + "-" + counter : base + "-" + counter + "." + extension;
    }

    public static boolean isImageFile(String fileName) {
        return IMAGE_EXTENSIONS.contains(FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT));
    }

    private static String trimUnderscores(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') start++;
        while (end > start && value.charAt(end - 1) == '_') end--;
        return value.substring(start, end);
    }
}
