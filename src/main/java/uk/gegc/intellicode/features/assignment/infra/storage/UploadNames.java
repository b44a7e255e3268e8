package uk.gegc.intellicode.features.assignment.infra.storage;

import org.apache.commons.io.FilenameUtils;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Fits client supplied file names and content types into the stored columns
 * and object keys.
 */
public final class UploadNames {

    public static final int MAX_NAME_LENGTH = 255;
    public static final int MAX_MIME_TYPE_LENGTH = 150;
    static final int MAX_KEY_NAME_LENGTH = 120;
    static final int MAX_EXTENSION_LENGTH = 16;
    static final String DEFAULT_NAME = "file";
    static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private UploadNames() {
    }

    /**
     * The name shown back to users: directories stripped, shortened to fit the
     * column while keeping the extension.
     */
    public static String displayName(String originalFilename) {
        // FilenameUtils rejects names containing NUL
        String name = originalFilename == null ? "" : FilenameUtils.getName(originalFilename.replace("\0", "")).trim();
        if (!StringUtils.hasText(name)) {
            return DEFAULT_NAME;
        }
        return shorten(name, MAX_NAME_LENGTH);
    }

    /**
     * The name used as the last segment of an object key.
     */
    public static String keyName(String originalFilename) {
        String safe = displayName(originalFilename).replaceAll("[^A-Za-z0-9._-]", "_");
        return shorten(safe, MAX_KEY_NAME_LENGTH);
    }

    public static String contentType(String contentType) {
        if (!StringUtils.hasText(contentType) || contentType.length() > MAX_MIME_TYPE_LENGTH) {
            return DEFAULT_MIME_TYPE;
        }
        return contentType.trim().toLowerCase(Locale.ROOT);
    }

    private static String shorten(String name, int maxLength) {
        if (name.length() <= maxLength) {
            return name;
        }
        String extension = FilenameUtils.getExtension(name);
        String suffix = StringUtils.hasText(extension) && extension.length() <= MAX_EXTENSION_LENGTH
                ? "." + extension
                : "";
        return name.substring(0, maxLength - suffix.length()) + suffix;
    }
}
