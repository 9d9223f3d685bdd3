package com.starscape.thumbnailer.features.ingestthumbnail.domain;

import java.util.regex.Pattern;

/**
 * Derives the destination key of a thumbnail from the decoded source key.
 * Pure: the same inputs always give the same key, which the metadata record depends on.
 */
public final class ThumbnailKey {
    
    private static final Pattern WHITESPACE = Pattern.compile("\\s");
    private static final Pattern REPEATED_SLASHES = Pattern.compile("/{2,}");
    
    private ThumbnailKey() {
    }
    
    /**
     * "my photo.png" with prefix "thumbnails/" and extension "jpg" gives "thumbnails/my-photo.png.jpg".
     */
    public static String derive(String prefix, String sourceKey, String extension) {
        if (sourceKey == null || sourceKey.isEmpty()) {
            throw new IllegalArgumentException("Source key cannot be empty");
        }
        String safeKey = WHITESPACE.matcher(sourceKey).replaceAll("-");
        String key = (prefix == null ? "" : prefix) + safeKey + "." + extension;
        return REPEATED_SLASHES.matcher(key).replaceAll("/");
    }
    
    public static boolean isUnderPrefix(String prefix, String key) {
        return prefix != null && !prefix.isEmpty() && key.startsWith(prefix);
    }
}
