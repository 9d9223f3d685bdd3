package com.starscape.thumbnailer.common.config;

import com.starscape.thumbnailer.common.exception.ConfigurationMissingException;

import java.util.regex.Pattern;

/**
 * Validated, immutable view of the ingestion configuration.
 * Built once at startup and shared by reference; construction fails fast on missing or invalid values.
 *
 * @param keyPrefix       destination key prefix, with runs of '/' collapsed like derived keys
 * @param maxSourcePixels largest source image (width x height) that is decoded at all
 */
public record IngestionSettings(
    String destinationBucket,
    String metadataTable,
    int maxWidth,
    int maxHeight,
    float quality,
    String keyPrefix,
    boolean diagnosticsEnabled,
    boolean redeliverOnFailure,
    long maxSourcePixels
) {
    
    public static final float DEFAULT_QUALITY = 0.85f;
    public static final String DEFAULT_KEY_PREFIX = "thumbnails/";
    // Roughly 179 megapixels, far beyond any camera upload
    public static final long DEFAULT_MAX_SOURCE_PIXELS = 178_956_970L;
    
    private static final Pattern REPEATED_SLASHES = Pattern.compile("/{2,}");
    
    public IngestionSettings {
        if (destinationBucket == null || destinationBucket.isBlank()) {
            throw new ConfigurationMissingException("app.ingest.destination-bucket");
        }
        if (metadataTable == null || metadataTable.isBlank()) {
            throw new ConfigurationMissingException("app.ingest.metadata-table");
        }
        if (maxWidth < 1 || maxHeight < 1) {
            throw new IllegalArgumentException(
                "Thumbnail bounds must be positive: " + maxWidth + "x" + maxHeight);
        }
        if (!(quality > 0f && quality <= 1f)) {
            throw new IllegalArgumentException("Thumbnail quality must be in (0, 1]: " + quality);
        }
        if (maxSourcePixels < 1) {
            throw new IllegalArgumentException("Source pixel limit must be positive: " + maxSourcePixels);
        }
        keyPrefix = keyPrefix == null ? "" : REPEATED_SLASHES.matcher(keyPrefix).replaceAll("/");
    }
    
    public IngestionSettings(
            String destinationBucket,
            String metadataTable,
            int maxWidth,
            int maxHeight,
            float quality,
            String keyPrefix,
            boolean diagnosticsEnabled,
            boolean redeliverOnFailure) {
        this(destinationBucket, metadataTable, maxWidth, maxHeight, quality, keyPrefix,
            diagnosticsEnabled, redeliverOnFailure, DEFAULT_MAX_SOURCE_PIXELS);
    }
    
    /**
     * Settings with the default thumbnail policy: 100x100 box, quality 0.85, "thumbnails/" prefix.
     */
    public static IngestionSettings withDefaults(String destinationBucket, String metadataTable) {
        return new IngestionSettings(
            destinationBucket, metadataTable, 100, 100, DEFAULT_QUALITY, DEFAULT_KEY_PREFIX, false, true);
    }
    
    public static IngestionSettings from(IngestionProperties ingest, ThumbnailProperties thumbnail) {
        return new IngestionSettings(
            ingest.getDestinationBucket(),
            ingest.getMetadataTable(),
            thumbnail.getMaxWidth(),
            thumbnail.getMaxHeight(),
            thumbnail.getQuality(),
            thumbnail.getKeyPrefix(),
            ingest.isDiagnosticsEnabled(),
            ingest.isRedeliverOnFailure(),
            thumbnail.getMaxSourcePixels()
        );
    }
}
