package com.starscape.thumbnailer.features.ingestthumbnail.domain;

/**
 * Descriptive record of one processed source image, keyed by its decoded object key.
 * Timestamps are ISO-8601 strings; the size is a decimal string of the fetched byte count.
 */
public record MetadataRecord(
    String imageName,
    String imageSizeBytes,
    String creationTimestamp,
    String processedTimestamp,
    String thumbnailKey,
    String checksum
) {
    
    public MetadataRecord {
        if (imageName == null || imageName.isEmpty()) {
            throw new IllegalArgumentException("Image name cannot be empty");
        }
        if (thumbnailKey == null || thumbnailKey.isBlank()) {
            throw new IllegalArgumentException("Thumbnail key cannot be blank");
        }
    }
}
