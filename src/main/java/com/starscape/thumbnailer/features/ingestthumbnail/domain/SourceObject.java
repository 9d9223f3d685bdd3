package com.starscape.thumbnailer.features.ingestthumbnail.domain;

import java.time.Instant;

/**
 * An object fetched from the source bucket.
 */
public record SourceObject(
    byte[] bytes,
    long sizeBytes,
    Instant lastModified,
    String contentType
) {
    
    public SourceObject {
        if (bytes == null) {
            throw new IllegalArgumentException("Bytes cannot be null");
        }
    }
}
