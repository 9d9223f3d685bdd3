package com.starscape.thumbnailer.features.ingestthumbnail.domain;

/**
 * One "object created" notification record.
 * The key is still URL-encoded as S3 delivers it; bucket or key are null when the record was malformed.
 * Event name and declared size are informational only.
 */
public record UploadEvent(
    String sourceBucket,
    String objectKey,
    String eventName,
    Long declaredSize
) {
    
    public static UploadEvent of(String sourceBucket, String objectKey) {
        return new UploadEvent(sourceBucket, objectKey, null, null);
    }
    
    /**
     * Stand-in for a notification that could not be parsed at all.
     */
    public static UploadEvent unparseable() {
        return new UploadEvent(null, null, null, null);
    }
    
    public boolean isWellFormed() {
        return sourceBucket != null && !sourceBucket.isBlank()
            && objectKey != null && !objectKey.isBlank();
    }
}
