package com.starscape.thumbnailer.features.ingestthumbnail.domain;

/**
 * Why an event did not reach {@link EventStatus#SUCCESS}.
 * Retryable kinds may succeed when the same notification is delivered again.
 * A deleted source shares the source-unavailable label but is never retried.
 */
public enum FailureKind {
    MALFORMED_EVENT("malformed-event", EventStatus.SKIPPED, false),
    UNDECODABLE_KEY("undecodable-key", EventStatus.SKIPPED, false),
    OWN_THUMBNAIL("own-thumbnail", EventStatus.SKIPPED, false),
    SOURCE_UNAVAILABLE("source-unavailable", EventStatus.FAILED, true),
    SOURCE_NOT_FOUND("source-unavailable", EventStatus.FAILED, false),
    DECODE_ERROR("decode-error", EventStatus.FAILED, false),
    DESTINATION_UNAVAILABLE("destination-unavailable", EventStatus.FAILED, true),
    METADATA_ERROR("metadata-error", EventStatus.PARTIAL_SUCCESS, true);
    
    private final String label;
    private final EventStatus status;
    private final boolean retryable;
    
    FailureKind(String label, EventStatus status, boolean retryable) {
        this.label = label;
        this.status = status;
        this.retryable = retryable;
    }
    
    public String label() {
        return label;
    }
    
    public EventStatus status() {
        return status;
    }
    
    public boolean isRetryable() {
        return retryable;
    }
}
