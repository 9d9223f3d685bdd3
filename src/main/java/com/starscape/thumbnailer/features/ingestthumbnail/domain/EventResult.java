package com.starscape.thumbnailer.features.ingestthumbnail.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one event within a batch.
 *
 * @param index     position of the event in the batch
 * @param imageName decoded source key, null when the key never decoded
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventResult(
    int index,
    String sourceBucket,
    String imageName,
    EventStatus status,
    FailureKind failureKind,
    String thumbnailKey,
    String message
) {
    
    public static EventResult success(int index, String sourceBucket, String imageName, String thumbnailKey) {
        return new EventResult(index, sourceBucket, imageName, EventStatus.SUCCESS, null, thumbnailKey, null);
    }
    
    public static EventResult notCompleted(
            int index,
            String sourceBucket,
            String imageName,
            FailureKind kind,
            String thumbnailKey,
            String message) {
        return new EventResult(index, sourceBucket, imageName, kind.status(), kind, thumbnailKey, message);
    }
    
    /**
     * Compact outcome label such as "success", "skipped:malformed-event", "failed:decode-error"
     * or "partial-success".
     */
    @JsonProperty("outcome")
    public String outcome() {
        return switch (status) {
            case SUCCESS -> "success";
            case PARTIAL_SUCCESS -> "partial-success";
            case SKIPPED -> "skipped:" + failureKind.label();
            case FAILED -> "failed:" + failureKind.label();
        };
    }
    
    @JsonIgnore
    public boolean isRetryable() {
        return failureKind != null && failureKind.isRetryable();
    }
}
