package com.starscape.thumbnailer.features.ingestthumbnail.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Per-event outcomes of one batch, in input order.
 */
public record BatchResult(List<EventResult> results) {
    
    public BatchResult {
        results = results == null ? List.of() : List.copyOf(results);
    }
    
    public static BatchResult empty() {
        return new BatchResult(List.of());
    }
    
    public int size() {
        return results.size();
    }
    
    public long count(EventStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }
    
    public long succeeded() {
        return count(EventStatus.SUCCESS);
    }
    
    public long skipped() {
        return count(EventStatus.SKIPPED);
    }
    
    public long failed() {
        return count(EventStatus.FAILED);
    }
    
    public long partiallySucceeded() {
        return count(EventStatus.PARTIAL_SUCCESS);
    }
    
    @JsonIgnore
    public boolean hasRetryableOutcome() {
        return results.stream().anyMatch(EventResult::isRetryable);
    }
    
    public EventResult get(int index) {
        return results.get(index);
    }
    
    public String summary() {
        return String.format("total=%d, success=%d, skipped=%d, failed=%d, partial=%d",
            size(), succeeded(), skipped(), failed(), partiallySucceeded());
    }
}
