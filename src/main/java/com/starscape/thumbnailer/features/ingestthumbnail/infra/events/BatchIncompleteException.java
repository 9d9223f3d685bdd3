package com.starscape.thumbnailer.features.ingestthumbnail.infra.events;

import com.starscape.thumbnailer.features.ingestthumbnail.domain.BatchResult;

/**
 * Thrown by the SQS listener so the notification is redelivered
 * when a batch left events that a later attempt may complete.
 */
public class BatchIncompleteException extends RuntimeException {
    
    private final transient BatchResult result;
    
    public BatchIncompleteException(BatchResult result) {
        super("Upload batch incomplete, requesting redelivery: " + result.summary());
        this.result = result;
    }
    
    public BatchResult getResult() {
        return result;
    }
}
