package com.starscape.thumbnailer.features.ingestthumbnail.infra.events;

import com.starscape.thumbnailer.common.config.IngestionSettings;
import com.starscape.thumbnailer.features.ingestthumbnail.app.ThumbnailIngestionPipeline;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.BatchResult;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.UploadEvent;
import com.starscape.thumbnailer.features.ingestthumbnail.infra.MalformedNotificationException;
import com.starscape.thumbnailer.features.ingestthumbnail.infra.S3NotificationParser;
import io.awspring.cloud.sqs.annotation.SqsListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Listens to SQS messages carrying S3 ObjectCreated notifications for the source bucket.
 * Each message is one batch for the ingestion pipeline.
 * 
 * Only enabled when spring.cloud.aws.sqs.enabled=true
 */
@Component
@ConditionalOnProperty(name = "spring.cloud.aws.sqs.enabled", havingValue = "true", matchIfMissing = false)
public class S3EventListener {
    
    private static final Logger log = LoggerFactory.getLogger(S3EventListener.class);
    
    static final int MAX_LOGGED_MESSAGE_LENGTH = 1000;
    
    private final ThumbnailIngestionPipeline pipeline;
    private final S3NotificationParser parser;
    private final boolean redeliverOnFailure;
    
    public S3EventListener(
            ThumbnailIngestionPipeline pipeline,
            S3NotificationParser parser,
            IngestionSettings settings) {
        this.pipeline = pipeline;
        this.parser = parser;
        this.redeliverOnFailure = settings.redeliverOnFailure();
    }
    
    /**
     * Handle an SQS message containing an S3 notification.
     * The queue URL is configured via ${aws.sqs.queue-url} property.
     *
     * @throws BatchIncompleteException when redelivery is enabled and an event may still succeed on retry
     */
    @SqsListener("${aws.sqs.queue-url}")
    public void handleS3Event(String message) {
        log.debug("Received SQS message: {}", truncate(message));
        
        List<UploadEvent> batch;
        try {
            batch = parser.parse(message);
        } catch (MalformedNotificationException e) {
            // Redelivery cannot fix the payload; report it as a single malformed event
            log.error("Failed to parse S3 notification: {}", truncate(message), e);
            batch = List.of(UploadEvent.unparseable());
        }
        
        BatchResult result = pipeline.process(batch);
        
        if (redeliverOnFailure && result.hasRetryableOutcome()) {
            throw new BatchIncompleteException(result);
        }
    }
    
    static String truncate(String message) {
        if (message == null || message.length() <= MAX_LOGGED_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_LOGGED_MESSAGE_LENGTH) + "...";
    }
}
