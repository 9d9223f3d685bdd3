package com.starscape.thumbnailer.features.ingestthumbnail.infra.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.thumbnailer.common.config.IngestionSettings;
import com.starscape.thumbnailer.features.ingestthumbnail.app.ThumbnailIngestionPipeline;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.BatchResult;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.EventResult;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.FailureKind;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.UploadEvent;
import com.starscape.thumbnailer.features.ingestthumbnail.infra.S3NotificationParser;
import com.starscape.thumbnailer.support.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class S3EventListenerTest {
    
    private ThumbnailIngestionPipeline pipeline;
    private S3NotificationParser parser;
    
    @BeforeEach
    void setUp() {
        pipeline = mock(ThumbnailIngestionPipeline.class);
        parser = new S3NotificationParser(new ObjectMapper());
    }
    
    private S3EventListener listener(boolean redeliverOnFailure) {
        IngestionSettings settings = new IngestionSettings(
            "thumbs", "image-metadata", 100, 100, 0.85f, "thumbnails/", false, redeliverOnFailure);
        return new S3EventListener(pipeline, parser, settings);
    }
    
    @Test
    @SuppressWarnings("unchecked")
    void shouldPassParsedEventsToPipeline() {
        when(pipeline.process(anyList())).thenReturn(BatchResult.empty());
        
        listener(true).handleS3Event(TestImages.s3Notification("uploads", "a.png", "b.png"));
        
        ArgumentCaptor<List<UploadEvent>> batch = ArgumentCaptor.forClass(List.class);
        verify(pipeline).process(batch.capture());
        assertThat(batch.getValue()).containsExactly(
            new UploadEvent("uploads", "a.png", "ObjectCreated:Put", 1024L),
            new UploadEvent("uploads", "b.png", "ObjectCreated:Put", 1024L));
    }
    
    @Test
    @SuppressWarnings("unchecked")
    void shouldReportUnparseableMessageAsSingleMalformedEvent() {
        when(pipeline.process(anyList())).thenReturn(BatchResult.empty());
        
        listener(true).handleS3Event("{not json");
        
        ArgumentCaptor<List<UploadEvent>> batch = ArgumentCaptor.forClass(List.class);
        verify(pipeline).process(batch.capture());
        assertThat(batch.getValue()).hasSize(1);
        assertThat(batch.getValue().get(0).isWellFormed()).isFalse();
    }
    
    @Test
    void shouldRequestRedeliveryWhenAnEventMaySucceedLater() {
        BatchResult result = new BatchResult(List.of(
            EventResult.success(0, "uploads", "a.png", "thumbnails/a.png.jpg"),
            EventResult.notCompleted(1, "uploads", "b.png", FailureKind.DESTINATION_UNAVAILABLE, null, "Access Denied")
        ));
        when(pipeline.process(anyList())).thenReturn(result);
        
        assertThatThrownBy(() -> listener(true).handleS3Event(TestImages.s3Notification("uploads", "a.png", "b.png")))
            .isInstanceOf(BatchIncompleteException.class)
            .hasMessageContaining("failed=1")
            .satisfies(e -> assertThat(((BatchIncompleteException) e).getResult()).isSameAs(result));
    }
    
    @Test
    void shouldAcknowledgeWhenOnlyPermanentFailuresRemain() {
        BatchResult result = new BatchResult(List.of(
            EventResult.notCompleted(0, "uploads", "a.png", FailureKind.DECODE_ERROR, null, "Unsupported image format")
        ));
        when(pipeline.process(anyList())).thenReturn(result);
        
        assertThatCode(() -> listener(true).handleS3Event(TestImages.s3Notification("uploads", "a.png")))
            .doesNotThrowAnyException();
    }
    
    @Test
    void shouldAcknowledgeWhenSourceObjectWasDeleted() {
        BatchResult result = new BatchResult(List.of(
            EventResult.success(0, "uploads", "a.png", "thumbnails/a.png.jpg"),
            EventResult.notCompleted(1, "uploads", "gone.png", FailureKind.SOURCE_NOT_FOUND, null,
                "Object not found: s3://uploads/gone.png")
        ));
        when(pipeline.process(anyList())).thenReturn(result);
        
        assertThatCode(() -> listener(true).handleS3Event(TestImages.s3Notification("uploads", "a.png", "gone.png")))
            .doesNotThrowAnyException();
    }
    
    @Test
    void shouldNotRequestRedeliveryWhenDisabled() {
        BatchResult result = new BatchResult(List.of(
            EventResult.notCompleted(0, "uploads", "a.png", FailureKind.METADATA_ERROR,
                "thumbnails/a.png.jpg", "Throttled")
        ));
        when(pipeline.process(anyList())).thenReturn(result);
        
        assertThatCode(() -> listener(false).handleS3Event(TestImages.s3Notification("uploads", "a.png")))
            .doesNotThrowAnyException();
    }
    
    @Test
    void shouldTruncateLongMessagesForLogging() {
        String longMessage = "x".repeat(S3EventListener.MAX_LOGGED_MESSAGE_LENGTH + 500);
        
        assertThat(S3EventListener.truncate(longMessage))
            .hasSize(S3EventListener.MAX_LOGGED_MESSAGE_LENGTH + 3)
            .endsWith("...");
        assertThat(S3EventListener.truncate("short")).isEqualTo("short");
        assertThat(S3EventListener.truncate(null)).isNull();
    }
}
