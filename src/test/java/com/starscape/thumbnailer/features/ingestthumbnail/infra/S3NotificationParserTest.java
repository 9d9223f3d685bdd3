package com.starscape.thumbnailer.features.ingestthumbnail.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.UploadEvent;
import com.starscape.thumbnailer.support.TestImages;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class S3NotificationParserTest {
    
    private final S3NotificationParser parser = new S3NotificationParser(new ObjectMapper());
    
    @Test
    void shouldParseEveryRecordOfNotification() throws Exception {
        List<UploadEvent> events = parser.parse(TestImages.s3Notification("uploads", "my+photo.png", "b.jpg"));
        
        assertThat(events).hasSize(2);
        assertThat(events.get(0).sourceBucket()).isEqualTo("uploads");
        assertThat(events.get(0).objectKey()).isEqualTo("my+photo.png");
        assertThat(events.get(0).eventName()).isEqualTo("ObjectCreated:Put");
        assertThat(events.get(0).declaredSize()).isEqualTo(1024L);
        assertThat(events.get(0).isWellFormed()).isTrue();
        assertThat(events.get(1).objectKey()).isEqualTo("b.jpg");
    }
    
    @Test
    void shouldKeepRecordsWithMissingFieldsAsMalformedEvents() throws Exception {
        String json = """
            {"Records":[
              {"eventSource":"aws:sqs","body":"hello"},
              {"s3":{"bucket":{"name":"uploads"},"object":{}}},
              {"s3":{"bucket":{"name":"uploads"},"object":{"key":"ok.png"}}}
            ]}
            """;
        
        List<UploadEvent> events = parser.parse(json);
        
        assertThat(events).hasSize(3);
        assertThat(events.get(0).isWellFormed()).isFalse();
        assertThat(events.get(1).isWellFormed()).isFalse();
        assertThat(events.get(2).isWellFormed()).isTrue();
        assertThat(events.get(2).declaredSize()).isNull();
    }
    
    @Test
    void shouldTreatNotificationWithoutRecordsAsEmptyBatch() throws Exception {
        String testEvent = """
            {"Service":"Amazon S3","Event":"s3:TestEvent","Time":"2026-03-14T09:00:00.000Z","Bucket":"uploads"}
            """;
        
        assertThat(parser.parse(testEvent)).isEmpty();
        assertThat(parser.parse("{\"Records\":[]}")).isEmpty();
    }
    
    @Test
    void shouldParseFromStream() throws Exception {
        byte[] json = TestImages.s3Notification("uploads", "cat.png").getBytes(StandardCharsets.UTF_8);
        
        List<UploadEvent> events = parser.parse(new ByteArrayInputStream(json));
        
        assertThat(events).extracting(UploadEvent::objectKey).containsExactly("cat.png");
    }
    
    @Test
    void shouldRejectPayloadsThatAreNotJsonObjects() {
        assertThatThrownBy(() -> parser.parse("not json at all"))
            .isInstanceOf(MalformedNotificationException.class);
        assertThatThrownBy(() -> parser.parse("[1, 2, 3]"))
            .isInstanceOf(MalformedNotificationException.class);
        assertThatThrownBy(() -> parser.parse(""))
            .isInstanceOf(MalformedNotificationException.class);
    }
}
