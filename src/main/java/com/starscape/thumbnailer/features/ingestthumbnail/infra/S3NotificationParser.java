package com.starscape.thumbnailer.features.ingestthumbnail.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.UploadEvent;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses S3 event notifications into upload batches.
 * Uses the Jackson tree model so a record with missing fields still yields an event
 * (reported as malformed by the pipeline) instead of failing the whole notification.
 *
 * <pre>
 * {"Records":[{"eventName":"ObjectCreated:Put",
 *              "s3":{"bucket":{"name":"uploads"},"object":{"key":"my+photo.png","size":1024}}}]}
 * </pre>
 */
@Component
public class S3NotificationParser {
    
    private final ObjectMapper objectMapper;
    
    public S3NotificationParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    public List<UploadEvent> parse(String payload) throws MalformedNotificationException {
        if (payload == null || payload.isBlank()) {
            throw new MalformedNotificationException("Notification payload is empty");
        }
        try {
            return parse(objectMapper.readTree(payload));
        } catch (JsonProcessingException e) {
            throw new MalformedNotificationException("Notification is not valid JSON", e);
        }
    }
    
    public List<UploadEvent> parse(InputStream payload) throws MalformedNotificationException {
        try {
            return parse(objectMapper.readTree(payload));
        } catch (IOException e) {
            throw new MalformedNotificationException("Notification is not valid JSON", e);
        }
    }
    
    /**
     * A payload without a Records array (such as s3:TestEvent) is an empty batch.
     */
    public List<UploadEvent> parse(JsonNode root) throws MalformedNotificationException {
        if (root == null || !root.isObject()) {
            throw new MalformedNotificationException("Notification is not a JSON object");
        }
        
        JsonNode records = root.get("Records");
        if (records == null || !records.isArray()) {
            return List.of();
        }
        
        List<UploadEvent> events = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            events.add(toEvent(record));
        }
        return events;
    }
    
    private UploadEvent toEvent(JsonNode record) {
        JsonNode s3 = record.path("s3");
        JsonNode object = s3.path("object");
        JsonNode size = object.path("size");
        return new UploadEvent(
            textOrNull(s3.path("bucket").path("name")),
            textOrNull(object.path("key")),
            textOrNull(record.path("eventName")),
            size.isNumber() ? size.asLong() : null
        );
    }
    
    private static String textOrNull(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }
}
