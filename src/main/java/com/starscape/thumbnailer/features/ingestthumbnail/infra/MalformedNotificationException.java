package com.starscape.thumbnailer.features.ingestthumbnail.infra;

/**
 * The notification payload is not a JSON object at all.
 */
public class MalformedNotificationException extends Exception {
    
    public MalformedNotificationException(String message) {
        super(message);
    }
    
    public MalformedNotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
