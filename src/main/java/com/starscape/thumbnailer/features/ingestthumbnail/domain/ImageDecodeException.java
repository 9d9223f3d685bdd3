package com.starscape.thumbnailer.features.ingestthumbnail.domain;

/**
 * The source bytes could not be turned into an RGB thumbnail.
 */
public class ImageDecodeException extends Exception {
    
    public ImageDecodeException(String message) {
        super(message);
    }
    
    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
