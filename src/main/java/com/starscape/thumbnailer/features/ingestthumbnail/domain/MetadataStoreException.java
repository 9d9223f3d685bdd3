package com.starscape.thumbnailer.features.ingestthumbnail.domain;

public class MetadataStoreException extends RuntimeException {
    
    public MetadataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
