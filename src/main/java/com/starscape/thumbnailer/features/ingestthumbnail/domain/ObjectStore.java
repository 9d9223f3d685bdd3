package com.starscape.thumbnailer.features.ingestthumbnail.domain;

/**
 * Object storage port. Implementations translate provider errors into {@link ObjectStoreException}.
 */
public interface ObjectStore {
    
    SourceObject get(String bucket, String key);
    
    void put(String bucket, String key, byte[] bytes, String contentType);
    
    /**
     * Diagnostic check; never throws.
     */
    boolean exists(String bucket, String key);
    
    /**
     * Diagnostic check; never throws.
     */
    boolean bucketReachable(String bucket);
}
