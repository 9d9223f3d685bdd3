package com.starscape.thumbnailer.features.ingestthumbnail.domain;

/**
 * Object store access failed. {@link #isNotFound()} separates an absent object,
 * which stays absent on every later attempt, from access and transport errors.
 */
public class ObjectStoreException extends RuntimeException {
    
    private final String bucket;
    private final String key;
    private final boolean notFound;
    
    public ObjectStoreException(String message, String bucket, String key, Throwable cause) {
        this(message, bucket, key, false, cause);
    }
    
    private ObjectStoreException(String message, String bucket, String key, boolean notFound, Throwable cause) {
        super(message, cause);
        this.bucket = bucket;
        this.key = key;
        this.notFound = notFound;
    }
    
    public static ObjectStoreException notFound(String bucket, String key, Throwable cause) {
        return new ObjectStoreException("Object not found: s3://" + bucket + "/" + key, bucket, key, true, cause);
    }
    
    public String getBucket() {
        return bucket;
    }
    
    public String getKey() {
        return key;
    }
    
    public boolean isNotFound() {
        return notFound;
    }
}
