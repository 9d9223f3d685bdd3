package com.starscape.thumbnailer.features.ingestthumbnail.infra;

import com.starscape.thumbnailer.features.ingestthumbnail.domain.ObjectStore;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.ObjectStoreException;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.SourceObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;

/**
 * {@link ObjectStore} backed by Amazon S3.
 */
@Component
public class S3ObjectStore implements ObjectStore {
    
    private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);
    
    private final S3Client s3Client;
    
    public S3ObjectStore(S3Client s3Client) {
        this.s3Client = s3Client;
    }
    
    @Override
    public SourceObject get(String bucket, String key) {
        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        
        try (ResponseInputStream<GetObjectResponse> response = s3Client.getObject(getRequest)) {
            byte[] bytes = response.readAllBytes();
            GetObjectResponse metadata = response.response();
            long contentLength = metadata.contentLength() != null ? metadata.contentLength() : bytes.length;
            return new SourceObject(bytes, contentLength, metadata.lastModified(), metadata.contentType());
        } catch (NoSuchKeyException e) {
            throw ObjectStoreException.notFound(bucket, key, e);
        } catch (SdkException e) {
            throw new ObjectStoreException("Failed to fetch s3://" + bucket + "/" + key + ": " + e.getMessage(),
                bucket, key, e);
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to read s3://" + bucket + "/" + key + ": " + e.getMessage(),
                bucket, key, e);
        }
    }
    
    @Override
    public void put(String bucket, String key, byte[] bytes, String contentType) {
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .contentLength((long) bytes.length)
                .build();
        
        try {
            s3Client.putObject(putRequest, RequestBody.fromBytes(bytes));
        } catch (SdkException e) {
            throw new ObjectStoreException("Failed to write s3://" + bucket + "/" + key + ": " + e.getMessage(),
                bucket, key, e);
        }
    }
    
    @Override
    public boolean exists(String bucket, String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (SdkException e) {
            log.debug("Existence check failed: bucket={}, key={}, error={}", bucket, key, e.getMessage());
            return false;
        }
    }
    
    @Override
    public boolean bucketReachable(String bucket) {
        try {
            s3Client.headBucket(HeadBucketRequest.builder()
                    .bucket(bucket)
                    .build());
            return true;
        } catch (SdkException e) {
            log.debug("Bucket check failed: bucket={}, error={}", bucket, e.getMessage());
            return false;
        }
    }
}
