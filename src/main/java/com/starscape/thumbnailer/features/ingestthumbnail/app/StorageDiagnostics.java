package com.starscape.thumbnailer.features.ingestthumbnail.app;

import com.starscape.thumbnailer.common.config.IngestionSettings;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.MetadataRepository;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.ObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Optional storage checks run around pipeline failures to help operators tell a missing object
 * from a permissions or connectivity problem. Checks only log; they never change an event's outcome.
 * Enabled with app.ingest.diagnostics-enabled.
 */
@Component
public class StorageDiagnostics {
    
    private static final Logger log = LoggerFactory.getLogger(StorageDiagnostics.class);
    
    private final ObjectStore objectStore;
    private final MetadataRepository metadataRepository;
    private final boolean enabled;
    
    public StorageDiagnostics(
            ObjectStore objectStore,
            MetadataRepository metadataRepository,
            IngestionSettings settings) {
        this.objectStore = objectStore;
        this.metadataRepository = metadataRepository;
        this.enabled = settings.diagnosticsEnabled();
    }
    
    public void afterFetchFailure(String bucket, String key) {
        if (!enabled) {
            return;
        }
        boolean exists = objectStore.exists(bucket, key);
        boolean reachable = objectStore.bucketReachable(bucket);
        log.info("Diagnostics after fetch failure: bucket={}, key={}, objectExists={}, bucketReachable={}",
            bucket, key, exists, reachable);
    }
    
    public void afterWriteFailure(String bucket) {
        if (!enabled) {
            return;
        }
        log.info("Diagnostics after thumbnail write failure: bucket={}, bucketReachable={}",
            bucket, objectStore.bucketReachable(bucket));
    }
    
    public void afterWrite(String bucket, String key) {
        if (!enabled) {
            return;
        }
        boolean verified = objectStore.exists(bucket, key);
        if (verified) {
            log.info("Verified thumbnail upload: bucket={}, key={}", bucket, key);
        } else {
            log.warn("Thumbnail not visible right after upload: bucket={}, key={}", bucket, key);
        }
    }
    
    public void afterMetadataFailure(String imageName) {
        if (!enabled) {
            return;
        }
        log.info("Diagnostics after metadata failure: imageName={}, tableReachable={}",
            imageName, metadataRepository.isReachable());
    }
}
