package com.starscape.thumbnailer.features.ingestthumbnail.domain;

import java.util.Optional;

/**
 * Record store port for {@link MetadataRecord}s. The table is fixed per repository instance.
 */
public interface MetadataRepository {
    
    /**
     * Insert the record, or overwrite the one with the same image name.
     *
     * @throws MetadataStoreException when the store rejects or cannot be reached
     */
    void upsert(MetadataRecord record);
    
    Optional<MetadataRecord> findByImageName(String imageName);
    
    /**
     * Diagnostic check; never throws.
     */
    boolean isReachable();
}
