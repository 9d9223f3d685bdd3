package com.starscape.thumbnailer.features.ingestthumbnail.app;

import com.starscape.thumbnailer.common.config.IngestionSettings;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.BatchResult;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.EventResult;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.FailureKind;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.ImageArtifact;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.ImageDecodeException;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.MetadataRecord;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.MetadataRepository;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.MetadataStoreException;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.ObjectStore;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.ObjectStoreException;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.SourceObject;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.ThumbnailArtifact;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.ThumbnailKey;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.UploadEvent;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Processes batches of upload notifications into thumbnails and metadata records:
 * - Decodes the object key and fetches the source image
 * - Renders a bounded RGB JPEG thumbnail
 * - Writes the thumbnail to the destination bucket
 * - Upserts the metadata record, only after the thumbnail write succeeded
 *
 * Each event gets an {@link EventResult}; a failing event never stops the rest of the batch.
 * Every write is an overwrite of a key derived from the source key, so replaying an event is safe.
 */
@Service
public class ThumbnailIngestionPipeline {
    
    private static final Logger log = LoggerFactory.getLogger(ThumbnailIngestionPipeline.class);
    
    private final ObjectStore objectStore;
    private final MetadataRepository metadataRepository;
    private final ThumbnailRenderer renderer;
    private final StorageDiagnostics diagnostics;
    private final IngestionSettings settings;
    private final Clock clock;
    
    public ThumbnailIngestionPipeline(
            ObjectStore objectStore,
            MetadataRepository metadataRepository,
            ThumbnailRenderer renderer,
            StorageDiagnostics diagnostics,
            IngestionSettings settings,
            Clock clock) {
        this.objectStore = objectStore;
        this.metadataRepository = metadataRepository;
        this.renderer = renderer;
        this.diagnostics = diagnostics;
        this.settings = settings;
        this.clock = clock;
    }
    
    /**
     * Process a batch of upload events sequentially.
     *
     * @param batch events of one notification; null is treated as empty
     * @return one result per event, in input order
     */
    public BatchResult process(List<UploadEvent> batch) {
        if (batch == null || batch.isEmpty()) {
            log.info("Upload batch is empty, nothing to process");
            return BatchResult.empty();
        }
        
        List<EventResult> results = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            results.add(processEvent(i, batch.get(i)));
        }
        
        BatchResult result = new BatchResult(results);
        log.info("Processed upload batch: {}", result.summary());
        return result;
    }
    
    EventResult processEvent(int index, UploadEvent event) {
        if (event == null || !event.isWellFormed()) {
            log.warn("Skipping malformed upload event: index={}, event={}", index, event);
            return EventResult.notCompleted(index, event == null ? null : event.sourceBucket(), null,
                FailureKind.MALFORMED_EVENT, null, "Notification lacks bucket name or object key");
        }
        
        String bucket = event.sourceBucket();
        String key;
        try {
            key = URLDecoder.decode(event.objectKey(), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping event with undecodable key: index={}, bucket={}, rawKey={}",
                index, bucket, event.objectKey(), e);
            return EventResult.notCompleted(index, bucket, null,
                FailureKind.UNDECODABLE_KEY, null, e.getMessage());
        }
        
        if (bucket.equals(settings.destinationBucket()) && ThumbnailKey.isUnderPrefix(settings.keyPrefix(), key)) {
            log.debug("Skipping generated thumbnail: bucket={}, key={}", bucket, key);
            return EventResult.notCompleted(index, bucket, key,
                FailureKind.OWN_THUMBNAIL, null, "Object is a generated thumbnail");
        }
        
        log.info("Processing upload: index={}, bucket={}, key={}, eventName={}, declaredSize={}",
            index, bucket, key, event.eventName(), event.declaredSize());
        
        // Fetch source
        SourceObject source;
        try {
            source = objectStore.get(bucket, key);
        } catch (ObjectStoreException e) {
            if (e.isNotFound()) {
                log.warn("Source object no longer exists: bucket={}, key={}", e.getBucket(), e.getKey());
            } else {
                log.error("Source object unavailable: bucket={}, key={}", e.getBucket(), e.getKey(), e);
            }
            diagnostics.afterFetchFailure(bucket, key);
            FailureKind kind = e.isNotFound() ? FailureKind.SOURCE_NOT_FOUND : FailureKind.SOURCE_UNAVAILABLE;
            return EventResult.notCompleted(index, bucket, key, kind, null, e.getMessage());
        }
        log.debug("Fetched source: key={}, bytes={}, contentLength={}, lastModified={}",
            key, source.bytes().length, source.sizeBytes(), source.lastModified());
        
        // Decode, normalize, resize, encode
        ThumbnailArtifact thumbnail;
        try {
            ImageArtifact image = renderer.decode(source.bytes());
            log.debug("Decoded image: key={}, format={}, mode={}, size={}x{}, decoded={}x{}, bytes={}",
                key, image.format(), image.colorMode(), image.sourceWidth(), image.sourceHeight(),
                image.width(), image.height(), image.byteLength());
            thumbnail = renderer.render(image);
        } catch (ImageDecodeException e) {
            log.error("Failed to create thumbnail: bucket={}, key={}", bucket, key, e);
            return EventResult.notCompleted(index, bucket, key,
                FailureKind.DECODE_ERROR, null, e.getMessage());
        }
        
        // Upload thumbnail
        String destinationBucket = settings.destinationBucket();
        String thumbnailKey = ThumbnailKey.derive(settings.keyPrefix(), key, ThumbnailRenderer.OUTPUT_FORMAT);
        try {
            objectStore.put(destinationBucket, thumbnailKey, thumbnail.bytes(), thumbnail.contentType());
        } catch (ObjectStoreException e) {
            log.error("Destination unavailable for thumbnail: bucket={}, key={}", destinationBucket, thumbnailKey, e);
            diagnostics.afterWriteFailure(destinationBucket);
            return EventResult.notCompleted(index, bucket, key,
                FailureKind.DESTINATION_UNAVAILABLE, thumbnailKey, e.getMessage());
        }
        log.debug("Uploaded thumbnail: bucket={}, key={}, size={}x{}, bytes={}",
            destinationBucket, thumbnailKey, thumbnail.width(), thumbnail.height(), thumbnail.bytes().length);
        diagnostics.afterWrite(destinationBucket, thumbnailKey);
        
        // Upsert metadata, only once the thumbnail exists
        MetadataRecord record = toRecord(key, source, thumbnailKey);
        try {
            metadataRepository.upsert(record);
        } catch (MetadataStoreException e) {
            log.error("Thumbnail stored but metadata write failed (partial success): key={}, thumbnailKey={}",
                key, thumbnailKey, e);
            diagnostics.afterMetadataFailure(key);
            return EventResult.notCompleted(index, bucket, key,
                FailureKind.METADATA_ERROR, thumbnailKey, e.getMessage());
        }
        
        log.info("Thumbnail created: source=s3://{}/{}, thumbnail=s3://{}/{}",
            bucket, key, destinationBucket, thumbnailKey);
        return EventResult.success(index, bucket, key, thumbnailKey);
    }
    
    private MetadataRecord toRecord(String key, SourceObject source, String thumbnailKey) {
        Instant lastModified = source.lastModified();
        return new MetadataRecord(
            key,
            String.valueOf(source.bytes().length),
            lastModified == null ? null : lastModified.toString(),
            Instant.now(clock).toString(),
            thumbnailKey,
            DigestUtils.sha256Hex(source.bytes())
        );
    }
}
