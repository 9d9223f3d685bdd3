package com.starscape.thumbnailer.features.ingestthumbnail.infra;

import com.starscape.thumbnailer.common.config.IngestionSettings;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.MetadataRecord;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.MetadataRepository;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.MetadataStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;

import java.util.Optional;

/**
 * {@link MetadataRepository} backed by a DynamoDB table keyed by ImageName.
 * PutItem replaces the whole item, which gives upsert semantics.
 */
@Repository
public class DynamoDbMetadataRepository implements MetadataRepository {
    
    private static final Logger log = LoggerFactory.getLogger(DynamoDbMetadataRepository.class);
    
    private final DynamoDbClient dynamoDbClient;
    private final DynamoDbTable<ImageMetadataItem> table;
    private final String tableName;
    
    public DynamoDbMetadataRepository(
            DynamoDbClient dynamoDbClient,
            DynamoDbEnhancedClient enhancedClient,
            IngestionSettings settings) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = settings.metadataTable();
        this.table = enhancedClient.table(tableName, TableSchema.fromBean(ImageMetadataItem.class));
    }
    
    @Override
    public void upsert(MetadataRecord record) {
        try {
            table.putItem(ImageMetadataItem.from(record));
            log.debug("Upserted metadata: table={}, imageName={}", tableName, record.imageName());
        } catch (SdkException e) {
            throw new MetadataStoreException(
                "Failed to upsert metadata for " + record.imageName() + " in " + tableName + ": " + e.getMessage(), e);
        }
    }
    
    @Override
    public Optional<MetadataRecord> findByImageName(String imageName) {
        try {
            ImageMetadataItem item = table.getItem(Key.builder().partitionValue(imageName).build());
            return Optional.ofNullable(item).map(ImageMetadataItem::toRecord);
        } catch (SdkException e) {
            throw new MetadataStoreException(
                "Failed to read metadata for " + imageName + " from " + tableName + ": " + e.getMessage(), e);
        }
    }
    
    @Override
    public boolean isReachable() {
        try {
            dynamoDbClient.describeTable(DescribeTableRequest.builder()
                    .tableName(tableName)
                    .build());
            return true;
        } catch (SdkException e) {
            log.debug("Table check failed: table={}, error={}", tableName, e.getMessage());
            return false;
        }
    }
}
