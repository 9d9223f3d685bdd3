package com.starscape.thumbnailer.features.ingestthumbnail.infra;

import com.starscape.thumbnailer.features.ingestthumbnail.domain.MetadataRecord;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * DynamoDB item for one processed image. Partition key is ImageName.
 */
@DynamoDbBean
public class ImageMetadataItem {
    
    private String imageName;
    private String imageSize;
    private String creationDate;
    private String processedDate;
    private String thumbnailKey;
    private String checksum;
    
    public ImageMetadataItem() {
        // Enhanced client constructor
    }
    
    public static ImageMetadataItem from(MetadataRecord record) {
        ImageMetadataItem item = new ImageMetadataItem();
        item.setImageName(record.imageName());
        item.setImageSize(record.imageSizeBytes());
        item.setCreationDate(record.creationTimestamp());
        item.setProcessedDate(record.processedTimestamp());
        item.setThumbnailKey(record.thumbnailKey());
        item.setChecksum(record.checksum());
        return item;
    }
    
    public MetadataRecord toRecord() {
        return new MetadataRecord(imageName, imageSize, creationDate, processedDate, thumbnailKey, checksum);
    }
    
    @DynamoDbPartitionKey
    @DynamoDbAttribute("ImageName")
    public String getImageName() {
        return imageName;
    }
    
    public void setImageName(String imageName) {
        this.imageName = imageName;
    }
    
    @DynamoDbAttribute("ImageSize")
    public String getImageSize() {
        return imageSize;
    }
    
    public void setImageSize(String imageSize) {
        this.imageSize = imageSize;
    }
    
    @DynamoDbAttribute("CreationDate")
    public String getCreationDate() {
        return creationDate;
    }
    
    public void setCreationDate(String creationDate) {
        this.creationDate = creationDate;
    }
    
    @DynamoDbAttribute("ProcessedDate")
    public String getProcessedDate() {
        return processedDate;
    }
    
    public void setProcessedDate(String processedDate) {
        this.processedDate = processedDate;
    }
    
    @DynamoDbAttribute("ThumbnailKey")
    public String getThumbnailKey() {
        return thumbnailKey;
    }
    
    public void setThumbnailKey(String thumbnailKey) {
        this.thumbnailKey = thumbnailKey;
    }
    
    @DynamoDbAttribute("Checksum")
    public String getChecksum() {
        return checksum;
    }
    
    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }
}
