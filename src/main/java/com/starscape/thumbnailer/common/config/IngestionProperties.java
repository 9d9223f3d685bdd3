package com.starscape.thumbnailer.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thumbnail ingestion.
 * Binds to app.ingest.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.ingest")
public class IngestionProperties {
    
    private String destinationBucket;
    private String metadataTable;
    private boolean diagnosticsEnabled = false;
    private boolean redeliverOnFailure = true;
    
    public String getDestinationBucket() {
        return destinationBucket;
    }
    
    public void setDestinationBucket(String destinationBucket) {
        this.destinationBucket = destinationBucket;
    }
    
    public String getMetadataTable() {
        return metadataTable;
    }
    
    public void setMetadataTable(String metadataTable) {
        this.metadataTable = metadataTable;
    }
    
    public boolean isDiagnosticsEnabled() {
        return diagnosticsEnabled;
    }
    
    public void setDiagnosticsEnabled(boolean diagnosticsEnabled) {
        this.diagnosticsEnabled = diagnosticsEnabled;
    }
    
    public boolean isRedeliverOnFailure() {
        return redeliverOnFailure;
    }
    
    public void setRedeliverOnFailure(boolean redeliverOnFailure) {
        this.redeliverOnFailure = redeliverOnFailure;
    }
}
