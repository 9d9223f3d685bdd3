package com.starscape.thumbnailer.common.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class IngestionConfig {
    
    private static final Logger log = LoggerFactory.getLogger(IngestionConfig.class);
    
    /**
     * Validated settings; a missing destination bucket or metadata table stops the context here.
     */
    @Bean
    public IngestionSettings ingestionSettings(
            IngestionProperties ingestionProperties,
            ThumbnailProperties thumbnailProperties) {
        IngestionSettings settings = IngestionSettings.from(ingestionProperties, thumbnailProperties);
        log.info("Thumbnail ingestion configured: destinationBucket={}, metadataTable={}, bounds={}x{}, quality={}",
            settings.destinationBucket(), settings.metadataTable(),
            settings.maxWidth(), settings.maxHeight(), settings.quality());
        return settings;
    }
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
