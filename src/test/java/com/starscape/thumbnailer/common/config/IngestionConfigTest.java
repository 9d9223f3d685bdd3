package com.starscape.thumbnailer.common.config;

import com.starscape.thumbnailer.common.exception.ConfigurationMissingException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.NestedExceptionUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestionConfigTest {
    
    @Configuration
    @EnableConfigurationProperties({IngestionProperties.class, ThumbnailProperties.class})
    static class PropertiesConfig {
    }
    
    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class, IngestionConfig.class);
    
    @Test
    void shouldBindSettingsWithDefaultThumbnailPolicy() {
        contextRunner
            .withPropertyValues(
                "app.ingest.destination-bucket=uploads-thumbnails",
                "app.ingest.metadata-table=image-metadata")
            .run(context -> {
                IngestionSettings settings = context.getBean(IngestionSettings.class);
                assertThat(settings.destinationBucket()).isEqualTo("uploads-thumbnails");
                assertThat(settings.metadataTable()).isEqualTo("image-metadata");
                assertThat(settings.maxWidth()).isEqualTo(100);
                assertThat(settings.maxHeight()).isEqualTo(100);
                assertThat(settings.quality()).isEqualTo(0.85f);
                assertThat(settings.keyPrefix()).isEqualTo("thumbnails/");
                assertThat(settings.diagnosticsEnabled()).isFalse();
                assertThat(settings.redeliverOnFailure()).isTrue();
                assertThat(settings.maxSourcePixels()).isEqualTo(IngestionSettings.DEFAULT_MAX_SOURCE_PIXELS);
            });
    }
    
    @Test
    void shouldBindOverriddenThumbnailPolicy() {
        contextRunner
            .withPropertyValues(
                "app.ingest.destination-bucket=thumbs",
                "app.ingest.metadata-table=images",
                "app.ingest.diagnostics-enabled=true",
                "app.thumbnail.max-width=200",
                "app.thumbnail.max-height=150",
                "app.thumbnail.quality=0.5",
                "app.thumbnail.key-prefix=small/",
                "app.thumbnail.max-source-pixels=25000000")
            .run(context -> {
                IngestionSettings settings = context.getBean(IngestionSettings.class);
                assertThat(settings.maxWidth()).isEqualTo(200);
                assertThat(settings.maxHeight()).isEqualTo(150);
                assertThat(settings.quality()).isEqualTo(0.5f);
                assertThat(settings.keyPrefix()).isEqualTo("small/");
                assertThat(settings.diagnosticsEnabled()).isTrue();
                assertThat(settings.maxSourcePixels()).isEqualTo(25_000_000L);
            });
    }
    
    @Test
    void shouldFailStartupWithoutDestinationBucket() {
        contextRunner
            .withPropertyValues("app.ingest.metadata-table=image-metadata")
            .run(context -> {
                assertThat(context).hasFailed();
                Throwable rootCause = NestedExceptionUtils.getMostSpecificCause(context.getStartupFailure());
                assertThat(rootCause)
                    .isInstanceOf(ConfigurationMissingException.class)
                    .hasMessage("Missing required configuration: app.ingest.destination-bucket");
            });
    }
    
    @Test
    void shouldFailStartupWithBlankMetadataTable() {
        contextRunner
            .withPropertyValues(
                "app.ingest.destination-bucket=thumbs",
                "app.ingest.metadata-table=  ")
            .run(context -> {
                assertThat(context).hasFailed();
                Throwable rootCause = NestedExceptionUtils.getMostSpecificCause(context.getStartupFailure());
                assertThat(((ConfigurationMissingException) rootCause).getProperty())
                    .isEqualTo("app.ingest.metadata-table");
            });
    }
    
    @Test
    void shouldRejectInvalidThumbnailPolicy() {
        assertThatThrownBy(() -> new IngestionSettings("thumbs", "images", 0, 100, 0.85f, "", false, true))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("0x100");
        assertThatThrownBy(() -> new IngestionSettings("thumbs", "images", 100, 100, 1.5f, "", false, true))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("quality");
        assertThatThrownBy(() -> new IngestionSettings("thumbs", "images", 100, 100, 0f, "", false, true))
            .isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    void shouldRejectNonPositivePixelLimit() {
        assertThatThrownBy(() -> new IngestionSettings("thumbs", "images", 100, 100, 0.85f, "", false, true, 0L))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pixel limit");
    }
    
    @Test
    void shouldCollapseRepeatedSlashesInKeyPrefix() {
        IngestionSettings settings = new IngestionSettings(
            "thumbs", "images", 100, 100, 0.85f, "thumbs//small///", false, true);
        
        assertThat(settings.keyPrefix()).isEqualTo("thumbs/small/");
    }
    
    @Test
    void shouldTreatMissingKeyPrefixAsEmpty() {
        IngestionSettings settings = new IngestionSettings("thumbs", "images", 100, 100, 0.85f, null, false, true);
        
        assertThat(settings.keyPrefix()).isEmpty();
    }
}
