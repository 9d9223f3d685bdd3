package com.starscape.thumbnailer.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thumbnail rendering.
 * Binds to app.thumbnail.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.thumbnail")
public class ThumbnailProperties {
    
    private int maxWidth = 100;
    private int maxHeight = 100;
    private float quality = 0.85f;
    private String keyPrefix = "thumbnails/";
    private long maxSourcePixels = IngestionSettings.DEFAULT_MAX_SOURCE_PIXELS;
    
    public int getMaxWidth() {
        return maxWidth;
    }
    
    public void setMaxWidth(int maxWidth) {
        this.maxWidth = maxWidth;
    }
    
    public int getMaxHeight() {
        return maxHeight;
    }
    
    public void setMaxHeight(int maxHeight) {
        this.maxHeight = maxHeight;
    }
    
    public float getQuality() {
        return quality;
    }
    
    public void setQuality(float quality) {
        this.quality = quality;
    }
    
    public String getKeyPrefix() {
        return keyPrefix;
    }
    
    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }
    
    public long getMaxSourcePixels() {
        return maxSourcePixels;
    }
    
    public void setMaxSourcePixels(long maxSourcePixels) {
        this.maxSourcePixels = maxSourcePixels;
    }
}
