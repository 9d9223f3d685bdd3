package com.starscape.thumbnailer.common.exception;

/**
 * Raised at startup when a required setting is absent.
 * The application context fails to start, so no event is ever attempted with incomplete configuration.
 */
public class ConfigurationMissingException extends IllegalStateException {
    
    private final String property;
    
    public ConfigurationMissingException(String property) {
        super("Missing required configuration: " + property);
        this.property = property;
    }
    
    public String getProperty() {
        return property;
    }
}
