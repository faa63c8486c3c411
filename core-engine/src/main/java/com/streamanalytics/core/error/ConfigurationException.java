package com.streamanalytics.core.error;

/**
 * Thrown when engine configuration is invalid or cannot be loaded.
 *
 * @since 1.0.0
 */
public class ConfigurationException extends AnalyticsException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
