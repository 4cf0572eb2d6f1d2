package com.mediaanalytics.etl.config;

/**
 * Raised when a configuration value is missing or invalid and cannot fall back to a default.
 */
public class ConfigurationException extends RuntimeException {
    private final String name;

    public ConfigurationException(String name, Object value, String message) {
        super(String.format("Invalid value %s for configuration %s: %s", value, name, message));
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
