package com.mediaanalytics.etl.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Typed lookups over an environment map. Unparseable numbers fall back to the default with a warning.
 */
final class EnvironmentValues {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnvironmentValues.class);

    private final Map<String, String> env;

    EnvironmentValues(Map<String, String> env) {
        this.env = env;
    }

    String getString(String name, String defaultValue) {
        String value = env.get(name);
        if (value != null && !value.isEmpty()) {
            return value;
        }
        return defaultValue;
    }

    int getInt(String name, int defaultValue) {
        String value = env.get(name);
        if (value != null && !value.isEmpty()) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                LOGGER.warn("Invalid {} environment variable: {}, using default {}", name, value, defaultValue);
            }
        }
        return defaultValue;
    }

    static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new ConfigurationException(name, value,
                String.format("must be between %d and %d", min, max));
        }
    }

    static void requireNonBlank(String name, String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new ConfigurationException(name, value, "must be non-empty");
        }
    }
}
