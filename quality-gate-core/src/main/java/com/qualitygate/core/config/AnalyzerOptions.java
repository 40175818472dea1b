package com.qualitygate.core.config;

/**
 * Settings shared by every analyzer section of the configuration.
 */
public interface AnalyzerOptions {

    Boolean enabled();

    Long timeoutSeconds();

    Integer retryAttempts();

    default boolean isEnabled() {
        return !Boolean.FALSE.equals(enabled());
    }
}
