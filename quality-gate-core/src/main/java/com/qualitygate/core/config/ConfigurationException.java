package com.qualitygate.core.config;

import com.qualitygate.core.QualityGateException;

import java.util.List;

/**
 * Thrown when configuration cannot be loaded or violates an invariant.
 *
 * <p>Raised before any analyzer runs.
 */
public class ConfigurationException extends QualityGateException {

    public static final String CODE = "CONFIG_ERROR";

    private final List<String> errors;

    public ConfigurationException(String message) {
        super(CODE, message);
        this.errors = List.of(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(CODE, message, cause);
        this.errors = List.of(message);
    }

    public ConfigurationException(List<String> errors) {
        super(CODE, "Invalid configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * Returns the individual validation errors.
     *
     * @return validation errors
     */
    public List<String> getErrors() {
        return errors;
    }
}
