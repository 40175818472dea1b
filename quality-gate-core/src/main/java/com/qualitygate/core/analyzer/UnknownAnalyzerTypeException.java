package com.qualitygate.core.analyzer;

import com.qualitygate.core.QualityGateException;

import java.util.Collection;

/**
 * Thrown when no analyzer is registered under a requested type.
 */
public class UnknownAnalyzerTypeException extends QualityGateException {

    public static final String CODE = "UNKNOWN_ANALYZER";

    public UnknownAnalyzerTypeException(String type, Collection<String> registeredTypes) {
        super(CODE, "Unknown analyzer type: " + type + ". Registered types: " + String.join(", ", registeredTypes));
    }
}
