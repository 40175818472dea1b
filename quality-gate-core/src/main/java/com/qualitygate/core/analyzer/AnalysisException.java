package com.qualitygate.core.analyzer;

import com.qualitygate.core.QualityGateException;

/**
 * Thrown when an analyzer cannot complete its analysis.
 */
public class AnalysisException extends QualityGateException {

    public static final String CODE = "ANALYSIS_ERROR";

    public AnalysisException(String message) {
        super(CODE, message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
