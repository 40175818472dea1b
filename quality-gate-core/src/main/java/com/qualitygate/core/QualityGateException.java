package com.qualitygate.core;

/**
 * Root of the quality gate exception hierarchy.
 *
 * <p>Every subclass carries a stable {@link #getCode() code} so front ends can map
 * failures to exit codes without inspecting messages.
 */
public abstract class QualityGateException extends RuntimeException {

    private final String code;

    protected QualityGateException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected QualityGateException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
