package com.qualitygate.core.analyzer;

import com.qualitygate.core.config.AnalyzerOptions;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-instance analyzer settings.
 *
 * @param name analyzer display name, used in logs and failure reasons
 * @param enabled whether the analyzer may run
 * @param timeout per-attempt deadline enforced by the orchestrator
 * @param retryAttempts additional attempts after a failed or timed-out first attempt
 */
public record AnalyzerSettings(
    String name,
    boolean enabled,
    Duration timeout,
    int retryAttempts
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    public AnalyzerSettings {
        Objects.requireNonNull(name, "name must not be null");
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (retryAttempts < 0) {
            retryAttempts = 0;
        }
    }

    /**
     * Default settings: enabled, 60 second timeout, one retry.
     *
     * @param name analyzer name
     * @return default settings
     */
    public static AnalyzerSettings defaults(String name) {
        return new AnalyzerSettings(name, true, DEFAULT_TIMEOUT, 1);
    }

    /**
     * Builds settings from a configuration section.
     *
     * @param name analyzer name
     * @param options configuration section
     * @return settings
     */
    public static AnalyzerSettings from(String name, AnalyzerOptions options) {
        return new AnalyzerSettings(
            name,
            options.isEnabled(),
            Duration.ofSeconds(options.timeoutSeconds()),
            options.retryAttempts());
    }
}
