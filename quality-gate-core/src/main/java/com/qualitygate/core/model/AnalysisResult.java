package com.qualitygate.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Output of one analyzer for one run.
 *
 * @param category category the analyzer reports on
 * @param score analyzer score, clamped to [0, 100]
 * @param status status derived from the score
 * @param findings ordered findings
 * @param metrics analyzer-specific metrics (may be null for third-party analyzers)
 * @param executionTime time spent in the analyzer
 */
public record AnalysisResult(
    AnalysisCategory category,
    double score,
    AnalysisStatus status,
    List<Finding> findings,
    AnalysisMetrics metrics,
    Duration executionTime
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public AnalysisResult {
        Objects.requireNonNull(category, "category must not be null");
        score = Math.max(0, Math.min(100, score));
        if (status == null) {
            status = AnalysisStatus.fromScore(score);
        }
        findings = findings == null ? List.of() : List.copyOf(findings);
        if (executionTime == null) {
            executionTime = Duration.ZERO;
        }
    }

    /**
     * Returns the metrics payload cast to the expected type.
     *
     * @param type expected metrics type
     * @param <T> metrics type
     * @return metrics, or null if absent or of another type
     */
    public <T extends AnalysisMetrics> T metricsAs(Class<T> type) {
        return type.isInstance(metrics) ? type.cast(metrics) : null;
    }
}
