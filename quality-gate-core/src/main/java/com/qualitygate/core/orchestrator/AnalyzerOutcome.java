package com.qualitygate.core.orchestrator;

import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.AnalysisResult;

import java.time.Duration;
import java.util.Objects;

/**
 * Settled state of one analyzer invocation. Exactly one of {@code result} and
 * {@code failureReason} is set.
 *
 * @param category analyzer category
 * @param analyzerName analyzer name
 * @param result analysis result, null on failure
 * @param failureReason failure or timeout description, null on success
 * @param attempts attempts made, including the first
 * @param elapsed wall-clock time over all attempts
 */
public record AnalyzerOutcome(
    AnalysisCategory category,
    String analyzerName,
    AnalysisResult result,
    String failureReason,
    int attempts,
    Duration elapsed
) {
    public AnalyzerOutcome {
        Objects.requireNonNull(category, "category must not be null");
        if ((result == null) == (failureReason == null)) {
            throw new IllegalArgumentException("An outcome holds either a result or a failure reason");
        }
    }

    public static AnalyzerOutcome success(AnalysisCategory category, String analyzerName, AnalysisResult result,
                                          int attempts, Duration elapsed) {
        return new AnalyzerOutcome(category, analyzerName, result, null, attempts, elapsed);
    }

    public static AnalyzerOutcome failure(AnalysisCategory category, String analyzerName, String reason,
                                          int attempts, Duration elapsed) {
        return new AnalyzerOutcome(category, analyzerName, null, reason, attempts, elapsed);
    }

    public boolean succeeded() {
        return result != null;
    }
}
