package com.qualitygate.core.model;

import java.util.Objects;

/**
 * Overall gate decision.
 *
 * @param score weighted sum of enabled sub-scores
 * @param grade letter grade for the score
 * @param status {@link AnalysisStatus#PASS} iff the score reaches the passing threshold
 * @param summary human-readable summary line
 */
public record OverallScore(
    double score,
    Grade grade,
    AnalysisStatus status,
    String summary
) {
    public OverallScore {
        Objects.requireNonNull(grade, "grade must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public boolean passed() {
        return status == AnalysisStatus.PASS;
    }
}
