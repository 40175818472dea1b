package com.qualitygate.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The single artifact a run hands to reporting.
 *
 * @param overall overall score, grade and status
 * @param componentScores sub-score per enabled category, in category order
 * @param findings merged and deduplicated findings
 * @param recommendations ranked, size-capped recommendations
 * @param trend trend against previous runs, or null when history is disabled
 * @param metadata run metadata
 */
public record ScoringResult(
    OverallScore overall,
    Map<AnalysisCategory, ComponentScore> componentScores,
    List<Finding> findings,
    List<Recommendation> recommendations,
    TrendData trend,
    ResultMetadata metadata
) {
    /**
     * Compact constructor with validation and immutable copies.
     */
    public ScoringResult {
        Objects.requireNonNull(overall, "overall must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        componentScores = componentScores == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(componentScores));
        findings = findings == null ? List.of() : List.copyOf(findings);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /**
     * Returns a copy of this result with the given trend attached.
     *
     * @param trend trend data
     * @return new result
     */
    public ScoringResult withTrend(TrendData trend) {
        return new ScoringResult(overall, componentScores, findings, recommendations, trend, metadata);
    }

    /**
     * Sum of the weights of all scored categories.
     *
     * @return total weight
     */
    public double totalWeight() {
        return componentScores.values().stream().mapToDouble(ComponentScore::weight).sum();
    }
}
