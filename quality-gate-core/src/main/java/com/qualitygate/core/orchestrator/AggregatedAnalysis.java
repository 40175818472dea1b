package com.qualitygate.core.orchestrator;

import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.AnalysisResult;
import com.qualitygate.core.model.Finding;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merged outcome of all analyzers of a run.
 *
 * @param results successful results per category
 * @param findings findings of all successful analyzers, deduplicated by id (first occurrence wins)
 * @param failures failure reason per degraded category
 * @param outcomes every outcome in analyzer order
 * @param totalTime time until the last analyzer settled
 */
public record AggregatedAnalysis(
    Map<AnalysisCategory, AnalysisResult> results,
    List<Finding> findings,
    Map<AnalysisCategory, String> failures,
    List<AnalyzerOutcome> outcomes,
    Duration totalTime
) {
    public AggregatedAnalysis {
        results = results == null || results.isEmpty()
            ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(results));
        findings = findings == null ? List.of() : List.copyOf(findings);
        failures = failures == null || failures.isEmpty()
            ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(failures));
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        if (totalTime == null) {
            totalTime = Duration.ZERO;
        }
    }

    public boolean isDegraded() {
        return !failures.isEmpty();
    }
}
