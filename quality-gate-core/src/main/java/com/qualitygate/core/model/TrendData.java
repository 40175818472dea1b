package com.qualitygate.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Score trend relative to the rolling history window.
 *
 * @param currentScore score of this run
 * @param previousScore score of the previous run, or null on the first run
 * @param changePercent relative change against the previous run, or null on the first run
 * @param direction overall direction
 * @param lastFiveScores most recent scores, oldest first, including this run
 * @param componentTrends direction per category
 */
public record TrendData(
    double currentScore,
    Double previousScore,
    Double changePercent,
    TrendDirection direction,
    List<Double> lastFiveScores,
    Map<AnalysisCategory, TrendDirection> componentTrends
) {
    public TrendData {
        Objects.requireNonNull(direction, "direction must not be null");
        lastFiveScores = lastFiveScores == null ? List.of() : List.copyOf(lastFiveScores);
        componentTrends = componentTrends == null ? Map.of() : Map.copyOf(componentTrends);
    }
}
