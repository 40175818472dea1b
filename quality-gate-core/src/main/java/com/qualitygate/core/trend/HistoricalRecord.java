package com.qualitygate.core.trend;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.ComponentScore;
import com.qualitygate.core.model.Grade;
import com.qualitygate.core.model.ScoringResult;

import java.util.EnumMap;
import java.util.Map;

/**
 * One scored run in the trend history.
 *
 * @param timestamp run time in epoch milliseconds
 * @param runId run identifier
 * @param overallScore overall score
 * @param grade letter grade
 * @param componentScores sub-score per scored category
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoricalRecord(
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("runId") String runId,
    @JsonProperty("overallScore") double overallScore,
    @JsonProperty("grade") Grade grade,
    @JsonProperty("componentScores") Map<AnalysisCategory, Double> componentScores
) {
    public HistoricalRecord {
        componentScores = componentScores == null ? Map.of() : Map.copyOf(componentScores);
    }

    public static HistoricalRecord from(ScoringResult result) {
        Map<AnalysisCategory, Double> scores = new EnumMap<>(AnalysisCategory.class);
        for (Map.Entry<AnalysisCategory, ComponentScore> entry : result.componentScores().entrySet()) {
            scores.put(entry.getKey(), entry.getValue().score());
        }
        return new HistoricalRecord(
            result.metadata().timestamp().toEpochMilli(),
            result.metadata().runId(),
            result.overall().score(),
            result.overall().grade(),
            scores);
    }
}
