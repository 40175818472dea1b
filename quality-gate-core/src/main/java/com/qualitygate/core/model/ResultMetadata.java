package com.qualitygate.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Run identification attached to a {@link ScoringResult}.
 *
 * @param timestamp when scoring completed
 * @param toolVersion version of the gate
 * @param runId unique run identifier
 * @param projectPath analyzed project root
 * @param analysisTime wall-clock time of the analyzer phase
 * @param degradedCategories enabled categories whose analyzer failed, with the failure reason
 * @param disabledCategories categories excluded by configuration
 */
public record ResultMetadata(
    Instant timestamp,
    String toolVersion,
    String runId,
    String projectPath,
    Duration analysisTime,
    Map<AnalysisCategory, String> degradedCategories,
    List<AnalysisCategory> disabledCategories
) {
    public ResultMetadata {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(runId, "runId must not be null");
        if (analysisTime == null) {
            analysisTime = Duration.ZERO;
        }
        degradedCategories = degradedCategories == null ? Map.of() : Map.copyOf(degradedCategories);
        disabledCategories = disabledCategories == null ? List.of() : List.copyOf(disabledCategories);
    }
}
