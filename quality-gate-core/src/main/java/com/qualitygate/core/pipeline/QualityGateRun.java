package com.qualitygate.core.pipeline;

import com.qualitygate.core.change.ChangeType;
import com.qualitygate.core.change.FileChange;
import com.qualitygate.core.model.ScoringResult;
import com.qualitygate.core.monitor.PerformanceReport;

import java.util.List;
import java.util.Objects;

/**
 * Everything one pipeline run produced.
 *
 * @param scoringResult score, findings, recommendations and trend
 * @param performanceReport timings of the run
 * @param changes change classification of every input file
 */
public record QualityGateRun(
    ScoringResult scoringResult,
    PerformanceReport performanceReport,
    List<FileChange> changes
) {
    public QualityGateRun {
        Objects.requireNonNull(scoringResult, "scoringResult must not be null");
        Objects.requireNonNull(performanceReport, "performanceReport must not be null");
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public boolean passed() {
        return scoringResult.overall().passed();
    }

    /**
     * @return number of files that were added or modified since the previous run
     */
    public long changedFileCount() {
        return changes.stream()
            .filter(change -> change.type() == ChangeType.ADDED || change.type() == ChangeType.MODIFIED)
            .count();
    }
}
