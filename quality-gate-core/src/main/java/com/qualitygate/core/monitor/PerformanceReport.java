package com.qualitygate.core.monitor;

import com.qualitygate.core.cache.CacheStatistics;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Performance figures of one pipeline run.
 *
 * @param timestamp end of the run
 * @param totalTime wall-clock time between {@code start()} and {@code end()}
 * @param fileCount files in the run
 * @param analyzers per-analyzer timings in recording order
 * @param cache cache statistics at the end of the run
 * @param changeDetection change detection figures
 * @param parallelEfficiency summed analyzer time over total time, in percent
 * @param parallelRatio summed analyzer time over total time
 * @param averageMillisPerFile total time per file in milliseconds
 * @param thresholdExceeded whether the total time exceeded the configured threshold
 * @param recommendations tuning hints
 */
public record PerformanceReport(
    Instant timestamp,
    Duration totalTime,
    int fileCount,
    List<AnalyzerTiming> analyzers,
    CacheStatistics cache,
    ChangeDetectionSnapshot changeDetection,
    double parallelEfficiency,
    double parallelRatio,
    double averageMillisPerFile,
    boolean thresholdExceeded,
    List<String> recommendations
) {
    public PerformanceReport {
        analyzers = analyzers == null ? List.of() : List.copyOf(analyzers);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        if (cache == null) {
            cache = CacheStatistics.empty();
        }
    }

    public int analyzerCount() {
        return analyzers.size();
    }

    public PerformanceReport withRecommendations(List<String> recommendations) {
        return new PerformanceReport(timestamp, totalTime, fileCount, analyzers, cache, changeDetection,
            parallelEfficiency, parallelRatio, averageMillisPerFile, thresholdExceeded, recommendations);
    }
}
