package com.qualitygate.core.monitor;

import com.qualitygate.core.cache.CacheStatistics;
import com.qualitygate.core.model.TrendDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Tracks run time, analyzer timings, cache efficiency and change rate of pipeline runs.
 *
 * <p>A run is bracketed by {@link #start()} and {@link #end()}. Analyzer timings may be recorded
 * concurrently from orchestrator threads. The last {@value #MAX_HISTORY} reports are kept in
 * memory for {@link #getTrend()} and {@link #getAverageMetrics()}.
 */
public class PerformanceMonitor {

    private static final Logger log = LoggerFactory.getLogger(PerformanceMonitor.class);

    public static final int MAX_HISTORY = 100;
    public static final Duration DEFAULT_THRESHOLD = Duration.ofSeconds(2);

    private static final double TREND_THRESHOLD_PERCENT = 5;
    private static final double MIN_PARALLEL_EFFICIENCY = 50;
    private static final double MIN_CACHE_HIT_RATE = 30;
    private static final double MAX_CHANGE_RATE = 80;
    private static final double MAX_MILLIS_PER_FILE = 1;
    private static final int EXPECTED_ANALYZERS = 4;

    /**
     * Averages over the report history.
     */
    public record AverageMetrics(
        double averageMillis,
        double averageFileCount,
        double averageCacheHitRate,
        double averageParallelEfficiency
    ) {}

    private final Duration threshold;
    private final LongSupplier nanoTime;
    private final Clock clock;

    private final Map<String, AnalyzerTiming> analyzers = new LinkedHashMap<>();
    private final List<PerformanceReport> history = new ArrayList<>();
    private CacheStatistics cacheStatistics;
    private ChangeDetectionSnapshot changeDetection;
    private int fileCount;
    private long startNanos;

    public PerformanceMonitor() {
        this(DEFAULT_THRESHOLD);
    }

    public PerformanceMonitor(Duration threshold) {
        this(threshold, System::nanoTime, Clock.systemUTC());
    }

    PerformanceMonitor(Duration threshold, LongSupplier nanoTime, Clock clock) {
        this.threshold = threshold;
        this.nanoTime = nanoTime;
        this.clock = clock;
    }

    // ==================== Recording ====================

    /**
     * Starts a run, discarding figures recorded for the previous one.
     */
    public synchronized void start() {
        analyzers.clear();
        cacheStatistics = null;
        changeDetection = null;
        fileCount = 0;
        startNanos = nanoTime.getAsLong();
        log.debug("Performance monitoring started");
    }

    public synchronized void recordAnalyzer(String name, int fileCount, Duration duration,
                                            boolean success, String errorMessage) {
        analyzers.put(name, new AnalyzerTiming(name, fileCount, duration, success, errorMessage));
        log.debug("Recorded analyzer {}: {} ms", name, duration.toMillis());
    }

    public synchronized void recordCache(CacheStatistics statistics) {
        this.cacheStatistics = statistics;
        log.debug("Cache performance: {}% hit rate ({} hits, {} misses)",
            String.format("%.1f", statistics.hitRate()), statistics.hits(), statistics.misses());
    }

    public synchronized void recordChangeDetection(int totalFiles, int changedFiles, Duration detectionTime) {
        this.changeDetection = ChangeDetectionSnapshot.of(totalFiles, changedFiles, detectionTime);
        log.debug("Change detection: {}/{} files changed", changedFiles, totalFiles);
    }

    public void recordChangeDetection(int totalFiles, int changedFiles) {
        recordChangeDetection(totalFiles, changedFiles, Duration.ZERO);
    }

    public synchronized void setFileCount(int fileCount) {
        this.fileCount = fileCount;
    }

    /**
     * Ends the run and builds its report, which is added to the history.
     *
     * @return report of the run
     */
    public synchronized PerformanceReport end() {
        Duration totalTime = Duration.ofNanos(Math.max(0, nanoTime.getAsLong() - startNanos));
        List<AnalyzerTiming> timings = List.copyOf(analyzers.values());

        double totalMillis = totalTime.toNanos() / 1_000_000.0;
        double serialMillis = timings.stream()
            .mapToDouble(timing -> timing.executionTime().toNanos() / 1_000_000.0)
            .sum();
        double parallelRatio = serialMillis > 0 && totalMillis > 0 ? serialMillis / totalMillis : 1;
        double averageMillisPerFile = fileCount > 0 ? totalMillis / fileCount : 0;
        boolean thresholdExceeded = totalTime.compareTo(threshold) > 0;

        ChangeDetectionSnapshot changes = changeDetection != null
            ? changeDetection
            : ChangeDetectionSnapshot.allChanged(fileCount);
        CacheStatistics cache = cacheStatistics != null ? cacheStatistics : CacheStatistics.empty();

        PerformanceReport report = new PerformanceReport(clock.instant(), totalTime, fileCount, timings, cache,
            changes, parallelRatio * 100, parallelRatio, averageMillisPerFile, thresholdExceeded, List.of());
        report = report.withRecommendations(generateRecommendations(report));

        history.add(report);
        if (history.size() > MAX_HISTORY) {
            history.subList(0, history.size() - MAX_HISTORY).clear();
        }

        log.info("Performance report generated: {} ms", totalTime.toMillis());
        if (thresholdExceeded) {
            log.warn("Analysis exceeded threshold: {} ms > {} ms", totalTime.toMillis(), threshold.toMillis());
        }
        return report;
    }

    private List<String> generateRecommendations(PerformanceReport report) {
        List<String> recommendations = new ArrayList<>();
        if (report.thresholdExceeded()) {
            recommendations.add(String.format("Analysis took %d ms (threshold: %d ms)",
                report.totalTime().toMillis(), threshold.toMillis()));
        }
        if (report.parallelEfficiency() < MIN_PARALLEL_EFFICIENCY) {
            recommendations.add(String.format(
                "Low parallelization efficiency (%.1f%%). Consider enabling caching or reducing analyzer work.",
                report.parallelEfficiency()));
        }
        if (report.cache().hitRate() < MIN_CACHE_HIT_RATE) {
            recommendations.add(String.format(
                "Low cache hit rate (%.1f%%). Files are changing frequently or the cache TTL is too low.",
                report.cache().hitRate()));
        }
        if (report.changeDetection().changeRate() > MAX_CHANGE_RATE) {
            recommendations.add(String.format(
                "High file change rate (%.1f%%). Most files are changing between runs.",
                report.changeDetection().changeRate()));
        }
        if (report.averageMillisPerFile() > MAX_MILLIS_PER_FILE) {
            recommendations.add(String.format(
                "High time per file (%.2f ms). Consider optimizing analyzer logic.",
                report.averageMillisPerFile()));
        }
        if (report.analyzerCount() < EXPECTED_ANALYZERS) {
            recommendations.add(String.format(
                "Only %d analyzer(s) ran. Enable more for a comprehensive analysis.", report.analyzerCount()));
        }
        return recommendations;
    }

    // ==================== History ====================

    /**
     * Compares the last two reports; a change beyond 5% either way is a trend.
     *
     * @return run time trend
     */
    public synchronized PerformanceTrend getTrend() {
        if (history.isEmpty()) {
            return PerformanceTrend.none();
        }
        Duration current = history.get(history.size() - 1).totalTime();
        if (history.size() < 2) {
            return new PerformanceTrend(current, null, null, null);
        }
        Duration previous = history.get(history.size() - 2).totalTime();
        if (previous.isZero()) {
            return new PerformanceTrend(current, previous, null, TrendDirection.STABLE);
        }

        double changePercent = (current.toNanos() - previous.toNanos()) * 100.0 / previous.toNanos();
        TrendDirection direction;
        if (changePercent < -TREND_THRESHOLD_PERCENT) {
            direction = TrendDirection.IMPROVING;
        } else if (changePercent > TREND_THRESHOLD_PERCENT) {
            direction = TrendDirection.DEGRADING;
        } else {
            direction = TrendDirection.STABLE;
        }
        return new PerformanceTrend(current, previous, changePercent, direction);
    }

    public synchronized AverageMetrics getAverageMetrics() {
        if (history.isEmpty()) {
            return new AverageMetrics(0, 0, 0, 0);
        }
        return new AverageMetrics(
            history.stream().mapToDouble(r -> r.totalTime().toNanos() / 1_000_000.0).average().orElse(0),
            history.stream().mapToInt(PerformanceReport::fileCount).average().orElse(0),
            history.stream().mapToDouble(r -> r.cache().hitRate()).average().orElse(0),
            history.stream().mapToDouble(PerformanceReport::parallelEfficiency).average().orElse(0));
    }

    public synchronized List<PerformanceReport> getHistory() {
        return List.copyOf(history);
    }

    public synchronized void clearHistory() {
        history.clear();
    }

    // ==================== Formatting ====================

    /**
     * Renders a report as plain text.
     *
     * @param report report to render
     * @return multi-line text
     */
    public String formatReport(PerformanceReport report) {
        StringBuilder out = new StringBuilder();
        out.append("=== PERFORMANCE REPORT ===\n\n");
        out.append("Timestamp: ").append(report.timestamp()).append('\n');
        out.append("Total Time: ").append(report.totalTime().toMillis()).append(" ms\n");
        out.append("Files Analyzed: ").append(report.fileCount()).append('\n');
        out.append("Analyzers: ").append(report.analyzerCount()).append("\n\n");

        out.append("--- Analyzer Performance ---\n");
        for (AnalyzerTiming timing : report.analyzers()) {
            out.append(String.format("%s: %d ms (%d files)%n",
                timing.name(), timing.executionTime().toMillis(), timing.fileCount()));
            if (!timing.success()) {
                out.append("  ERROR: ").append(timing.errorMessage()).append('\n');
            }
        }

        out.append("\n--- Cache Performance ---\n");
        out.append(String.format("Hit Rate: %.1f%%%n", report.cache().hitRate()));
        out.append(String.format("Hits: %d, Misses: %d%n", report.cache().hits(), report.cache().misses()));
        out.append(String.format("Avg Retrieval: %.2f ms%n", report.cache().averageRetrievalMillis()));

        ChangeDetectionSnapshot changes = report.changeDetection();
        out.append("\n--- Change Detection ---\n");
        out.append(String.format("Changed Files: %d/%d (%.1f%%)%n",
            changes.changedFiles(), changes.totalFiles(), changes.changeRate()));

        out.append("\n--- Parallelization ---\n");
        out.append(String.format("Efficiency: %.1f%%%n", report.parallelEfficiency()));
        out.append(String.format("Ratio: %.2fx%n", report.parallelRatio()));

        out.append("\n--- Metrics ---\n");
        out.append(String.format("Avg Time/File: %.2f ms%n", report.averageMillisPerFile()));
        out.append("Status: ").append(report.thresholdExceeded() ? "EXCEEDED THRESHOLD" : "OK").append('\n');

        if (!report.recommendations().isEmpty()) {
            out.append("\n--- Recommendations ---\n");
            report.recommendations().forEach(r -> out.append("- ").append(r).append('\n'));
        }
        return out.toString();
    }
}
