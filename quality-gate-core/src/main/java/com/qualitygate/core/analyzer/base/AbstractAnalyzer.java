package com.qualitygate.core.analyzer.base;

import com.qualitygate.core.analyzer.AnalysisContext;
import com.qualitygate.core.analyzer.AnalysisException;
import com.qualitygate.core.analyzer.Analyzer;
import com.qualitygate.core.analyzer.AnalyzerSettings;
import com.qualitygate.core.cache.CacheKey;
import com.qualitygate.core.cache.ResultCache;
import com.qualitygate.core.model.AnalysisMetrics;
import com.qualitygate.core.model.AnalysisResult;
import com.qualitygate.core.model.AnalysisStatus;
import com.qualitygate.core.model.FileLocation;
import com.qualitygate.core.model.Finding;
import com.qualitygate.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Abstract base class for analyzer implementations providing common functionality.
 *
 * <p>This class reduces code duplication across analyzers by providing:
 * <ul>
 *   <li>Logger initialization (one logger per analyzer class)</li>
 *   <li>Timing and exception wrapping around {@link #doAnalyze(AnalysisContext)}</li>
 *   <li>Cached per-file analysis ({@link #analyzeFile(AnalysisContext, String, Class, FileAnalysis)})</li>
 *   <li>Fail-open file reading ({@link #readFileContent(AnalysisContext, String)})</li>
 *   <li>Result and finding helpers ({@link #buildResult}, {@link #finding})</li>
 * </ul>
 *
 * <p>Concrete analyzers typically analyze each file through {@code analyzeFile()} into a small
 * serializable report record, aggregate the reports into metrics, derive findings and return
 * {@code buildResult()}. Per-invocation state lives in local variables only.
 *
 * @see Analyzer
 * @see AnalysisContext
 */
public abstract class AbstractAnalyzer implements Analyzer {

    /**
     * Logger instance for this analyzer.
     * Automatically initialized with the concrete analyzer class name.
     */
    protected final Logger log;

    private final AnalyzerSettings settings;

    protected AbstractAnalyzer(AnalyzerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public AnalyzerSettings getSettings() {
        return settings;
    }

    @Override
    public String getType() {
        return getCategory().analyzerType();
    }

    @Override
    public boolean validate() {
        if (settings.name().isBlank()) {
            log.warn("Analyzer of type '{}' has no name", getType());
            return false;
        }
        if (settings.timeout().isZero() || settings.timeout().isNegative()) {
            log.warn("{} has a non-positive timeout: {}", getName(), settings.timeout());
            return false;
        }
        if (!settings.enabled()) {
            log.debug("{} is disabled", getName());
            return false;
        }
        return true;
    }

    @Override
    public final AnalysisResult analyze(AnalysisContext context) {
        long start = System.nanoTime();
        AnalysisResult result;
        try {
            result = doAnalyze(context);
        } catch (AnalysisException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AnalysisException(getName() + " failed: " + e.getMessage(), e);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        log.info("{} complete: score {} with {} findings in {} ms",
            getName(), String.format("%.1f", result.score()), result.findings().size(), elapsed.toMillis());

        return new AnalysisResult(result.category(), result.score(), result.status(),
            result.findings(), result.metrics(), elapsed);
    }

    /**
     * Performs the analysis. Timing and exception wrapping are handled by the caller.
     *
     * @param context run context
     * @return analysis result (execution time is filled in afterwards)
     */
    protected abstract AnalysisResult doAnalyze(AnalysisContext context);

    // ==================== Cached Per-File Analysis ====================

    /**
     * Computes a per-file report from file content.
     *
     * @param <T> report type
     */
    @FunctionalInterface
    protected interface FileAnalysis<T> {
        T analyze(String file, String content);
    }

    /**
     * Analyzes one file, reusing the cached report when the file is unchanged.
     *
     * <p>The cache key is this analyzer's category plus the file path. A fresh report is
     * written back to the cache. Unreadable files produce an empty result.
     *
     * @param context run context
     * @param file project-relative path
     * @param reportType report record type (must be JSON-serializable)
     * @param analysis computation for a cache miss
     * @param <T> report type
     * @return the report, or empty if the file could not be read
     */
    protected <T> Optional<T> analyzeFile(AnalysisContext context, String file, Class<T> reportType,
                                          FileAnalysis<T> analysis) {
        ResultCache cache = context.cache();
        CacheKey key = CacheKey.of(getCategory().id(), file);

        if (!cache.hasChanged(key)) {
            Optional<T> cached = cache.get(key, reportType);
            if (cached.isPresent()) {
                return cached;
            }
        }

        Optional<String> content = readFileContent(context, file);
        if (content.isEmpty()) {
            return Optional.empty();
        }
        T report = analysis.analyze(file, content.get());
        cache.set(key, report);
        return Optional.of(report);
    }

    // ==================== File Reading Utilities ====================

    /**
     * Reads a project file, logging and returning empty when it cannot be read.
     *
     * @param context run context
     * @param file project-relative path
     * @return file content, or empty if unreadable
     */
    protected Optional<String> readFileContent(AnalysisContext context, String file) {
        try {
            return Optional.of(Files.readString(context.resolve(file)));
        } catch (IOException | RuntimeException e) {
            log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Checks whether a path looks like a test file ({@code .test.} or {@code .spec.}).
     *
     * @param file project-relative path
     * @return true for test files
     */
    protected boolean isTestFile(String file) {
        return file.contains(".test.") || file.contains(".spec.") || file.contains("__tests__/");
    }

    // ==================== Result Creation Helpers ====================

    /**
     * Builds a result for this analyzer's category with the status derived from the score.
     *
     * @param score score, clamped to [0, 100]
     * @param findings findings in report order
     * @param metrics metrics payload
     * @return analysis result
     */
    protected AnalysisResult buildResult(double score, List<Finding> findings, AnalysisMetrics metrics) {
        double clamped = Math.max(0, Math.min(100, score));
        return new AnalysisResult(getCategory(), clamped, AnalysisStatus.fromScore(clamped),
            findings, metrics, Duration.ZERO);
    }

    /**
     * Creates a finding in this analyzer's category.
     */
    protected Finding finding(String id, Severity severity, String title, String description,
                              String remediation, FileLocation location, String evidence) {
        return new Finding(id, severity, getCategory(), title, description, remediation, location, evidence);
    }
}
