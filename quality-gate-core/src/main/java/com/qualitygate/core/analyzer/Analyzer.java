package com.qualitygate.core.analyzer;

import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.AnalysisResult;

import java.time.Duration;

/**
 * Contract every analysis category implements.
 *
 * <p>An analyzer turns the run's file set into one {@link AnalysisResult} for its
 * {@link AnalysisCategory}. Analyzers are blocking; the orchestrator schedules them
 * concurrently, enforces {@link #getTimeout()} per attempt and retries up to
 * {@link #getRetryAttempts()} times. Implementations must not share mutable state between
 * invocations, since one instance may be reused across runs.
 *
 * <p>Built-in analyzers are registered by {@link AnalyzerRegistry#withBuiltIns()}; third-party
 * analyzers are contributed through {@link AnalyzerProvider}.
 *
 * @see AnalysisContext
 * @see AnalysisResult
 */
public interface Analyzer {

    /**
     * Returns the type key this analyzer is registered under (e.g. "coverage").
     *
     * @return analyzer type key
     */
    String getType();

    /**
     * Returns the category this analyzer reports on.
     *
     * @return analysis category
     */
    AnalysisCategory getCategory();

    /**
     * Returns the settings this instance was created with.
     *
     * @return analyzer settings
     */
    AnalyzerSettings getSettings();

    /**
     * Returns the human-readable name, used in logs and failure reasons.
     *
     * @return analyzer name
     */
    default String getName() {
        return getSettings().name();
    }

    default Duration getTimeout() {
        return getSettings().timeout();
    }

    default int getRetryAttempts() {
        return getSettings().retryAttempts();
    }

    /**
     * Checks enablement and configuration before running.
     *
     * @return true if the analyzer may run
     */
    boolean validate();

    /**
     * Analyzes the file set.
     *
     * <p>Unreadable files are skipped rather than failing the whole analysis. Exceptions
     * thrown here are isolated by the orchestrator and turn the category into a degraded one.
     *
     * @param context run context with files, configuration and cache
     * @return analysis result for this analyzer's category
     * @throws AnalysisException if the analysis cannot complete
     */
    AnalysisResult analyze(AnalysisContext context);
}
