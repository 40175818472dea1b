package com.qualitygate.core.monitor;

import java.time.Duration;

/**
 * Execution record of one analyzer in a run.
 *
 * @param name analyzer name
 * @param fileCount files handed to the analyzer
 * @param executionTime wall-clock time including retries
 * @param success whether the analyzer produced a result
 * @param errorMessage failure reason, null on success
 */
public record AnalyzerTiming(
    String name,
    int fileCount,
    Duration executionTime,
    boolean success,
    String errorMessage
) {}
