package com.qualitygate.core.analyzer.impl.security;

import com.qualitygate.core.model.SecurityMetrics.PerformanceIssue;
import com.qualitygate.core.model.SecurityMetrics.SecurityPattern;

import java.util.List;

/**
 * Cached security and performance matches for one source file.
 */
public record SecurityFileReport(
    String file,
    List<SecurityPattern> patterns,
    List<PerformanceIssue> performanceIssues
) {
    public SecurityFileReport {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        performanceIssues = performanceIssues == null ? List.of() : List.copyOf(performanceIssues);
    }
}
