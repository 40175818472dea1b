package com.qualitygate.core.model;

import java.util.List;

/**
 * Metrics produced by the security analyzer.
 *
 * @param vulnerabilities known vulnerable dependencies (at most 20)
 * @param codePatterns insecure code patterns (at most 20)
 * @param performanceIssues performance smells (at most 20)
 */
public record SecurityMetrics(
    List<Vulnerability> vulnerabilities,
    List<SecurityPattern> codePatterns,
    List<PerformanceIssue> performanceIssues
) implements AnalysisMetrics {

    public SecurityMetrics {
        vulnerabilities = vulnerabilities == null ? List.of() : List.copyOf(vulnerabilities);
        codePatterns = codePatterns == null ? List.of() : List.copyOf(codePatterns);
        performanceIssues = performanceIssues == null ? List.of() : List.copyOf(performanceIssues);
    }

    public long vulnerabilitiesWithSeverity(Severity severity) {
        return vulnerabilities.stream().filter(v -> v.severity() == severity).count();
    }

    public long patternsWithSeverity(Severity severity) {
        return codePatterns.stream().filter(p -> p.severity() == severity).count();
    }

    public record Vulnerability(
        String packageName,
        Severity severity,
        String title,
        String range,
        boolean fixAvailable
    ) {}

    public record SecurityPattern(
        String file,
        int line,
        String type,
        Severity severity,
        String evidence,
        String remediation
    ) {}

    public record PerformanceIssue(
        String file,
        int line,
        String type,
        Severity severity,
        String suggestion
    ) {}
}
