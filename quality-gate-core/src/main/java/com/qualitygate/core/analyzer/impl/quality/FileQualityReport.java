package com.qualitygate.core.analyzer.impl.quality;

import com.qualitygate.core.model.CodeQualityMetrics.LintViolation;

import java.util.List;

/**
 * Cached code quality facts for one file.
 *
 * <p>Holds raw measurements only; thresholds are applied when reports are aggregated so a
 * configuration change does not invalidate cached reports.
 *
 * @param file project-relative path
 * @param lineCount number of lines
 * @param functions detected functions with their estimated complexity
 * @param violations lint violations
 * @param importLines trimmed import statements, used for the duplication estimate
 */
public record FileQualityReport(
    String file,
    int lineCount,
    List<DetectedFunction> functions,
    List<LintViolation> violations,
    List<String> importLines
) {
    public FileQualityReport {
        functions = functions == null ? List.of() : List.copyOf(functions);
        violations = violations == null ? List.of() : List.copyOf(violations);
        importLines = importLines == null ? List.of() : List.copyOf(importLines);
    }

    /**
     * @param name function name
     * @param line 1-based declaration line
     * @param complexity estimated cyclomatic complexity
     */
    public record DetectedFunction(String name, int line, int complexity) {}
}
