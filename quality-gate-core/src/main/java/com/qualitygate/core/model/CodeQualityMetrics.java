package com.qualitygate.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Metrics produced by the code quality analyzer.
 *
 * @param complexity cyclomatic complexity metrics
 * @param duplication duplication estimate
 * @param linting lint heuristics
 */
public record CodeQualityMetrics(
    ComplexityMetrics complexity,
    DuplicationMetrics duplication,
    LintingMetrics linting
) implements AnalysisMetrics {

    public CodeQualityMetrics {
        Objects.requireNonNull(complexity, "complexity must not be null");
        Objects.requireNonNull(duplication, "duplication must not be null");
        Objects.requireNonNull(linting, "linting must not be null");
    }

    /**
     * Complexity summary over all detected functions.
     *
     * @param functions most complex functions, highest first
     * @param averagePerFile total complexity divided by analyzed file count
     * @param maximum highest complexity seen
     * @param distribution bucket counts over all functions
     */
    public record ComplexityMetrics(
        List<FunctionComplexity> functions,
        double averagePerFile,
        int maximum,
        ComplexityDistribution distribution
    ) {
        public ComplexityMetrics {
            functions = functions == null ? List.of() : List.copyOf(functions);
            if (distribution == null) {
                distribution = new ComplexityDistribution(0, 0, 0);
            }
        }
    }

    /**
     * Function counts per complexity bucket.
     *
     * @param good functions at or below the warning threshold
     * @param warning functions above the warning threshold up to the critical threshold
     * @param critical functions above the critical threshold
     */
    public record ComplexityDistribution(int good, int warning, int critical) {

        public int total() {
            return good + warning + critical;
        }
    }

    /**
     * Complexity of one detected function.
     *
     * @param file project-relative file
     * @param name function name
     * @param line 1-based declaration line
     * @param complexity estimated cyclomatic complexity
     * @param status bucket name: good, warning or critical
     */
    public record FunctionComplexity(
        String file,
        String name,
        int line,
        int complexity,
        String status
    ) {}

    /**
     * @param percent estimated duplicated share of code
     * @param lines estimated duplicated lines
     * @param status bucket name: good, warning or critical
     */
    public record DuplicationMetrics(double percent, int lines, String status) {}

    /**
     * Lint heuristic results.
     *
     * @param errors error-level violations
     * @param warnings warning-level violations
     * @param info info-level violations
     * @param violations all violations
     * @param byRule violation count per rule
     */
    public record LintingMetrics(
        int errors,
        int warnings,
        int info,
        List<LintViolation> violations,
        Map<String, Integer> byRule
    ) {
        public LintingMetrics {
            violations = violations == null ? List.of() : List.copyOf(violations);
            byRule = byRule == null ? Map.of() : Map.copyOf(byRule);
        }
    }

    /**
     * One lint violation.
     */
    public record LintViolation(
        String file,
        int line,
        int column,
        Severity severity,
        String rule,
        String message,
        boolean fixable
    ) {}
}
