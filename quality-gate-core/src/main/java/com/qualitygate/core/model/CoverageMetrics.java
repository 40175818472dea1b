package com.qualitygate.core.model;

import java.util.List;
import java.util.Map;

/**
 * Metrics produced by the test coverage analyzer.
 *
 * @param overall project-wide coverage summary
 * @param byFile per-file coverage keyed by normalized path
 * @param effectiveness test effectiveness estimate
 * @param gaps files below the coverage target, least covered first
 */
public record CoverageMetrics(
    CoverageSummary overall,
    Map<String, CoverageSummary> byFile,
    TestEffectiveness effectiveness,
    List<CoverageGap> gaps
) implements AnalysisMetrics {

    public CoverageMetrics {
        if (overall == null) {
            overall = CoverageSummary.empty();
        }
        byFile = byFile == null ? Map.of() : Map.copyOf(byFile);
        if (effectiveness == null) {
            effectiveness = TestEffectiveness.unknown();
        }
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
    }

    /**
     * One coverage dimension.
     *
     * @param total coverable items
     * @param covered covered items
     * @param percentage covered share, 100 when nothing is coverable
     * @param status excellent, acceptable or poor
     */
    public record CoverageMetric(int total, int covered, double percentage, String status) {

        public static CoverageMetric of(int total, int covered) {
            double percentage = total > 0 ? (covered * 100.0) / total : 100.0;
            String status;
            if (percentage >= 80) {
                status = "excellent";
            } else if (percentage >= 60) {
                status = "acceptable";
            } else {
                status = "poor";
            }
            return new CoverageMetric(total, covered, percentage, status);
        }

        public static CoverageMetric zero() {
            return new CoverageMetric(0, 0, 0, "poor");
        }
    }

    /**
     * Lines, branches, functions and statements coverage.
     */
    public record CoverageSummary(
        CoverageMetric lines,
        CoverageMetric branches,
        CoverageMetric functions,
        CoverageMetric statements
    ) {
        public CoverageSummary {
            if (lines == null) {
                lines = CoverageMetric.zero();
            }
            if (branches == null) {
                branches = CoverageMetric.zero();
            }
            if (functions == null) {
                functions = CoverageMetric.zero();
            }
            if (statements == null) {
                statements = CoverageMetric.zero();
            }
        }

        public static CoverageSummary empty() {
            return new CoverageSummary(null, null, null, null);
        }

        /**
         * Mean of the four percentages.
         *
         * @return average coverage percentage
         */
        public double averagePercentage() {
            return (lines.percentage() + branches.percentage()
                + functions.percentage() + statements.percentage()) / 4;
        }
    }

    /**
     * Test effectiveness estimate derived from the test files in the analyzed set.
     *
     * @param totalTests detected test cases
     * @param testsWithoutAssertions test cases in files without any assertion
     * @param averageAssertionsPerTest assertions divided by test cases
     * @param effectivenessScore score in [0, 100]
     */
    public record TestEffectiveness(
        int totalTests,
        int testsWithoutAssertions,
        double averageAssertionsPerTest,
        double effectivenessScore
    ) {
        public static TestEffectiveness unknown() {
            return new TestEffectiveness(0, 0, 0, 70);
        }
    }

    /**
     * A file whose line coverage is below target.
     */
    public record CoverageGap(
        String file,
        double coverage,
        int uncoveredLines,
        Severity criticality,
        List<String> suggestedTests
    ) {
        public CoverageGap {
            suggestedTests = suggestedTests == null ? List.of() : List.copyOf(suggestedTests);
        }
    }
}
