package com.qualitygate.core.scoring;

import com.qualitygate.core.model.ArchitectureMetrics;
import com.qualitygate.core.model.CodeQualityMetrics;
import com.qualitygate.core.model.CoverageMetrics;
import com.qualitygate.core.model.SecurityMetrics;
import com.qualitygate.core.model.Severity;

/**
 * Deterministic category formulas mapping metrics to a sub-score in [0, 100].
 *
 * <p>Shared by the built-in analyzers (for their own result score) and the
 * {@link ScoringEngine} (for the weighted overall score), so both always agree.
 */
public final class SubScores {

    /** Sub-score of a degraded category without metrics */
    public static final double FALLBACK_SCORE = 50;

    /** Sub-score of a degraded coverage category without metrics */
    public static final double FALLBACK_COVERAGE_SCORE = 30;

    private SubScores() {
        // Utility class
    }

    /**
     * complexity x 0.40 + duplication x 0.35 + linting x 0.25.
     *
     * @param metrics code quality metrics
     * @return sub-score
     */
    public static double codeQuality(CodeQualityMetrics metrics) {
        return clamp(complexityScore(metrics.complexity().distribution()) * 0.40
            + duplicationScore(metrics.duplication().percent()) * 0.35
            + lintingScore(metrics.linting().errors(), metrics.linting().warnings()) * 0.25);
    }

    static double complexityScore(CodeQualityMetrics.ComplexityDistribution distribution) {
        int total = distribution.total();
        if (total == 0) {
            return 100;
        }
        double criticalPercent = distribution.critical() * 100.0 / total;
        double warningPercent = distribution.warning() * 100.0 / total;
        return clamp(100 - criticalPercent * 2 - warningPercent * 0.5);
    }

    static double duplicationScore(double percent) {
        if (percent < 3) {
            return 100;
        }
        if (percent < 5) {
            return 90;
        }
        if (percent < 10) {
            return 70;
        }
        return clamp(100 - (percent - 10) * 5);
    }

    static double lintingScore(int errors, int warnings) {
        double score = 100 - Math.min(errors * 15, 100);
        if (warnings > 5) {
            score -= Math.min((warnings - 5) * 2, 50);
        }
        return clamp(score);
    }

    /**
     * average coverage x 0.6 + effectiveness x 0.4.
     *
     * @param metrics coverage metrics
     * @return sub-score
     */
    public static double coverage(CoverageMetrics metrics) {
        return clamp(metrics.overall().averagePercentage() * 0.6
            + metrics.effectiveness().effectivenessScore() * 0.4);
    }

    /**
     * component x 0.35 + dependency x 0.35 + pattern x 0.30.
     *
     * @param metrics architecture metrics
     * @return sub-score
     */
    public static double architecture(ArchitectureMetrics metrics) {
        double component = clamp(100 - metrics.components().oversized().size() * 10.0);
        double dependency = clamp(100
            - metrics.dependencies().circularDependencies().size() * 20.0
            - metrics.dependencies().layerViolations() * 10.0);
        double pattern = clamp(metrics.patterns().averageScore());
        return clamp(component * 0.35 + dependency * 0.35 + pattern * 0.30);
    }

    /**
     * 100 minus penalties for vulnerabilities, insecure patterns and performance issues.
     *
     * @param metrics security metrics
     * @return sub-score
     */
    public static double security(SecurityMetrics metrics) {
        double score = 100
            - metrics.vulnerabilitiesWithSeverity(Severity.CRITICAL) * 25.0
            - metrics.vulnerabilitiesWithSeverity(Severity.HIGH) * 10.0
            - metrics.patternsWithSeverity(Severity.CRITICAL) * 15.0
            - metrics.patternsWithSeverity(Severity.HIGH) * 5.0
            - Math.min(metrics.performanceIssues().size() * 2.0, 30.0);
        return clamp(score);
    }

    public static double clamp(double score) {
        return Math.max(0, Math.min(100, score));
    }
}
