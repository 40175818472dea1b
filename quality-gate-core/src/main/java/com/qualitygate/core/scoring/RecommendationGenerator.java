package com.qualitygate.core.scoring;

import com.qualitygate.core.config.QualityConfig;
import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.AnalysisResult;
import com.qualitygate.core.model.ArchitectureMetrics;
import com.qualitygate.core.model.CodeQualityMetrics;
import com.qualitygate.core.model.CoverageMetrics;
import com.qualitygate.core.model.Priority;
import com.qualitygate.core.model.Recommendation;
import com.qualitygate.core.model.SecurityMetrics;
import com.qualitygate.core.model.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives ranked remediation advice from category metrics.
 *
 * <p>Categories are visited in a fixed order (code quality, coverage, architecture, security).
 * Recommendations are deduplicated by category and issue, sorted by priority with ties kept in
 * generation order, then truncated to the configured maximum.
 */
public class RecommendationGenerator {

    static final double TARGET_EFFECTIVENESS = 70;

    private final QualityConfig config;

    public RecommendationGenerator(QualityConfig config) {
        this.config = config;
    }

    /**
     * Generates recommendations for the successful categories.
     *
     * @param results analysis results per category
     * @return at most {@code maxRecommendations} recommendations, highest priority first
     */
    public List<Recommendation> generate(Map<AnalysisCategory, AnalysisResult> results) {
        List<Recommendation> candidates = new ArrayList<>();
        for (AnalysisCategory category : AnalysisCategory.values()) {
            AnalysisResult result = results.get(category);
            if (result == null) {
                continue;
            }
            switch (category) {
                case CODE_QUALITY -> codeQuality(result.metricsAs(CodeQualityMetrics.class), candidates);
                case TEST_COVERAGE -> coverage(result.metricsAs(CoverageMetrics.class), candidates);
                case ARCHITECTURE -> architecture(result.metricsAs(ArchitectureMetrics.class), candidates);
                case SECURITY -> security(result.metricsAs(SecurityMetrics.class), candidates);
            }
        }

        Set<String> seen = new HashSet<>();
        List<Recommendation> unique = new ArrayList<>();
        for (Recommendation recommendation : candidates) {
            if (seen.add(recommendation.category() + "|" + recommendation.issue())) {
                unique.add(recommendation);
            }
        }

        unique.sort(Comparator.comparing(Recommendation::priority));
        return List.copyOf(unique.subList(0, Math.min(config.scoring().maxRecommendations(), unique.size())));
    }

    // ==================== Per-Category Rules ====================

    private void codeQuality(CodeQualityMetrics metrics, List<Recommendation> out) {
        if (metrics == null) {
            return;
        }
        int critical = metrics.complexity().distribution().critical();
        if (critical > 0) {
            out.add(new Recommendation(Priority.HIGH, AnalysisCategory.CODE_QUALITY,
                "High cyclomatic complexity",
                String.format("Refactor %d functions with high complexity (>%d) by extracting logic into smaller functions",
                    critical, config.analyzers().codeQuality().complexityCritical()),
                "medium",
                "Improved code readability and testability"));
        }
        double duplication = metrics.duplication().percent();
        if (duplication > config.analyzers().codeQuality().duplicationMaxPercent()) {
            out.add(new Recommendation(Priority.MEDIUM, AnalysisCategory.CODE_QUALITY,
                "Code duplication",
                String.format("Reduce code duplication (%.1f%%) by extracting shared code into reusable "
                    + "components or utilities", duplication),
                "medium",
                "Easier maintenance and consistency"));
        }
        if (metrics.linting().errors() > 0) {
            out.add(new Recommendation(Priority.MEDIUM, AnalysisCategory.CODE_QUALITY,
                "Linting errors",
                "Fix " + metrics.linting().errors() + " linting errors reported by the lint rules",
                "low",
                "Fewer latent bugs"));
        }
    }

    private void coverage(CoverageMetrics metrics, List<Recommendation> out) {
        if (metrics == null) {
            return;
        }
        double target = config.analyzers().coverage().minimumPercent();
        double lines = metrics.overall().lines().percentage();
        if (lines < target) {
            out.add(new Recommendation(Priority.HIGH, AnalysisCategory.TEST_COVERAGE,
                "Insufficient test coverage",
                String.format("Increase test coverage from %.1f%% to at least %.0f%% by adding tests for "
                    + "uncovered code paths", lines, target),
                "high",
                "Better code reliability and reduced bugs"));
        }
        if (metrics.effectiveness().effectivenessScore() < TARGET_EFFECTIVENESS) {
            out.add(new Recommendation(Priority.MEDIUM, AnalysisCategory.TEST_COVERAGE,
                "Low test effectiveness",
                "Improve test effectiveness by adding meaningful assertions and improving test isolation",
                "medium",
                "More reliable test suite"));
        }
    }

    private void architecture(ArchitectureMetrics metrics, List<Recommendation> out) {
        if (metrics == null) {
            return;
        }
        int cycles = metrics.dependencies().circularDependencies().size();
        if (cycles > 0) {
            out.add(new Recommendation(Priority.HIGH, AnalysisCategory.ARCHITECTURE,
                "Circular dependencies",
                "Resolve " + cycles + " circular dependencies by restructuring module organization",
                "medium",
                "Better modularity and maintainability"));
        }
        var oversized = metrics.components().oversized();
        if (!oversized.isEmpty()) {
            out.add(new Recommendation(Priority.MEDIUM, AnalysisCategory.ARCHITECTURE,
                "Oversized components",
                String.format("Split %d oversized components (largest has %d lines) into smaller, focused components",
                    oversized.size(), oversized.get(0).lines()),
                "medium",
                "Improved reusability and testability"));
        }
    }

    private void security(SecurityMetrics metrics, List<Recommendation> out) {
        if (metrics == null) {
            return;
        }
        long criticalVulnerabilities = metrics.vulnerabilitiesWithSeverity(Severity.CRITICAL);
        if (criticalVulnerabilities > 0) {
            out.add(new Recommendation(Priority.CRITICAL, AnalysisCategory.SECURITY,
                "Critical vulnerabilities",
                "Address " + criticalVulnerabilities
                    + " critical vulnerabilities by updating dependencies to patched versions",
                "low",
                "Eliminated critical security risks"));
        }
        long criticalPatterns = metrics.patternsWithSeverity(Severity.CRITICAL);
        if (criticalPatterns > 0) {
            out.add(new Recommendation(Priority.HIGH, AnalysisCategory.SECURITY,
                "Insecure code patterns",
                "Remove " + criticalPatterns + " hard-coded secrets or eval() calls from the source",
                "low",
                "Reduced attack surface"));
        }
    }
}
