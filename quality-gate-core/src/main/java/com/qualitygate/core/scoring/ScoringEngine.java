package com.qualitygate.core.scoring;

import com.qualitygate.core.config.QualityConfig;
import com.qualitygate.core.config.QualityConfig.DisabledCategoryPolicy;
import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.AnalysisResult;
import com.qualitygate.core.model.AnalysisStatus;
import com.qualitygate.core.model.ArchitectureMetrics;
import com.qualitygate.core.model.CodeQualityMetrics;
import com.qualitygate.core.model.ComponentScore;
import com.qualitygate.core.model.CoverageMetrics;
import com.qualitygate.core.model.Grade;
import com.qualitygate.core.model.OverallScore;
import com.qualitygate.core.model.ResultMetadata;
import com.qualitygate.core.model.ScoringResult;
import com.qualitygate.core.model.SecurityMetrics;
import com.qualitygate.core.orchestrator.AggregatedAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns per-category analysis results into one weighted score, a grade and a pass/fail status.
 *
 * <p>Scoring rules:
 * <ul>
 *   <li>each enabled category gets a sub-score in [0, 100] from {@link SubScores}</li>
 *   <li>an enabled category without a result (failed or timed out) is degraded: it keeps its
 *       weight and scores {@link SubScores#FALLBACK_SCORE} ({@link SubScores#FALLBACK_COVERAGE_SCORE}
 *       for coverage)</li>
 *   <li>disabled categories contribute neither score nor weight; under
 *       {@link DisabledCategoryPolicy#RENORMALIZE} the remaining weights are scaled back to 1.0,
 *       under {@link DisabledCategoryPolicy#DROP} they are kept as configured</li>
 *   <li>the overall score is the sum of the weighted sub-scores</li>
 *   <li>the run passes iff the overall score reaches the passing score</li>
 * </ul>
 */
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    private static final String DEVELOPMENT_VERSION = "dev";

    private final QualityConfig config;
    private final RecommendationGenerator recommendations;
    private final Clock clock;

    public ScoringEngine(QualityConfig config) {
        this(config, Clock.systemUTC());
    }

    public ScoringEngine(QualityConfig config, Clock clock) {
        this.config = config;
        this.recommendations = new RecommendationGenerator(config);
        this.clock = clock;
    }

    /**
     * Scores an aggregated analysis.
     *
     * @param analysis merged analyzer outcomes
     * @param projectPath analyzed project, recorded in the metadata
     * @return scoring result without trend data
     */
    public ScoringResult score(AggregatedAnalysis analysis, String projectPath) {
        List<AnalysisCategory> enabled = new ArrayList<>();
        List<AnalysisCategory> disabled = new ArrayList<>();
        for (AnalysisCategory category : AnalysisCategory.values()) {
            if (config.analyzers().isEnabled(category)) {
                enabled.add(category);
            } else {
                disabled.add(category);
            }
        }

        Map<AnalysisCategory, Double> weights = effectiveWeights(enabled);
        Map<AnalysisCategory, ComponentScore> componentScores = new LinkedHashMap<>();
        Map<AnalysisCategory, String> degraded = new EnumMap<>(AnalysisCategory.class);

        for (AnalysisCategory category : enabled) {
            AnalysisResult result = analysis.results().get(category);
            double subScore;
            if (result != null) {
                subScore = subScore(category, result);
            } else {
                subScore = fallbackScore(category);
                String reason = analysis.failures().getOrDefault(category, "No result produced");
                degraded.put(category, reason);
                log.warn("Category {} is degraded ({}); scoring fallback {}", category.id(), reason, subScore);
            }
            componentScores.put(category, ComponentScore.of(SubScores.clamp(subScore), weights.get(category)));
        }

        double overall = SubScores.clamp(componentScores.values().stream()
            .mapToDouble(ComponentScore::weightedScore)
            .sum());
        Grade grade = Grade.forScore(overall);
        AnalysisStatus status = overall >= config.scoring().passingScore() ? AnalysisStatus.PASS : AnalysisStatus.FAIL;
        String summary = String.format("%s (%.1f%%)", grade.description(), overall);

        ResultMetadata metadata = new ResultMetadata(
            clock.instant(),
            toolVersion(),
            UUID.randomUUID().toString(),
            projectPath,
            analysis.totalTime(),
            degraded,
            disabled);

        log.info("Overall score {} (grade {}, {})", String.format("%.1f", overall), grade, status);
        return new ScoringResult(
            new OverallScore(overall, grade, status, summary),
            componentScores,
            analysis.findings(),
            recommendations.generate(analysis.results()),
            null,
            metadata);
    }

    /**
     * Computes the weight of each enabled category under the configured policy.
     *
     * <p>Weights never sum above 1.0: a configuration within the tolerance but over 1.0 is
     * scaled down under either policy, so the overall score stays the plain sum of the
     * weighted sub-scores.
     *
     * @param enabled enabled categories
     * @return weight per enabled category
     */
    Map<AnalysisCategory, Double> effectiveWeights(List<AnalysisCategory> enabled) {
        QualityConfig.Weights configured = config.scoring().weights();
        double enabledSum = enabled.stream().mapToDouble(configured::forCategory).sum();
        boolean renormalize = config.scoring().disabledCategoryPolicy() == DisabledCategoryPolicy.RENORMALIZE
            && enabledSum > 0;
        double divisor = renormalize || enabledSum > 1 ? enabledSum : 1;

        Map<AnalysisCategory, Double> weights = new EnumMap<>(AnalysisCategory.class);
        for (AnalysisCategory category : enabled) {
            weights.put(category, configured.forCategory(category) / divisor);
        }
        return weights;
    }

    /**
     * Computes a category sub-score from the result's metrics, or takes the analyzer's own
     * score when the metrics are not of the built-in type.
     */
    double subScore(AnalysisCategory category, AnalysisResult result) {
        Optional<Double> fromMetrics = switch (category) {
            case CODE_QUALITY -> Optional.ofNullable(result.metricsAs(CodeQualityMetrics.class))
                .map(SubScores::codeQuality);
            case TEST_COVERAGE -> Optional.ofNullable(result.metricsAs(CoverageMetrics.class))
                .map(SubScores::coverage);
            case ARCHITECTURE -> Optional.ofNullable(result.metricsAs(ArchitectureMetrics.class))
                .map(SubScores::architecture);
            case SECURITY -> Optional.ofNullable(result.metricsAs(SecurityMetrics.class))
                .map(SubScores::security);
        };
        return fromMetrics.orElse(result.score());
    }

    static double fallbackScore(AnalysisCategory category) {
        return category == AnalysisCategory.TEST_COVERAGE
            ? SubScores.FALLBACK_COVERAGE_SCORE
            : SubScores.FALLBACK_SCORE;
    }

    private static String toolVersion() {
        String version = ScoringEngine.class.getPackage().getImplementationVersion();
        return version != null ? version : DEVELOPMENT_VERSION;
    }
}
