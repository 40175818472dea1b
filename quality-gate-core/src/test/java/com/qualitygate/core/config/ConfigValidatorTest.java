package com.qualitygate.core.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigValidator}.
 */
class ConfigValidatorTest {

    @Test
    void collectErrors_defaults_areValid() {
        assertThat(ConfigValidator.collectErrors(QualityConfig.defaults())).isEmpty();
        assertThatCode(() -> ConfigValidator.validate(QualityConfig.defaults())).doesNotThrowAnyException();
    }

    @Test
    void weightsSumToOne_withinTolerance_isAccepted() {
        QualityConfig.Weights weights = new QualityConfig.Weights(0.30, 0.35, 0.20, 0.145);

        assertThat(ConfigValidator.weightsSumToOne(weights)).isTrue();
    }

    @Test
    void weightsSumToOne_outsideTolerance_isRejected() {
        QualityConfig.Weights weights = new QualityConfig.Weights(0.30, 0.35, 0.20, 0.10);

        assertThat(ConfigValidator.weightsSumToOne(weights)).isFalse();
    }

    @Test
    void collectErrors_negativeWeight_reportsRange() {
        QualityConfig config = withScoring(new QualityConfig.ScoringConfig(
            new QualityConfig.Weights(-0.2, 0.6, 0.3, 0.3), null, null, null));

        assertThat(ConfigValidator.collectErrors(config))
            .anyMatch(error -> error.startsWith("Weight for codeQuality must be between 0 and 1"));
    }

    @Test
    void collectErrors_passingScoreOutOfRange_isReported() {
        QualityConfig config = withScoring(new QualityConfig.ScoringConfig(null, 120.0, null, null));

        assertThat(ConfigValidator.collectErrors(config))
            .containsExactly("Passing score must be between 0 and 100, got 120.0");
    }

    @Test
    void collectErrors_nanPassingScore_isReported() {
        QualityConfig config = withScoring(new QualityConfig.ScoringConfig(null, Double.NaN, null, null));

        assertThat(ConfigValidator.collectErrors(config))
            .containsExactly("Passing score must be between 0 and 100, got NaN");
    }

    @Test
    void collectErrors_zeroRecommendations_isReported() {
        QualityConfig config = withScoring(new QualityConfig.ScoringConfig(null, null, 0, null));

        assertThat(ConfigValidator.collectErrors(config)).containsExactly("maxRecommendations must be at least 1");
    }

    @Test
    void collectErrors_badAnalyzerSettings_reportsEach() {
        QualityConfig.AnalyzersConfig analyzers = new QualityConfig.AnalyzersConfig(
            new QualityConfig.CodeQualityConfig(null, 0L, null, 20, 10, null),
            new QualityConfig.CoverageConfig(null, null, -1, null, null, null),
            new QualityConfig.ArchitectureConfig(null, null, null, 0),
            null);
        QualityConfig config = new QualityConfig(null, analyzers, null, null, null, null, null, null, null);

        assertThat(ConfigValidator.collectErrors(config)).containsExactlyInAnyOrder(
            "Timeout for codeQuality must be positive",
            "Retry attempts for testCoverage must not be negative",
            "complexityWarning must be lower than complexityCritical",
            "maxComponentLines must be positive");
    }

    @Test
    void collectErrors_badCacheAndHistory_reportsEach() {
        QualityConfig config = new QualityConfig(null, null, null,
            new QualityConfig.CacheConfig(true, null, 0L, 0),
            null,
            new QualityConfig.HistoryConfig(true, null, 0),
            new QualityConfig.PerformanceConfig(-5L),
            null, null);

        assertThat(ConfigValidator.collectErrors(config)).containsExactlyInAnyOrder(
            "Cache TTL must be positive",
            "Cache maxSize must be positive",
            "History maxRecords must be at least 1",
            "Performance threshold must be positive");
    }

    @Test
    void validate_invalidConfig_throwsWithAllErrors() {
        QualityConfig config = withScoring(new QualityConfig.ScoringConfig(
            new QualityConfig.Weights(0.5, 0.5, 0.5, 0.5), -1.0, null, null));

        assertThatThrownBy(() -> ConfigValidator.validate(config))
            .isInstanceOf(ConfigurationException.class)
            .satisfies(e -> {
                ConfigurationException error = (ConfigurationException) e;
                assertThat(error.getErrors()).hasSize(2);
                assertThat(error.getCode()).isEqualTo(ConfigurationException.CODE);
            });
    }

    private static QualityConfig withScoring(QualityConfig.ScoringConfig scoring) {
        return new QualityConfig(null, null, scoring, null, null, null, null, null, null);
    }
}
