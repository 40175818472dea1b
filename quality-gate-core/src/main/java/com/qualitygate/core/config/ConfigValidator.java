package com.qualitygate.core.config;

import com.qualitygate.core.model.AnalysisCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks configuration invariants before a run starts.
 */
public final class ConfigValidator {

    /** Allowed deviation of the weight sum from 1.0 */
    public static final double WEIGHT_TOLERANCE = 0.01;

    private ConfigValidator() {
        // Utility class
    }

    /**
     * Validates the configuration.
     *
     * @param config configuration to check
     * @throws ConfigurationException listing every violated invariant
     */
    public static void validate(QualityConfig config) {
        List<String> errors = collectErrors(config);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
    }

    /**
     * Collects invariant violations without throwing.
     *
     * @param config configuration to check
     * @return violation messages, empty when valid
     */
    public static List<String> collectErrors(QualityConfig config) {
        List<String> errors = new ArrayList<>();

        QualityConfig.Weights weights = config.scoring().weights();
        for (AnalysisCategory category : AnalysisCategory.values()) {
            double weight = weights.forCategory(category);
            if (!(weight >= 0 && weight <= 1)) {
                errors.add("Weight for " + category.id() + " must be between 0 and 1, got " + weight);
            }
        }
        if (!weightsSumToOne(weights)) {
            errors.add(String.format("Scoring weights must sum to 1.0 (+/- %.2f), got %.4f",
                WEIGHT_TOLERANCE, weights.sum()));
        }

        double passingScore = config.scoring().passingScore();
        if (!(passingScore >= 0 && passingScore <= 100)) {
            errors.add("Passing score must be between 0 and 100, got " + passingScore);
        }
        if (config.scoring().maxRecommendations() < 1) {
            errors.add("maxRecommendations must be at least 1");
        }

        for (AnalysisCategory category : AnalysisCategory.values()) {
            AnalyzerOptions options = config.analyzers().forCategory(category);
            if (options.timeoutSeconds() <= 0) {
                errors.add("Timeout for " + category.id() + " must be positive");
            }
            if (options.retryAttempts() < 0) {
                errors.add("Retry attempts for " + category.id() + " must not be negative");
            }
        }

        QualityConfig.CodeQualityConfig codeQuality = config.analyzers().codeQuality();
        if (codeQuality.complexityWarning() >= codeQuality.complexityCritical()) {
            errors.add("complexityWarning must be lower than complexityCritical");
        }
        if (config.analyzers().architecture().maxComponentLines() <= 0) {
            errors.add("maxComponentLines must be positive");
        }

        if (config.cache().ttlSeconds() <= 0) {
            errors.add("Cache TTL must be positive");
        }
        if (config.cache().maxSize() <= 0) {
            errors.add("Cache maxSize must be positive");
        }
        if (config.history().maxRecords() < 1) {
            errors.add("History maxRecords must be at least 1");
        }
        if (config.performance().thresholdMillis() <= 0) {
            errors.add("Performance threshold must be positive");
        }
        return errors;
    }

    /**
     * Checks the weight-sum invariant.
     *
     * @param weights weights to check
     * @return true if the weights sum to 1.0 within {@link #WEIGHT_TOLERANCE}
     */
    public static boolean weightsSumToOne(QualityConfig.Weights weights) {
        return Math.abs(weights.sum() - 1.0) <= WEIGHT_TOLERANCE;
    }
}
