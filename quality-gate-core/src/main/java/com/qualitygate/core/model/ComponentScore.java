package com.qualitygate.core.model;

/**
 * A category sub-score together with its effective weight.
 *
 * @param score sub-score in [0, 100]
 * @param weight effective weight in [0, 1]
 * @param weightedScore {@code score * weight}
 */
public record ComponentScore(
    double score,
    double weight,
    double weightedScore
) {
    public ComponentScore {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be within [0, 100]: " + score);
        }
        if (weight < 0 || weight > 1) {
            throw new IllegalArgumentException("weight must be within [0, 1]: " + weight);
        }
    }

    public static ComponentScore of(double score, double weight) {
        return new ComponentScore(score, weight, score * weight);
    }
}
