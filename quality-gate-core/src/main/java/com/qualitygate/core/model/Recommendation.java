package com.qualitygate.core.model;

import java.util.Objects;

/**
 * Actionable remediation derived from category metrics.
 *
 * @param priority urgency of the recommendation
 * @param category category the recommendation applies to
 * @param issue short issue title
 * @param remediation what to do about it
 * @param estimatedEffort rough effort (low, medium, high)
 * @param expectedImpact expected effect on the score
 */
public record Recommendation(
    Priority priority,
    AnalysisCategory category,
    String issue,
    String remediation,
    String estimatedEffort,
    String expectedImpact
) {
    public Recommendation {
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(issue, "issue must not be null");
    }
}
