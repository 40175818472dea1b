package com.qualitygate.core.model;

/**
 * Letter grade assigned to an overall score.
 *
 * <p>The ladder is inclusive at each lower bound: 90 is an A, 80 is a B.
 */
public enum Grade {
    A(90, "Excellent code quality - exceeds expectations"),
    B(80, "Good code quality - meets expectations"),
    C(70, "Acceptable code quality - areas for improvement"),
    D(60, "Poor code quality - significant issues"),
    F(0, "Failing code quality - critical issues");

    private final double minimumScore;
    private final String description;

    Grade(double minimumScore, String description) {
        this.minimumScore = minimumScore;
        this.description = description;
    }

    public double minimumScore() {
        return minimumScore;
    }

    public String description() {
        return description;
    }

    /**
     * Maps a score to its grade.
     *
     * @param score overall score
     * @return grade for the score
     */
    public static Grade forScore(double score) {
        for (Grade grade : values()) {
            if (score >= grade.minimumScore) {
                return grade;
            }
        }
        return F;
    }
}
