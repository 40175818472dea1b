package com.qualitygate.core.model;

/**
 * Outcome status of an analyzer or of the whole gate.
 */
public enum AnalysisStatus {
    PASS,
    WARNING,
    FAIL;

    /**
     * Derives an analyzer status from its score: 80 and above passes,
     * 70 and above warns, anything lower fails.
     *
     * @param score score in [0, 100]
     * @return derived status
     */
    public static AnalysisStatus fromScore(double score) {
        if (score >= 80) {
            return PASS;
        }
        if (score >= 70) {
            return WARNING;
        }
        return FAIL;
    }
}
