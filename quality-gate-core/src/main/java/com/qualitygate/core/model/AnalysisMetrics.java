package com.qualitygate.core.model;

/**
 * Marker for the analyzer-specific metrics payload carried by an {@link AnalysisResult}.
 *
 * <p>The orchestrator treats metrics as opaque; only the scoring engine inspects the
 * concrete record types.
 */
public interface AnalysisMetrics {
}
