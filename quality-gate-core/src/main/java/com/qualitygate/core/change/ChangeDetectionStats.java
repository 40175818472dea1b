package com.qualitygate.core.change;

/**
 * @param trackedFiles number of recorded files
 * @param lastUpdate epoch milliseconds of the last {@code updateRecords}, 0 if never
 */
public record ChangeDetectionStats(int trackedFiles, long lastUpdate) {}
