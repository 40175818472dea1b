package com.qualitygate.core.monitor;

import java.time.Duration;

/**
 * Change detection figures of one run.
 *
 * @param totalFiles files inspected
 * @param changedFiles files added, modified or deleted
 * @param unchangedFiles files with an identical digest
 * @param changeRate changed files in percent of all files
 * @param detectionTime time spent hashing and comparing
 */
public record ChangeDetectionSnapshot(
    int totalFiles,
    int changedFiles,
    int unchangedFiles,
    double changeRate,
    Duration detectionTime
) {
    public static ChangeDetectionSnapshot of(int totalFiles, int changedFiles, Duration detectionTime) {
        double rate = totalFiles > 0 ? changedFiles * 100.0 / totalFiles : 0;
        return new ChangeDetectionSnapshot(totalFiles, changedFiles, totalFiles - changedFiles, rate, detectionTime);
    }

    /**
     * Assumes every file changed; used when no change detection ran.
     */
    static ChangeDetectionSnapshot allChanged(int totalFiles) {
        return new ChangeDetectionSnapshot(totalFiles, totalFiles, 0, 100, Duration.ZERO);
    }
}
