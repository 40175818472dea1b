package com.qualitygate.core.change;

/**
 * Classification of a file against its last recorded digest.
 */
public enum ChangeType {
    /** No prior record exists */
    ADDED,
    /** Digest differs from the record, or the file could not be read */
    MODIFIED,
    /** Digest matches the record */
    UNCHANGED,
    /** A record exists but the file is gone */
    DELETED;

    public boolean requiresAnalysis() {
        return this != UNCHANGED;
    }
}
