package com.qualitygate.core.model;

/**
 * Severity of a {@link Finding}, ordered from most to least severe.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    /**
     * Returns the lower-case identifier used in reports (e.g. "critical").
     *
     * @return lower-case identifier
     */
    public String id() {
        return name().toLowerCase();
    }

    /**
     * Returns true if this severity is at least as severe as the given one.
     *
     * @param other severity to compare with
     * @return true if this is the same or more severe
     */
    public boolean isAtLeast(Severity other) {
        return ordinal() <= other.ordinal();
    }
}
