package com.qualitygate.core.model;

/**
 * Priority of a {@link Recommendation}; declaration order is sort order.
 */
public enum Priority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
