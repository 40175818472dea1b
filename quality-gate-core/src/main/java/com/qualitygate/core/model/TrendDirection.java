package com.qualitygate.core.model;

public enum TrendDirection {
    IMPROVING,
    STABLE,
    DEGRADING
}
