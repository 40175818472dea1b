package com.qualitygate.core.monitor;

import com.qualitygate.core.model.TrendDirection;

import java.time.Duration;

/**
 * Run time of the latest report compared with the one before.
 *
 * <p>{@code previous}, {@code changePercent} and {@code direction} are null until two reports
 * exist. Shorter run times are {@link TrendDirection#IMPROVING}.
 */
public record PerformanceTrend(
    Duration current,
    Duration previous,
    Double changePercent,
    TrendDirection direction
) {
    public static PerformanceTrend none() {
        return new PerformanceTrend(Duration.ZERO, null, null, null);
    }
}
