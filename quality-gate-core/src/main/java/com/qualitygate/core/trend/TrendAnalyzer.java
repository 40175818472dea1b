package com.qualitygate.core.trend;

import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.ComponentScore;
import com.qualitygate.core.model.ScoringResult;
import com.qualitygate.core.model.TrendData;
import com.qualitygate.core.model.TrendDirection;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Compares a scoring result with the stored history.
 *
 * <p>A change of more than 0.5% relative to the previous run is a trend; anything smaller is
 * {@link TrendDirection#STABLE}. The same rule applies to each category sub-score.
 */
public class TrendAnalyzer {

    static final double DIRECTION_THRESHOLD_PERCENT = 0.5;
    static final int RECENT_SCORES = 5;

    /**
     * Derives trend data for a result from the records stored before it.
     *
     * @param result current scoring result
     * @param history earlier records, oldest first
     * @return trend data
     */
    public TrendData analyze(ScoringResult result, List<HistoricalRecord> history) {
        double current = result.overall().score();
        HistoricalRecord previous = history.isEmpty() ? null : history.get(history.size() - 1);

        List<Double> lastFive = new ArrayList<>();
        history.subList(Math.max(0, history.size() - (RECENT_SCORES - 1)), history.size())
            .forEach(record -> lastFive.add(record.overallScore()));
        lastFive.add(current);

        Map<AnalysisCategory, TrendDirection> componentTrends = new EnumMap<>(AnalysisCategory.class);
        for (Map.Entry<AnalysisCategory, ComponentScore> entry : result.componentScores().entrySet()) {
            Double before = previous == null ? null : previous.componentScores().get(entry.getKey());
            componentTrends.put(entry.getKey(),
                before == null ? TrendDirection.STABLE : direction(before, entry.getValue().score()));
        }

        if (previous == null) {
            return new TrendData(current, null, null, TrendDirection.STABLE, lastFive, componentTrends);
        }
        return new TrendData(
            current,
            previous.overallScore(),
            changePercent(previous.overallScore(), current),
            direction(previous.overallScore(), current),
            lastFive,
            componentTrends);
    }

    static double changePercent(double previous, double current) {
        if (previous == 0) {
            return 0;
        }
        return (current - previous) / previous * 100;
    }

    static TrendDirection direction(double previous, double current) {
        double change = changePercent(previous, current);
        if (change > DIRECTION_THRESHOLD_PERCENT) {
            return TrendDirection.IMPROVING;
        }
        if (change < -DIRECTION_THRESHOLD_PERCENT) {
            return TrendDirection.DEGRADING;
        }
        return TrendDirection.STABLE;
    }

    /**
     * Population standard deviation of the stored overall scores.
     *
     * @param history stored records
     * @return volatility, 0 with fewer than two records
     */
    public double volatility(List<HistoricalRecord> history) {
        if (history.size() < 2) {
            return 0;
        }
        double mean = history.stream().mapToDouble(HistoricalRecord::overallScore).average().orElse(0);
        double variance = history.stream()
            .mapToDouble(record -> Math.pow(record.overallScore() - mean, 2))
            .average()
            .orElse(0);
        return Math.sqrt(variance);
    }

    /**
     * One-line description of a trend for console output.
     *
     * @param trend trend data
     * @return summary text
     */
    public String summarize(TrendData trend) {
        String direction = switch (trend.direction()) {
            case IMPROVING -> "Quality is improving";
            case DEGRADING -> "Quality is declining";
            case STABLE -> "Quality is stable";
        };
        if (trend.changePercent() == null) {
            return direction + " (first recorded run)";
        }
        return String.format("%s (%+.1f%% since previous run)", direction, trend.changePercent());
    }
}
