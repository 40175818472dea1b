package com.qualitygate.core.trend;

import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.AnalysisStatus;
import com.qualitygate.core.model.ComponentScore;
import com.qualitygate.core.model.Grade;
import com.qualitygate.core.model.OverallScore;
import com.qualitygate.core.model.ResultMetadata;
import com.qualitygate.core.model.ScoringResult;
import com.qualitygate.core.model.TrendData;
import com.qualitygate.core.model.TrendDirection;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link TrendAnalyzer}.
 */
class TrendAnalyzerTest {

    private final TrendAnalyzer analyzer = new TrendAnalyzer();

    @Test
    void analyze_firstRun_isStableWithoutPrevious() {
        TrendData trend = analyzer.analyze(result(80, 90), List.of());

        assertThat(trend.direction()).isEqualTo(TrendDirection.STABLE);
        assertThat(trend.previousScore()).isNull();
        assertThat(trend.changePercent()).isNull();
        assertThat(trend.lastFiveScores()).containsExactly(80.0);
        assertThat(trend.componentTrends()).containsEntry(AnalysisCategory.SECURITY, TrendDirection.STABLE);
        assertThat(analyzer.summarize(trend)).isEqualTo("Quality is stable (first recorded run)");
    }

    @Test
    void analyze_higherScore_isImproving() {
        TrendData trend = analyzer.analyze(result(88, 90), List.of(TrendStorageTest.record(1, 80)));

        assertThat(trend.direction()).isEqualTo(TrendDirection.IMPROVING);
        assertThat(trend.previousScore()).isEqualTo(80.0);
        assertThat(trend.changePercent()).isCloseTo(10, within(1e-9));
        assertThat(trend.componentTrends()).containsEntry(AnalysisCategory.SECURITY, TrendDirection.IMPROVING);
        assertThat(analyzer.summarize(trend)).isEqualTo("Quality is improving (+10.0% since previous run)");
    }

    @Test
    void analyze_lowerScore_isDegrading() {
        TrendData trend = analyzer.analyze(result(70, 60), List.of(TrendStorageTest.record(1, 80)));

        assertThat(trend.direction()).isEqualTo(TrendDirection.DEGRADING);
        assertThat(analyzer.summarize(trend)).isEqualTo("Quality is declining (-12.5% since previous run)");
    }

    @Test
    void analyze_changeWithinHalfPercent_isStable() {
        TrendData trend = analyzer.analyze(result(80.3, 80), List.of(TrendStorageTest.record(1, 80)));

        assertThat(trend.direction()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void analyze_longHistory_keepsLastFiveScoresIncludingCurrent() {
        List<HistoricalRecord> history = List.of(
            TrendStorageTest.record(1, 60),
            TrendStorageTest.record(2, 65),
            TrendStorageTest.record(3, 70),
            TrendStorageTest.record(4, 75),
            TrendStorageTest.record(5, 78),
            TrendStorageTest.record(6, 80));

        TrendData trend = analyzer.analyze(result(85, 85), history);

        assertThat(trend.lastFiveScores()).containsExactly(70.0, 75.0, 78.0, 80.0, 85.0);
        assertThat(trend.previousScore()).isEqualTo(80.0);
    }

    @Test
    void analyze_categoryMissingFromPrevious_isStable() {
        HistoricalRecord previous = new HistoricalRecord(1L, "run-0", 80, Grade.B, Map.of());

        TrendData trend = analyzer.analyze(result(90, 95), List.of(previous));

        assertThat(trend.componentTrends()).containsEntry(AnalysisCategory.SECURITY, TrendDirection.STABLE);
    }

    @Test
    void volatility_isPopulationStandardDeviation() {
        assertThat(analyzer.volatility(List.of())).isZero();
        assertThat(analyzer.volatility(List.of(TrendStorageTest.record(1, 80)))).isZero();

        double volatility = analyzer.volatility(List.of(
            TrendStorageTest.record(1, 70),
            TrendStorageTest.record(2, 80),
            TrendStorageTest.record(3, 90)));

        assertThat(volatility).isCloseTo(Math.sqrt(200.0 / 3), within(1e-9));
    }

    @Test
    void changePercent_zeroPrevious_isZero() {
        assertThat(TrendAnalyzer.changePercent(0, 50)).isZero();
    }

    private static ScoringResult result(double overall, double security) {
        return new ScoringResult(
            new OverallScore(overall, Grade.forScore(overall), AnalysisStatus.fromScore(overall), ""),
            Map.of(AnalysisCategory.SECURITY, ComponentScore.of(security, 1.0)),
            List.of(),
            List.of(),
            null,
            new ResultMetadata(Instant.parse("2024-01-15T10:00:00Z"), "dev", "run-current", "/p", null, null, null));
    }
}
