package com.qualitygate.core.analyzer.impl.coverage;

import com.qualitygate.core.analyzer.AnalysisContext;
import com.qualitygate.core.analyzer.AnalyzerSettings;
import com.qualitygate.core.analyzer.base.AbstractLineAnalyzer;
import com.qualitygate.core.config.QualityConfig;
import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.AnalysisResult;
import com.qualitygate.core.model.CoverageMetrics;
import com.qualitygate.core.model.CoverageMetrics.CoverageGap;
import com.qualitygate.core.model.CoverageMetrics.CoverageSummary;
import com.qualitygate.core.model.CoverageMetrics.TestEffectiveness;
import com.qualitygate.core.model.FileLocation;
import com.qualitygate.core.model.Finding;
import com.qualitygate.core.model.Severity;
import com.qualitygate.core.scoring.SubScores;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reports test coverage from an Istanbul report and estimates test effectiveness from the
 * test files in the analyzed set.
 *
 * <p>Without a coverage report all percentages are zero. Without test files the effectiveness
 * score defaults to 70.
 */
public class CoverageAnalyzer extends AbstractLineAnalyzer {

    public static final String DEFAULT_NAME = "CoverageAnalyzer";

    private static final Pattern TEST_CASE = Pattern.compile("\\b(?:it|test)(?:\\.(?:only|each\\([^)]*\\)))?\\s*\\(");
    private static final Pattern ASSERTION = Pattern.compile("\\bexpect\\s*\\(|\\bassert\\w*\\s*\\(");

    private static final int MAX_GAPS = 10;
    private static final int GAP_FINDINGS = 5;

    private final CoverageReportReader reportReader;

    public CoverageAnalyzer(AnalyzerSettings settings) {
        this(settings, new CoverageReportReader());
    }

    CoverageAnalyzer(AnalyzerSettings settings, CoverageReportReader reportReader) {
        super(settings);
        this.reportReader = reportReader;
    }

    @Override
    public AnalysisCategory getCategory() {
        return AnalysisCategory.TEST_COVERAGE;
    }

    @Override
    protected AnalysisResult doAnalyze(AnalysisContext context) {
        QualityConfig.CoverageConfig config = context.configuration().analyzers().coverage();

        CoverageSummary overall = CoverageSummary.empty();
        Map<String, CoverageSummary> byFile = Map.of();
        var report = reportReader.read(context.rootPath(), config.reportPaths());
        if (report.isPresent()) {
            overall = report.get().overall();
            byFile = report.get().byFile();
        } else {
            log.info("No coverage report found; coverage is reported as 0%");
        }

        CoverageMetrics metrics = new CoverageMetrics(
            overall,
            byFile,
            estimateEffectiveness(context),
            identifyGaps(byFile, config));

        return buildResult(SubScores.coverage(metrics), generateFindings(metrics, config), metrics);
    }

    // ==================== Test Effectiveness ====================

    private TestEffectiveness estimateEffectiveness(AnalysisContext context) {
        List<TestFileReport> reports = new ArrayList<>();
        for (String file : context.sourceFiles()) {
            if (isTestFile(file)) {
                analyzeFile(context, file, TestFileReport.class, this::countTests).ifPresent(reports::add);
            }
        }

        int totalTests = reports.stream().mapToInt(TestFileReport::tests).sum();
        if (totalTests == 0) {
            return TestEffectiveness.unknown();
        }
        int assertions = reports.stream().mapToInt(TestFileReport::assertions).sum();
        int withoutAssertions = reports.stream()
            .filter(report -> report.assertions() == 0)
            .mapToInt(TestFileReport::tests)
            .sum();

        double averageAssertions = (double) assertions / totalTests;
        double score = 100 - (withoutAssertions * 60.0 / totalTests);
        if (averageAssertions < 1) {
            score -= 20;
        }
        return new TestEffectiveness(totalTests, withoutAssertions, averageAssertions, SubScores.clamp(score));
    }

    TestFileReport countTests(String file, String content) {
        return new TestFileReport(file, countMatches(TEST_CASE, content), countMatches(ASSERTION, content));
    }

    // ==================== Gaps ====================

    private List<CoverageGap> identifyGaps(Map<String, CoverageSummary> byFile, QualityConfig.CoverageConfig config) {
        List<CoverageGap> gaps = new ArrayList<>();
        for (Map.Entry<String, CoverageSummary> entry : byFile.entrySet()) {
            double coverage = entry.getValue().lines().percentage();
            if (coverage >= config.minimumPercent()) {
                continue;
            }
            Severity criticality;
            if (coverage < 50) {
                criticality = Severity.CRITICAL;
            } else if (coverage < 65) {
                criticality = Severity.HIGH;
            } else {
                criticality = Severity.MEDIUM;
            }
            int uncovered = entry.getValue().lines().total() - entry.getValue().lines().covered();
            gaps.add(new CoverageGap(entry.getKey(), coverage, uncovered, criticality, suggestTests(entry.getKey())));
        }
        return gaps.stream()
            .sorted(Comparator.comparingDouble(CoverageGap::coverage))
            .limit(MAX_GAPS)
            .toList();
    }

    private List<String> suggestTests(String file) {
        List<String> suggestions = new ArrayList<>();
        if (file.contains("utils")) {
            suggestions.add("Test utility functions with various inputs");
        }
        if (file.contains("components")) {
            suggestions.add("Test component rendering");
            suggestions.add("Test component props");
            suggestions.add("Test component event handlers");
        }
        if (file.contains("hooks")) {
            suggestions.add("Test hook initialization");
            suggestions.add("Test hook state changes");
        }
        if (file.contains("store") || file.contains("redux")) {
            suggestions.add("Test reducer logic");
            suggestions.add("Test selector functions");
        }
        if (suggestions.isEmpty()) {
            suggestions.add("Add unit tests for uncovered branches");
        }
        return suggestions;
    }

    // ==================== Findings ====================

    private List<Finding> generateFindings(CoverageMetrics metrics, QualityConfig.CoverageConfig config) {
        List<Finding> findings = new ArrayList<>();
        CoverageSummary overall = metrics.overall();

        if (overall.lines().percentage() < config.minimumPercent()) {
            findings.add(finding(
                "coverage-low",
                Severity.HIGH,
                "Low test coverage",
                String.format("Overall line coverage is %.1f%%, target is %.0f%%",
                    overall.lines().percentage(), config.minimumPercent()),
                "Add tests for uncovered code paths, starting with the largest gaps",
                null,
                String.format("Lines: %.1f%%, Branches: %.1f%%",
                    overall.lines().percentage(), overall.branches().percentage())));
        }

        if (overall.branches().percentage() < config.branchMinimumPercent()) {
            findings.add(finding(
                "coverage-branch-low",
                Severity.MEDIUM,
                "Low branch coverage",
                String.format("Branch coverage is %.1f%%, target is %.0f%%",
                    overall.branches().percentage(), config.branchMinimumPercent()),
                "Add tests for conditional branches and error paths",
                null,
                String.format("Branches: %.1f%%", overall.branches().percentage())));
        }

        for (CoverageGap gap : metrics.gaps().subList(0, Math.min(GAP_FINDINGS, metrics.gaps().size()))) {
            findings.add(finding(
                "gap-" + gap.file(),
                gap.criticality(),
                "Coverage gap",
                String.format("File has only %.1f%% coverage with %d uncovered lines",
                    gap.coverage(), gap.uncoveredLines()),
                String.join("; ", gap.suggestedTests()),
                FileLocation.of(gap.file()),
                String.format("Coverage: %.1f%%, Uncovered: %d", gap.coverage(), gap.uncoveredLines())));
        }
        return findings;
    }
}
