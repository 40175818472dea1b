package com.qualitygate.core.analyzer.impl.coverage;

import com.qualitygate.core.analyzer.AnalyzerSettings;
import com.qualitygate.core.analyzer.AnalyzerTestBase;
import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.AnalysisResult;
import com.qualitygate.core.model.CoverageMetrics;
import com.qualitygate.core.model.Finding;
import com.qualitygate.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link CoverageAnalyzer}.
 */
class CoverageAnalyzerTest extends AnalyzerTestBase {

    private CoverageAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new CoverageAnalyzer(AnalyzerSettings.defaults(CoverageAnalyzer.DEFAULT_NAME));
    }

    @Test
    void getCategory_isTestCoverage() {
        assertThat(analyzer.getCategory()).isEqualTo(AnalysisCategory.TEST_COVERAGE);
        assertThat(analyzer.getType()).isEqualTo("coverage");
    }

    @Test
    void analyze_withoutReportOrTests_reportsZeroCoverage() throws IOException {
        createFile("src/app.ts", "export const app = () => 1;\n");

        AnalysisResult result = analyzer.analyze(context("src/app.ts"));

        CoverageMetrics metrics = (CoverageMetrics) result.metrics();
        assertThat(metrics.overall().lines().percentage()).isZero();
        assertThat(metrics.effectiveness().effectivenessScore()).isEqualTo(70.0);
        assertThat(result.score()).isCloseTo(28.0, within(1e-9));
        assertThat(findById(result, "coverage-low")).isPresent();
        assertThat(findById(result, "coverage-branch-low")).isPresent();
    }

    @Test
    void analyze_summaryReport_reportsGapsLeastCoveredFirst() throws IOException {
        createFile("coverage/coverage-summary.json", """
            {
              "total": {
                "lines": {"total": 100, "covered": 90},
                "branches": {"total": 100, "covered": 60},
                "functions": {"total": 10, "covered": 10},
                "statements": {"total": 100, "covered": 90}
              },
              "src/components/Cart.tsx": {"lines": {"total": 50, "covered": 35}},
              "src/utils/format.ts": {"lines": {"total": 20, "covered": 8}},
              "src/ok.ts": {"lines": {"total": 30, "covered": 30}}
            }
            """);

        AnalysisResult result = analyzer.analyze(context());

        CoverageMetrics metrics = (CoverageMetrics) result.metrics();
        assertThat(metrics.gaps()).extracting(CoverageMetrics.CoverageGap::file)
            .containsExactly("src/utils/format.ts", "src/components/Cart.tsx");
        assertThat(findById(result, "coverage-low")).isEmpty();
        assertThat(findById(result, "coverage-branch-low")).isPresent();

        Finding utilsGap = findById(result, "gap-src/utils/format.ts").orElseThrow();
        assertThat(utilsGap.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(utilsGap.remediation()).isEqualTo("Test utility functions with various inputs");
        assertThat(findById(result, "gap-src/components/Cart.tsx").orElseThrow().severity())
            .isEqualTo(Severity.MEDIUM);

        // average (90 + 60 + 100 + 90) / 4 = 85, effectiveness unknown = 70
        assertThat(result.score()).isCloseTo(85 * 0.6 + 70 * 0.4, within(1e-9));
    }

    @Test
    void countTests_countsCasesAndAssertions() {
        TestFileReport report = analyzer.countTests("src/cart.test.ts", """
            describe('cart', () => {
              it('adds', () => { expect(add(1)).toBe(1); });
              test('removes', () => { expect(remove(1)).toBe(0); assert(ok); });
              test.each([1, 2])('handles %d', (n) => { expect(n).toBeTruthy(); });
            });
            """);

        assertThat(report.tests()).isEqualTo(3);
        assertThat(report.assertions()).isEqualTo(4);
    }

    @Test
    void analyze_testsWithoutAssertions_lowerEffectiveness() throws IOException {
        createFile("src/empty.test.ts", """
            it('renders', () => { render(); });
            it('clicks', () => { click(); });
            """);

        AnalysisResult result = analyzer.analyze(context("src/empty.test.ts"));

        CoverageMetrics.TestEffectiveness effectiveness = ((CoverageMetrics) result.metrics()).effectiveness();
        assertThat(effectiveness.totalTests()).isEqualTo(2);
        assertThat(effectiveness.testsWithoutAssertions()).isEqualTo(2);
        assertThat(effectiveness.effectivenessScore()).isEqualTo(20.0);
    }

    @Test
    void analyze_mixedTestFiles_penalizesOnlyFilesWithoutAssertions() throws IOException {
        createFile("src/a.test.ts", """
            it('one', () => { run(); });
            it('two', () => { run(); });
            """);
        createFile("src/b.spec.ts", """
            it('three', () => { expect(a).toBe(1); expect(b).toBe(2); });
            it('four', () => { expect(c).toBe(3); expect(d).toBe(4); });
            """);

        AnalysisResult result = analyzer.analyze(context("src/a.test.ts", "src/b.spec.ts"));

        CoverageMetrics.TestEffectiveness effectiveness = ((CoverageMetrics) result.metrics()).effectiveness();
        assertThat(effectiveness.totalTests()).isEqualTo(4);
        assertThat(effectiveness.averageAssertionsPerTest()).isEqualTo(1.0);
        assertThat(effectiveness.effectivenessScore()).isEqualTo(70.0);
    }
}
