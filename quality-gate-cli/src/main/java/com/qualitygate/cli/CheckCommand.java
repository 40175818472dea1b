package com.qualitygate.cli;

import com.qualitygate.core.config.ConfigLoader;
import com.qualitygate.core.config.ConfigurationException;
import com.qualitygate.core.config.QualityConfig;
import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.ComponentScore;
import com.qualitygate.core.model.Finding;
import com.qualitygate.core.model.Recommendation;
import com.qualitygate.core.model.ScoringResult;
import com.qualitygate.core.model.TrendData;
import com.qualitygate.core.pipeline.QualityGate;
import com.qualitygate.core.pipeline.QualityGateRun;
import com.qualitygate.core.trend.TrendAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to analyze a project and decide whether it passes the quality gate.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load and validate the configuration</li>
 *   <li>Discover source files</li>
 *   <li>Run all enabled analyzers concurrently</li>
 *   <li>Score the results and compare with the stored history</li>
 *   <li>Print the summary and map the outcome to an exit code</li>
 * </ol>
 *
 * <p><b>Exit codes:</b> {@value ExitCode#PASS} pass, {@value ExitCode#QUALITY_FAILURE} below the
 * passing score, {@value ExitCode#CONFIGURATION_ERROR} configuration error,
 * {@value ExitCode#EXECUTION_ERROR} execution error.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Check current directory
 * quality-gate check
 *
 * # Check another project with an explicit config and the performance report
 * quality-gate check ../storefront -c ci/quality.yaml --performance
 * }</pre>
 */
@Command(
    name = "check",
    description = "Analyze a project and report its quality score",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    private static final int MAX_FINDINGS = 10;

    @Parameters(
        index = "0",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    private Path projectPath;

    @Mixin
    private ConfigOption configOption;

    @Option(
        names = {"--performance"},
        description = "Print the performance report after the summary"
    )
    private boolean showPerformance;

    @Override
    public Integer call() {
        Path root = projectPath.toAbsolutePath().normalize();
        try {
            log.info("Starting quality check of: {}", root);
            QualityConfig config = ConfigLoader.loadAndValidate(configOption.resolve(root));

            try (QualityGate gate = new QualityGate.Builder(root).config(config).build()) {
                List<String> files = gate.discoverFiles();
                System.out.println("Checking project: " + root);
                System.out.println("✓ Discovered " + files.size() + " source files");

                QualityGateRun run = gate.run(files);
                System.out.println("✓ " + run.changedFileCount() + " files changed since the previous run");
                System.out.println();
                printResult(run.scoringResult());

                if (showPerformance) {
                    System.out.println();
                    System.out.print(gate.getMonitor().formatReport(run.performanceReport()));
                }
                return run.passed() ? ExitCode.PASS : ExitCode.QUALITY_FAILURE;
            }
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            System.err.println("✗ Configuration error: " + e.getMessage());
            return ExitCode.CONFIGURATION_ERROR;
        } catch (Exception e) {
            log.error("Quality check failed", e);
            System.err.println("✗ Quality check failed: " + e.getMessage());
            return ExitCode.EXECUTION_ERROR;
        }
    }

    // ==================== Output ====================

    private void printResult(ScoringResult result) {
        System.out.printf("Overall: %.1f (grade %s) - %s%n",
            result.overall().score(), result.overall().grade(), result.overall().status());
        System.out.println(result.overall().summary());
        System.out.println();

        System.out.println("Category scores:");
        for (Map.Entry<AnalysisCategory, ComponentScore> entry : result.componentScores().entrySet()) {
            ComponentScore score = entry.getValue();
            String degraded = result.metadata().degradedCategories().containsKey(entry.getKey()) ? " (degraded)" : "";
            System.out.printf("  %-14s %5.1f  x %.2f = %5.1f%s%n",
                entry.getKey().displayName(), score.score(), score.weight(), score.weightedScore(), degraded);
        }
        for (AnalysisCategory disabled : result.metadata().disabledCategories()) {
            System.out.printf("  %-14s disabled%n", disabled.displayName());
        }
        result.metadata().degradedCategories().forEach((category, reason) ->
            System.out.println("  ! " + category.displayName() + " failed: " + reason));

        if (!result.findings().isEmpty()) {
            System.out.println();
            System.out.println("Findings (" + result.findings().size() + "):");
            result.findings().stream()
                .sorted(Comparator.comparing(Finding::severity))
                .limit(MAX_FINDINGS)
                .forEach(finding -> System.out.printf("  [%s] %s%s%n",
                    finding.severity(), finding.title(),
                    finding.location() != null ? " (" + finding.location().file() + ")" : ""));
        }

        if (!result.recommendations().isEmpty()) {
            System.out.println();
            System.out.println("Recommendations:");
            for (Recommendation recommendation : result.recommendations()) {
                System.out.printf("  [%s] %s: %s%n",
                    recommendation.priority(), recommendation.issue(), recommendation.remediation());
            }
        }

        TrendData trend = result.trend();
        if (trend != null) {
            System.out.println();
            System.out.println("Trend: " + new TrendAnalyzer().summarize(trend));
        }
    }
}
