package com.qualitygate.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CheckCommand}.
 */
class CheckCommandTest extends CliTestSupport {

    @Test
    void check_scoreAbovePassingScore_exitsWithPass() throws IOException {
        writeSampleProject();
        write(".qualitygate.yaml", """
            scoring:
              passingScore: 0
            """);

        int exitCode = execute("check", tempDir.toString());

        assertThat(exitCode).isEqualTo(ExitCode.PASS);
        assertThat(output())
            .contains("✓ Discovered 3 source files")
            .contains("Category scores:")
            .contains("Circular dependency detected (src/a.ts)")
            .contains("Trend: Quality is stable (first recorded run)");
    }

    @Test
    void check_scoreBelowPassingScore_exitsWithQualityFailure() throws IOException {
        writeSampleProject();
        write(".qualitygate.yaml", """
            scoring:
              passingScore: 100
            """);

        int exitCode = execute("check", tempDir.toString());

        assertThat(exitCode).isEqualTo(ExitCode.QUALITY_FAILURE);
        assertThat(output()).contains("FAIL");
    }

    @Test
    void check_weightsNotSummingToOne_exitsWithConfigurationError() throws IOException {
        writeSampleProject();
        write(".qualitygate.yaml", """
            scoring:
              weights:
                codeQuality: 0.5
                testCoverage: 0.5
                architecture: 0.5
                security: 0.5
            """);

        int exitCode = execute("check", tempDir.toString());

        assertThat(exitCode).isEqualTo(ExitCode.CONFIGURATION_ERROR);
        assertThat(errorOutput()).contains("must sum to 1.0");
    }

    @Test
    void check_explicitConfigOption_overridesProjectFile() throws IOException {
        writeSampleProject();
        write(".qualitygate.yaml", "scoring:\n  passingScore: 100\n");
        Path lenient = write("ci/lenient.yaml", "scoring:\n  passingScore: 0\n");

        int exitCode = execute("check", tempDir.toString(), "-c", lenient.toString());

        assertThat(exitCode).isEqualTo(ExitCode.PASS);
    }

    @Test
    void check_performanceFlag_printsPerformanceReport() throws IOException {
        writeSampleProject();
        write(".qualitygate.yaml", "scoring:\n  passingScore: 0\n");

        execute("check", tempDir.toString(), "--performance");

        assertThat(output()).contains("CodeQualityAnalyzer:");
    }

    @Test
    void check_disabledCategory_isListedAsDisabled() throws IOException {
        writeSampleProject();
        write(".qualitygate.yaml", """
            analyzers:
              coverage:
                enabled: false
            scoring:
              passingScore: 0
            """);

        int exitCode = execute("check", tempDir.toString());

        assertThat(exitCode).isEqualTo(ExitCode.PASS);
        assertThat(output()).containsPattern("Test Coverage\\s+disabled");
    }
}
