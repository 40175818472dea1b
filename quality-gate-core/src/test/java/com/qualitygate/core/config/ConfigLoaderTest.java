package com.qualitygate.core.config;

import com.qualitygate.core.model.AnalysisCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            project:
              name: "storefront"
              version: "2.1.0"

            analyzers:
              codeQuality:
                complexityWarning: 8
                complexityCritical: 15
              coverage:
                enabled: false
              architecture:
                maxComponentLines: 300
                timeoutSeconds: 10
              security:
                auditReport: "reports/audit.json"
                retryAttempts: 0

            scoring:
              passingScore: 75
              maxRecommendations: 3
              disabledCategoryPolicy: DROP
              weights:
                codeQuality: 0.4
                testCoverage: 0.3
                architecture: 0.2
                security: 0.1

            cache:
              directory: ".cache/quality"
              ttlSeconds: 3600
              maxSize: 50

            history:
              maxRecords: 10
            """);

        QualityConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("storefront");
        assertThat(config.project().version()).isEqualTo("2.1.0");
        assertThat(config.analyzers().codeQuality().complexityWarning()).isEqualTo(8);
        assertThat(config.analyzers().codeQuality().complexityCritical()).isEqualTo(15);
        assertThat(config.analyzers().isEnabled(AnalysisCategory.TEST_COVERAGE)).isFalse();
        assertThat(config.analyzers().architecture().maxComponentLines()).isEqualTo(300);
        assertThat(config.analyzers().architecture().timeoutSeconds()).isEqualTo(10L);
        assertThat(config.analyzers().security().auditReport()).isEqualTo("reports/audit.json");
        assertThat(config.analyzers().security().retryAttempts()).isZero();
        assertThat(config.scoring().passingScore()).isEqualTo(75.0);
        assertThat(config.scoring().maxRecommendations()).isEqualTo(3);
        assertThat(config.scoring().disabledCategoryPolicy()).isEqualTo(QualityConfig.DisabledCategoryPolicy.DROP);
        assertThat(config.scoring().weights().codeQuality()).isEqualTo(0.4);
        assertThat(config.cache().directory()).isEqualTo(".cache/quality");
        assertThat(config.cache().ttlSeconds()).isEqualTo(3600L);
        assertThat(config.cache().maxSize()).isEqualTo(50);
        assertThat(config.history().maxRecords()).isEqualTo(10);
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            project:
              name: "minimal"
            """);

        QualityConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("minimal");
        assertThat(config.project().version()).isEqualTo("1.0.0");
        assertThat(config.scoring().passingScore()).isEqualTo(80.0);
        assertThat(config.scoring().maxRecommendations()).isEqualTo(5);
        assertThat(config.scoring().disabledCategoryPolicy())
            .isEqualTo(QualityConfig.DisabledCategoryPolicy.RENORMALIZE);
        assertThat(config.scoring().weights().testCoverage()).isEqualTo(0.35);
        assertThat(config.cache().enabled()).isTrue();
        assertThat(config.cache().ttlSeconds()).isEqualTo(86400L);
        assertThat(config.cache().maxSize()).isEqualTo(1000);
        assertThat(config.analyzers().coverage().timeoutSeconds()).isEqualTo(30L);
        assertThat(config.analyzers().architecture().timeoutSeconds()).isEqualTo(45L);
        assertThat(config.sourceExtensions()).containsExactly(".ts", ".tsx", ".js", ".jsx");
        assertThat(config.excludePaths()).contains("node_modules", ".quality");
    }

    @Test
    void load_unknownProperties_areIgnored() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            project:
              name: "lenient"
              owner: "platform-team"
            notifications:
              slack: true
            """);

        QualityConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("lenient");
    }

    @Test
    void load_missingFile_returnsDefaults() {
        QualityConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(QualityConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "   \n");

        QualityConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(QualityConfig.defaults());
    }

    @Test
    void load_malformedYaml_throwsConfigurationException() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            scoring:
              passingScore: [not, a, number
            """);

        assertThatThrownBy(() -> ConfigLoader.load(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Failed to parse configuration file");
    }

    @Test
    void load_directoryInsteadOfFile_throwsConfigurationException() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("config-dir"));

        assertThatThrownBy(() -> ConfigLoader.load(directory))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("not readable");
    }

    @Test
    void loadAndValidate_invalidWeights_throwsWithErrors() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            scoring:
              weights:
                codeQuality: 0.5
                testCoverage: 0.5
                architecture: 0.5
                security: 0.5
            """);

        assertThatThrownBy(() -> ConfigLoader.loadAndValidate(configFile))
            .isInstanceOf(ConfigurationException.class)
            .satisfies(e -> assertThat(((ConfigurationException) e).getErrors())
                .anyMatch(error -> error.contains("must sum to 1.0")));
    }
}
