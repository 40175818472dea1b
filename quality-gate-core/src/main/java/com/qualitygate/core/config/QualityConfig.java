package com.qualitygate.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.qualitygate.core.model.AnalysisCategory;

import java.util.List;

/**
 * Root configuration for a quality gate run.
 *
 * <p>Loaded from {@code .qualitygate.yaml} in the project root. Every section is optional;
 * missing sections and missing values fall back to the defaults documented on each record.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "storefront"
 *
 * analyzers:
 *   coverage:
 *     enabled: false
 *   architecture:
 *     maxComponentLines: 400
 *
 * scoring:
 *   passingScore: 75
 *   weights:
 *     codeQuality: 0.3
 *     testCoverage: 0.35
 *     architecture: 0.2
 *     security: 0.15
 *
 * cache:
 *   ttlSeconds: 3600
 * }</pre>
 *
 * @param project project metadata
 * @param analyzers per-analyzer settings
 * @param scoring weights and thresholds
 * @param cache result cache settings
 * @param changeDetection change detector settings
 * @param history trend history settings
 * @param performance performance monitor settings
 * @param sourceExtensions file extensions handed to analyzers
 * @param excludePaths path fragments excluded from discovery
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QualityConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("analyzers") AnalyzersConfig analyzers,
    @JsonProperty("scoring") ScoringConfig scoring,
    @JsonProperty("cache") CacheConfig cache,
    @JsonProperty("changeDetection") ChangeDetectionConfig changeDetection,
    @JsonProperty("history") HistoryConfig history,
    @JsonProperty("performance") PerformanceConfig performance,
    @JsonProperty("sourceExtensions") List<String> sourceExtensions,
    @JsonProperty("excludePaths") List<String> excludePaths
) {
    public static final List<String> DEFAULT_SOURCE_EXTENSIONS = List.of(".ts", ".tsx", ".js", ".jsx");
    public static final List<String> DEFAULT_EXCLUDE_PATHS =
        List.of("node_modules", "dist", "build", "coverage", ".quality", ".git");

    /**
     * Compact constructor filling in defaults for missing sections.
     */
    public QualityConfig {
        if (project == null) {
            project = new ProjectInfo(null, null);
        }
        if (analyzers == null) {
            analyzers = new AnalyzersConfig(null, null, null, null);
        }
        if (scoring == null) {
            scoring = new ScoringConfig(null, null, null, null);
        }
        if (cache == null) {
            cache = new CacheConfig(null, null, null, null);
        }
        if (changeDetection == null) {
            changeDetection = new ChangeDetectionConfig(null);
        }
        if (history == null) {
            history = new HistoryConfig(null, null, null);
        }
        if (performance == null) {
            performance = new PerformanceConfig(null);
        }
        if (sourceExtensions == null || sourceExtensions.isEmpty()) {
            sourceExtensions = DEFAULT_SOURCE_EXTENSIONS;
        }
        if (excludePaths == null) {
            excludePaths = DEFAULT_EXCLUDE_PATHS;
        }
    }

    /**
     * Creates the default configuration: all four analyzers enabled, default weights,
     * passing score 80, cache enabled.
     *
     * @return default configuration
     */
    public static QualityConfig defaults() {
        return new QualityConfig(null, null, null, null, null, null, null, null, null);
    }

    /**
     * Checks whether a path has one of the configured source extensions.
     *
     * @param path project-relative path
     * @return true if the file should be analyzed
     */
    public boolean isSourceFile(String path) {
        return sourceExtensions.stream().anyMatch(path::endsWith);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version
    ) {
        public ProjectInfo {
            if (name == null) {
                name = "project";
            }
            if (version == null) {
                version = "1.0.0";
            }
        }
    }

    /**
     * Settings for the built-in analyzers.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalyzersConfig(
        @JsonProperty("codeQuality") CodeQualityConfig codeQuality,
        @JsonProperty("coverage") CoverageConfig coverage,
        @JsonProperty("architecture") ArchitectureConfig architecture,
        @JsonProperty("security") SecurityConfig security
    ) {
        public AnalyzersConfig {
            if (codeQuality == null) {
                codeQuality = new CodeQualityConfig(null, null, null, null, null, null);
            }
            if (coverage == null) {
                coverage = new CoverageConfig(null, null, null, null, null, null);
            }
            if (architecture == null) {
                architecture = new ArchitectureConfig(null, null, null, null);
            }
            if (security == null) {
                security = new SecurityConfig(null, null, null, null);
            }
        }

        /**
         * Returns the options section for a category.
         *
         * @param category analysis category
         * @return analyzer options
         */
        public AnalyzerOptions forCategory(AnalysisCategory category) {
            return switch (category) {
                case CODE_QUALITY -> codeQuality;
                case TEST_COVERAGE -> coverage;
                case ARCHITECTURE -> architecture;
                case SECURITY -> security;
            };
        }

        /**
         * Checks whether the analyzer for a category is enabled.
         *
         * @param category analysis category
         * @return true if enabled
         */
        public boolean isEnabled(AnalysisCategory category) {
            return forCategory(category).isEnabled();
        }
    }

    /**
     * @param complexityWarning complexity above which a function is a warning (default 10)
     * @param complexityCritical complexity above which a function is critical (default 20)
     * @param duplicationMaxPercent duplication above which a finding is raised (default 5)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CodeQualityConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("timeoutSeconds") Long timeoutSeconds,
        @JsonProperty("retryAttempts") Integer retryAttempts,
        @JsonProperty("complexityWarning") Integer complexityWarning,
        @JsonProperty("complexityCritical") Integer complexityCritical,
        @JsonProperty("duplicationMaxPercent") Double duplicationMaxPercent
    ) implements AnalyzerOptions {
        public CodeQualityConfig {
            if (enabled == null) {
                enabled = true;
            }
            if (timeoutSeconds == null) {
                timeoutSeconds = 60L;
            }
            if (retryAttempts == null) {
                retryAttempts = 1;
            }
            if (complexityWarning == null) {
                complexityWarning = 10;
            }
            if (complexityCritical == null) {
                complexityCritical = 20;
            }
            if (duplicationMaxPercent == null) {
                duplicationMaxPercent = 5.0;
            }
        }
    }

    /**
     * @param minimumPercent line coverage target (default 80)
     * @param branchMinimumPercent branch coverage target (default 75)
     * @param reportPaths coverage summary candidates, relative to the project root
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CoverageConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("timeoutSeconds") Long timeoutSeconds,
        @JsonProperty("retryAttempts") Integer retryAttempts,
        @JsonProperty("minimumPercent") Double minimumPercent,
        @JsonProperty("branchMinimumPercent") Double branchMinimumPercent,
        @JsonProperty("reportPaths") List<String> reportPaths
    ) implements AnalyzerOptions {
        public static final List<String> DEFAULT_REPORT_PATHS = List.of(
            "coverage/coverage-summary.json",
            "coverage/coverage-final.json",
            "coverage-final.json",
            ".nyc_output/coverage-final.json");

        public CoverageConfig {
            if (enabled == null) {
                enabled = true;
            }
            if (timeoutSeconds == null) {
                timeoutSeconds = 30L;
            }
            if (retryAttempts == null) {
                retryAttempts = 1;
            }
            if (minimumPercent == null) {
                minimumPercent = 80.0;
            }
            if (branchMinimumPercent == null) {
                branchMinimumPercent = 75.0;
            }
            if (reportPaths == null || reportPaths.isEmpty()) {
                reportPaths = DEFAULT_REPORT_PATHS;
            }
        }
    }

    /**
     * @param maxComponentLines line count above which a component is oversized (default 500)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ArchitectureConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("timeoutSeconds") Long timeoutSeconds,
        @JsonProperty("retryAttempts") Integer retryAttempts,
        @JsonProperty("maxComponentLines") Integer maxComponentLines
    ) implements AnalyzerOptions {
        public ArchitectureConfig {
            if (enabled == null) {
                enabled = true;
            }
            if (timeoutSeconds == null) {
                timeoutSeconds = 45L;
            }
            if (retryAttempts == null) {
                retryAttempts = 1;
            }
            if (maxComponentLines == null) {
                maxComponentLines = 500;
            }
        }
    }

    /**
     * @param auditReport path of an {@code npm audit --json} report, relative to the project root
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SecurityConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("timeoutSeconds") Long timeoutSeconds,
        @JsonProperty("retryAttempts") Integer retryAttempts,
        @JsonProperty("auditReport") String auditReport
    ) implements AnalyzerOptions {
        public SecurityConfig {
            if (enabled == null) {
                enabled = true;
            }
            if (timeoutSeconds == null) {
                timeoutSeconds = 60L;
            }
            if (retryAttempts == null) {
                retryAttempts = 1;
            }
            if (auditReport == null) {
                auditReport = "npm-audit.json";
            }
        }
    }

    /**
     * What happens to the weight of a disabled category.
     */
    public enum DisabledCategoryPolicy {
        /** Remaining weights are scaled so they sum to 1.0 again */
        RENORMALIZE,
        /** The weight is dropped; the theoretical maximum falls below 100 */
        DROP
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScoringConfig(
        @JsonProperty("weights") Weights weights,
        @JsonProperty("passingScore") Double passingScore,
        @JsonProperty("maxRecommendations") Integer maxRecommendations,
        @JsonProperty("disabledCategoryPolicy") DisabledCategoryPolicy disabledCategoryPolicy
    ) {
        public ScoringConfig {
            if (weights == null) {
                weights = Weights.defaults();
            }
            if (passingScore == null) {
                passingScore = 80.0;
            }
            if (maxRecommendations == null) {
                maxRecommendations = 5;
            }
            if (disabledCategoryPolicy == null) {
                disabledCategoryPolicy = DisabledCategoryPolicy.RENORMALIZE;
            }
        }
    }

    /**
     * Category weights; they must sum to 1.0 within 0.01.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Weights(
        @JsonProperty("codeQuality") Double codeQuality,
        @JsonProperty("testCoverage") Double testCoverage,
        @JsonProperty("architecture") Double architecture,
        @JsonProperty("security") Double security
    ) {
        public Weights {
            if (codeQuality == null) {
                codeQuality = 0.30;
            }
            if (testCoverage == null) {
                testCoverage = 0.35;
            }
            if (architecture == null) {
                architecture = 0.20;
            }
            if (security == null) {
                security = 0.15;
            }
        }

        public static Weights defaults() {
            return new Weights(null, null, null, null);
        }

        public double forCategory(AnalysisCategory category) {
            return switch (category) {
                case CODE_QUALITY -> codeQuality;
                case TEST_COVERAGE -> testCoverage;
                case ARCHITECTURE -> architecture;
                case SECURITY -> security;
            };
        }

        public double sum() {
            return codeQuality + testCoverage + architecture + security;
        }
    }

    /**
     * @param enabled whether results are cached (default true)
     * @param directory cache directory relative to the project root (default {@code .quality/.cache})
     * @param ttlSeconds entry time-to-live (default 86400)
     * @param maxSize maximum in-memory entries (default 1000)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CacheConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("directory") String directory,
        @JsonProperty("ttlSeconds") Long ttlSeconds,
        @JsonProperty("maxSize") Integer maxSize
    ) {
        public CacheConfig {
            if (enabled == null) {
                enabled = true;
            }
            if (directory == null) {
                directory = ".quality/.cache";
            }
            if (ttlSeconds == null) {
                ttlSeconds = 86400L;
            }
            if (maxSize == null) {
                maxSize = 1000;
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChangeDetectionConfig(
        @JsonProperty("stateFile") String stateFile
    ) {
        public ChangeDetectionConfig {
            if (stateFile == null) {
                stateFile = ".quality/.state.json";
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HistoryConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("file") String file,
        @JsonProperty("maxRecords") Integer maxRecords
    ) {
        public HistoryConfig {
            if (enabled == null) {
                enabled = true;
            }
            if (file == null) {
                file = ".quality/history.json";
            }
            if (maxRecords == null) {
                maxRecords = 30;
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PerformanceConfig(
        @JsonProperty("thresholdMillis") Long thresholdMillis
    ) {
        public PerformanceConfig {
            if (thresholdMillis == null) {
                thresholdMillis = 2000L;
            }
        }
    }
}
