package com.qualitygate.core.pipeline;

import com.qualitygate.core.analyzer.AnalysisContext;
import com.qualitygate.core.analyzer.Analyzer;
import com.qualitygate.core.analyzer.AnalyzerRegistry;
import com.qualitygate.core.analyzer.AnalyzerSettings;
import com.qualitygate.core.analyzer.impl.architecture.ArchitectureAnalyzer;
import com.qualitygate.core.analyzer.impl.coverage.CoverageAnalyzer;
import com.qualitygate.core.analyzer.impl.quality.CodeQualityAnalyzer;
import com.qualitygate.core.analyzer.impl.security.SecurityAnalyzer;
import com.qualitygate.core.cache.ContentHasher;
import com.qualitygate.core.cache.ResultCache;
import com.qualitygate.core.change.ChangeType;
import com.qualitygate.core.change.FileChange;
import com.qualitygate.core.change.FileChangeDetector;
import com.qualitygate.core.config.ConfigLoader;
import com.qualitygate.core.config.ConfigValidator;
import com.qualitygate.core.config.ConfigurationException;
import com.qualitygate.core.config.QualityConfig;
import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.ScoringResult;
import com.qualitygate.core.monitor.PerformanceMonitor;
import com.qualitygate.core.monitor.PerformanceReport;
import com.qualitygate.core.orchestrator.AggregatedAnalysis;
import com.qualitygate.core.orchestrator.AnalysisOrchestrator;
import com.qualitygate.core.scoring.ScoringEngine;
import com.qualitygate.core.trend.HistoricalRecord;
import com.qualitygate.core.trend.TrendAnalyzer;
import com.qualitygate.core.trend.TrendStorage;
import com.qualitygate.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Composition root of the quality gate pipeline.
 *
 * <p>One instance owns the cache, change detector, trend storage and orchestrator for a
 * project and can run any number of times. Each {@link #run(List)} executes:
 * <ol>
 *   <li>configuration validation</li>
 *   <li>change detection against the previous run</li>
 *   <li>analyzer creation from the registry</li>
 *   <li>concurrent analysis</li>
 *   <li>scoring and recommendations</li>
 *   <li>trend analysis against the stored history</li>
 *   <li>update of the change baselines</li>
 *   <li>performance report</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (QualityGate gate = new QualityGate.Builder(projectRoot).build()) {
 *     QualityGateRun run = gate.run(gate.discoverFiles());
 *     System.out.println(run.scoringResult().overall().summary());
 * }
 * }</pre>
 */
public class QualityGate implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    private final Path projectRoot;
    private final QualityConfig config;
    private final AnalyzerRegistry registry;
    private final ResultCache cache;
    private final FileChangeDetector detector;
    private final PerformanceMonitor monitor;
    private final AnalysisOrchestrator orchestrator;
    private final ScoringEngine engine;
    private final TrendStorage trendStorage;
    private final TrendAnalyzer trendAnalyzer = new TrendAnalyzer();

    private QualityGate(Builder builder) {
        this.projectRoot = builder.projectRoot;
        this.config = builder.config != null
            ? builder.config
            : ConfigLoader.load(projectRoot.resolve(ConfigLoader.DEFAULT_FILE_NAME));
        this.registry = builder.registry != null
            ? builder.registry
            : AnalyzerRegistry.withBuiltIns().loadProviders();

        ContentHasher hasher = new ContentHasher();
        this.cache = builder.cache != null
            ? builder.cache
            : new ResultCache(projectRoot, config.cache(), hasher, builder.clock);
        this.detector = new FileChangeDetector(projectRoot,
            projectRoot.resolve(config.changeDetection().stateFile()), hasher, builder.clock);
        this.monitor = builder.monitor != null
            ? builder.monitor
            : new PerformanceMonitor(Duration.ofMillis(config.performance().thresholdMillis()));
        this.orchestrator = new AnalysisOrchestrator(monitor);
        this.engine = new ScoringEngine(config, builder.clock);
        this.trendStorage = new TrendStorage(projectRoot.resolve(config.history().file()),
            config.history().maxRecords(), builder.clock);
    }

    public Path getProjectRoot() {
        return projectRoot;
    }

    public QualityConfig getConfig() {
        return config;
    }

    public ResultCache getCache() {
        return cache;
    }

    public PerformanceMonitor getMonitor() {
        return monitor;
    }

    public TrendStorage getTrendStorage() {
        return trendStorage;
    }

    /**
     * Discovers the project's source files using the configured extensions and exclusions.
     *
     * @return sorted project-relative paths
     * @throws ConfigurationException if the project directory cannot be walked
     */
    public List<String> discoverFiles() {
        try {
            return FileUtils.discoverFiles(projectRoot, config.sourceExtensions(), config.excludePaths());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot discover files below " + projectRoot + ": " + e.getMessage(), e);
        }
    }

    /**
     * Runs the whole pipeline on a file set.
     *
     * @param files project-relative file paths
     * @return scoring result, performance report and change classification
     * @throws ConfigurationException if the configuration violates an invariant
     */
    public QualityGateRun run(List<String> files) {
        ConfigValidator.validate(config);

        monitor.start();
        monitor.setFileCount(files.size());
        log.info("Running quality gate on {} files in {}", files.size(), projectRoot);

        // Change detection
        long detectionStart = System.nanoTime();
        List<FileChange> changes = detector.detectChanges(files);
        int changed = (int) changes.stream()
            .filter(change -> change.type() == ChangeType.ADDED || change.type() == ChangeType.MODIFIED)
            .count();
        monitor.recordChangeDetection(files.size(), changed, Duration.ofNanos(System.nanoTime() - detectionStart));

        // Analysis
        List<Analyzer> analyzers = registry.createAll(this::settingsFor);
        AnalysisContext context = new AnalysisContext(projectRoot, files, config, cache);
        AggregatedAnalysis analysis = orchestrator.run(analyzers, context);

        // Scoring and trend
        ScoringResult result = engine.score(analysis, projectRoot.toString());
        if (config.history().enabled()) {
            List<HistoricalRecord> history = trendStorage.load();
            result = result.withTrend(trendAnalyzer.analyze(result, history));
            trendStorage.append(HistoricalRecord.from(result));
        }

        detector.updateRecords(files);

        monitor.recordCache(cache.getStatistics());
        PerformanceReport report = monitor.end();

        log.info("Quality gate finished: {} in {} ms", result.overall().summary(), report.totalTime().toMillis());
        return new QualityGateRun(result, report, changes);
    }

    /**
     * Builds the settings for a registered analyzer type: built-in categories read their
     * configuration section, third-party types get defaults.
     */
    AnalyzerSettings settingsFor(String type) {
        return AnalysisCategory.fromAnalyzerType(type)
            .map(category -> AnalyzerSettings.from(defaultName(category), config.analyzers().forCategory(category)))
            .orElseGet(() -> AnalyzerSettings.defaults(type));
    }

    private static String defaultName(AnalysisCategory category) {
        return switch (category) {
            case CODE_QUALITY -> CodeQualityAnalyzer.DEFAULT_NAME;
            case TEST_COVERAGE -> CoverageAnalyzer.DEFAULT_NAME;
            case ARCHITECTURE -> ArchitectureAnalyzer.DEFAULT_NAME;
            case SECURITY -> SecurityAnalyzer.DEFAULT_NAME;
        };
    }

    @Override
    public void close() {
        orchestrator.close();
    }

    /**
     * Builder for {@link QualityGate}; everything except the project root is optional.
     */
    public static class Builder {
        private final Path projectRoot;
        private QualityConfig config;
        private AnalyzerRegistry registry;
        private ResultCache cache;
        private PerformanceMonitor monitor;
        private Clock clock = Clock.systemUTC();

        public Builder(Path projectRoot) {
            this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot must not be null")
                .toAbsolutePath().normalize();
        }

        /**
         * Uses the given configuration instead of loading {@code .qualitygate.yaml}.
         */
        public Builder config(QualityConfig config) {
            this.config = config;
            return this;
        }

        public Builder registry(AnalyzerRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder cache(ResultCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder monitor(PerformanceMonitor monitor) {
            this.monitor = monitor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public QualityGate build() {
            return new QualityGate(this);
        }
    }
}
