package com.qualitygate.core.analyzer.impl.architecture;

import com.qualitygate.core.analyzer.AnalysisContext;
import com.qualitygate.core.analyzer.AnalyzerSettings;
import com.qualitygate.core.analyzer.base.AbstractLineAnalyzer;
import com.qualitygate.core.config.QualityConfig;
import com.qualitygate.core.graph.CycleDetector;
import com.qualitygate.core.graph.DependencyGraph;
import com.qualitygate.core.graph.DependencyGraphBuilder;
import com.qualitygate.core.graph.ImportExtractor;
import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.AnalysisResult;
import com.qualitygate.core.model.ArchitectureMetrics;
import com.qualitygate.core.model.ArchitectureMetrics.ComponentMetrics;
import com.qualitygate.core.model.ArchitectureMetrics.DependencyMetrics;
import com.qualitygate.core.model.ArchitectureMetrics.OversizedComponent;
import com.qualitygate.core.model.ArchitectureMetrics.PatternCompliance;
import com.qualitygate.core.model.ArchitectureMetrics.PatternIssue;
import com.qualitygate.core.model.ArchitectureMetrics.PatternMetrics;
import com.qualitygate.core.model.CircularDependency;
import com.qualitygate.core.model.FileLocation;
import com.qualitygate.core.model.Finding;
import com.qualitygate.core.model.Severity;
import com.qualitygate.core.scoring.SubScores;
import com.qualitygate.core.util.FileUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checks component size, import structure and state/hook usage patterns.
 *
 * <p>Components are classified by atomic-design folder ({@code atoms}, {@code molecules},
 * {@code organisms}, {@code templates}). A lower layer importing a higher one (an atom
 * importing a molecule, for example) counts as a layer violation.
 *
 * <p>Per-file facts are cached; the import graph and its cycles are rebuilt on every run
 * because a change in one file can close or break a cycle through unchanged files.
 */
public class ArchitectureAnalyzer extends AbstractLineAnalyzer {

    public static final String DEFAULT_NAME = "ArchitectureAnalyzer";

    /** Atomic-design layers, lowest first. */
    static final List<String> LAYERS = List.of("atoms", "molecules", "organisms", "templates");
    static final String UNKNOWN_TYPE = "unknown";

    private static final Pattern STATE_MUTATION = Pattern.compile(
        "\\bstate\\.[\\w.\\[\\]'\"]+\\s*(?:=(?![=>])|\\+=|-=|\\+\\+|--)");
    private static final Pattern CONDITIONAL = Pattern.compile("\\bif\\s*\\(");
    private static final Pattern HOOK_CALL = Pattern.compile("\\buse[A-Z]\\w*\\s*\\(");

    private static final int MAX_OVERSIZED = 10;
    private static final int OVERSIZED_FINDINGS = 3;
    private static final int MAX_PATTERN_ISSUES = 5;
    private static final int STATE_FINDINGS = 2;
    private static final double PATTERN_ISSUE_PENALTY = 20;

    private final CycleDetector cycleDetector;

    public ArchitectureAnalyzer(AnalyzerSettings settings) {
        this(settings, new CycleDetector());
    }

    ArchitectureAnalyzer(AnalyzerSettings settings, CycleDetector cycleDetector) {
        super(settings);
        this.cycleDetector = cycleDetector;
    }

    @Override
    public AnalysisCategory getCategory() {
        return AnalysisCategory.ARCHITECTURE;
    }

    @Override
    protected AnalysisResult doAnalyze(AnalysisContext context) {
        QualityConfig.ArchitectureConfig config = context.configuration().analyzers().architecture();

        List<FileStructureReport> reports = new ArrayList<>();
        for (String file : context.sourceFiles()) {
            analyzeFile(context, file, FileStructureReport.class, this::analyzeContent).ifPresent(reports::add);
        }

        ArchitectureMetrics metrics = new ArchitectureMetrics(
            analyzeComponents(reports, config),
            analyzeDependencies(reports, context.configuration().sourceExtensions()),
            analyzePatterns(reports));

        return buildResult(SubScores.architecture(metrics), generateFindings(metrics, config), metrics);
    }

    // ==================== Per-File Analysis ====================

    FileStructureReport analyzeContent(String file, String content) {
        List<String> lines = splitLines(content);

        List<PatternIssue> stateIssues = new ArrayList<>();
        if (file.contains("/store/") || file.contains("/slices/") || file.startsWith("store/")) {
            findLineMatches(STATE_MUTATION, lines).stream()
                .findFirst()
                .ifPresent(match -> stateIssues.add(new PatternIssue(
                    file,
                    match.line(),
                    "State mutation",
                    "Direct state mutation detected",
                    "Return a new state object or rely on an immer-based reducer",
                    Severity.HIGH)));
        }

        List<PatternIssue> hookIssues = new ArrayList<>();
        for (int i = 0; i + 1 < lines.size(); i++) {
            if (isComment(lines.get(i)) || !CONDITIONAL.matcher(lines.get(i)).find()) {
                continue;
            }
            if (HOOK_CALL.matcher(lines.get(i + 1)).find()) {
                hookIssues.add(new PatternIssue(
                    file,
                    i + 2,
                    "Hook not at top level",
                    "Hook called conditionally",
                    "Move the hook call to the top level of the component",
                    Severity.HIGH));
            }
        }

        return new FileStructureReport(file, FileUtils.countLines(content),
            ImportExtractor.extract(content), stateIssues, hookIssues);
    }

    // ==================== Components ====================

    private ComponentMetrics analyzeComponents(List<FileStructureReport> reports,
                                               QualityConfig.ArchitectureConfig config) {
        Map<String, Integer> byType = new LinkedHashMap<>();
        LAYERS.forEach(layer -> byType.put(layer, 0));
        byType.put(UNKNOWN_TYPE, 0);

        List<OversizedComponent> oversized = new ArrayList<>();
        long totalLines = 0;
        for (FileStructureReport report : reports) {
            byType.merge(classify(report.file()), 1, Integer::sum);
            totalLines += report.lineCount();
            if (report.lineCount() > config.maxComponentLines()) {
                oversized.add(new OversizedComponent(
                    report.file(),
                    FileUtils.getBaseName(report.file()),
                    report.lineCount(),
                    "Split into smaller components or extract logic to utilities"));
            }
        }

        oversized.sort(Comparator.comparingInt(OversizedComponent::lines).reversed());
        double averageSize = reports.isEmpty() ? 0 : Math.round((double) totalLines / reports.size());
        return new ComponentMetrics(
            reports.size(),
            byType,
            oversized.subList(0, Math.min(MAX_OVERSIZED, oversized.size())),
            averageSize);
    }

    /**
     * Classifies a file by the first atomic-design folder in its path.
     *
     * @param file project-relative path
     * @return layer name or {@code unknown}
     */
    static String classify(String file) {
        for (String segment : file.split("/")) {
            if (LAYERS.contains(segment)) {
                return segment;
            }
        }
        return UNKNOWN_TYPE;
    }

    // ==================== Dependencies ====================

    private DependencyMetrics analyzeDependencies(List<FileStructureReport> reports, List<String> extensions) {
        Map<String, List<String>> importsByFile = new LinkedHashMap<>();
        for (FileStructureReport report : reports) {
            importsByFile.put(report.file(), report.imports());
        }

        DependencyGraph graph = new DependencyGraphBuilder(extensions).build(importsByFile);
        List<CircularDependency> cycles = cycleDetector.detect(graph);

        return new DependencyMetrics(
            graph.nodeCount(),
            graph.edgeCount(),
            cycles,
            countLayerViolations(graph),
            graph.externalDependencies());
    }

    private int countLayerViolations(DependencyGraph graph) {
        int violations = 0;
        for (String node : graph.nodes()) {
            int from = LAYERS.indexOf(classify(node));
            if (from < 0) {
                continue;
            }
            for (String target : graph.dependenciesOf(node)) {
                if (LAYERS.indexOf(classify(target)) > from) {
                    log.debug("Layer violation: {} imports {}", node, target);
                    violations++;
                }
            }
        }
        return violations;
    }

    // ==================== Patterns ====================

    private PatternMetrics analyzePatterns(List<FileStructureReport> reports) {
        List<PatternIssue> stateIssues = reports.stream()
            .flatMap(report -> report.stateIssues().stream())
            .toList();
        List<PatternIssue> hookIssues = reports.stream()
            .flatMap(report -> report.hookIssues().stream())
            .toList();
        return new PatternMetrics(compliance(stateIssues), compliance(hookIssues));
    }

    private PatternCompliance compliance(List<PatternIssue> issues) {
        double score = 100 - Math.min(issues.size() * PATTERN_ISSUE_PENALTY, 100);
        return new PatternCompliance(issues.subList(0, Math.min(MAX_PATTERN_ISSUES, issues.size())), score);
    }

    // ==================== Findings ====================

    private List<Finding> generateFindings(ArchitectureMetrics metrics, QualityConfig.ArchitectureConfig config) {
        List<Finding> findings = new ArrayList<>();

        metrics.components().oversized().stream()
            .limit(OVERSIZED_FINDINGS)
            .forEach(component -> findings.add(finding(
                "oversized-" + component.file(),
                Severity.MEDIUM,
                "Oversized component",
                String.format("Component '%s' has %d lines, recommended max is %d",
                    component.name(), component.lines(), config.maxComponentLines()),
                component.suggestion(),
                FileLocation.of(component.file()),
                "Lines: " + component.lines())));

        for (CircularDependency cycle : metrics.dependencies().circularDependencies()) {
            findings.add(finding(
                "circular-" + cycle.path().get(0),
                cycle.severity(),
                "Circular dependency detected",
                "Circular dependency: " + cycle.describe(),
                "Restructure modules to break the circular dependency",
                FileLocation.of(cycle.path().get(0)),
                "Cycle: " + cycle.describe()));
        }

        int layerViolations = metrics.dependencies().layerViolations();
        if (layerViolations > 0) {
            findings.add(finding(
                "layer-violations",
                Severity.MEDIUM,
                "Component layer violations",
                layerViolations + " imports point from a lower component layer to a higher one",
                "Atoms must not import molecules, organisms or templates; move shared code down a layer",
                null,
                "Violations: " + layerViolations));
        }

        metrics.patterns().stateManagement().issues().stream()
            .limit(STATE_FINDINGS)
            .forEach(issue -> findings.add(finding(
                "redux-" + issue.file(),
                issue.severity(),
                "Redux pattern violation",
                issue.issue(),
                issue.suggestion(),
                new FileLocation(issue.file(), issue.line(), null),
                Optional.ofNullable(issue.line()).map(line -> "Line: " + line).orElse(null))));

        return findings;
    }
}
