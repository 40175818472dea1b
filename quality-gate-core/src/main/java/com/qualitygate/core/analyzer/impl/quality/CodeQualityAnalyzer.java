package com.qualitygate.core.analyzer.impl.quality;

import com.qualitygate.core.analyzer.AnalysisContext;
import com.qualitygate.core.analyzer.AnalyzerSettings;
import com.qualitygate.core.analyzer.base.AbstractLineAnalyzer;
import com.qualitygate.core.analyzer.impl.quality.FileQualityReport.DetectedFunction;
import com.qualitygate.core.config.QualityConfig;
import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.AnalysisResult;
import com.qualitygate.core.model.CodeQualityMetrics;
import com.qualitygate.core.model.CodeQualityMetrics.ComplexityDistribution;
import com.qualitygate.core.model.CodeQualityMetrics.ComplexityMetrics;
import com.qualitygate.core.model.CodeQualityMetrics.DuplicationMetrics;
import com.qualitygate.core.model.CodeQualityMetrics.FunctionComplexity;
import com.qualitygate.core.model.CodeQualityMetrics.LintViolation;
import com.qualitygate.core.model.CodeQualityMetrics.LintingMetrics;
import com.qualitygate.core.model.FileLocation;
import com.qualitygate.core.model.Finding;
import com.qualitygate.core.model.Severity;
import com.qualitygate.core.scoring.SubScores;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Estimates complexity, duplication and lint violations from source text.
 *
 * <p><b>Complexity:</b> functions are found with two patterns (declarations and
 * {@code const f = (...) =>} style expressions). A function's complexity is 1 plus 0.5 for
 * every control-flow token in the 1000 characters following its declaration, rounded up.
 *
 * <p><b>Duplication:</b> an import statement repeated across files counts as one duplicated
 * line per extra occurrence; the percentage is duplicated lines over total lines.
 *
 * <p><b>Linting:</b> {@code console.log} outside tests and {@code var} declarations are
 * warnings, {@code debugger} statements are errors.
 */
public class CodeQualityAnalyzer extends AbstractLineAnalyzer {

    public static final String DEFAULT_NAME = "CodeQualityAnalyzer";

    private static final Pattern FUNCTION_DECLARATION = Pattern.compile(
        "\\b(?:async\\s+)?function\\s*\\*?\\s*(\\w+)\\s*\\(");
    private static final Pattern FUNCTION_EXPRESSION = Pattern.compile(
        "\\b(?:const|let|var)\\s+(\\w+)\\s*(?::[^=]+)?=\\s*(?:async\\s*)?(?:function\\b|\\([^)]*\\)\\s*(?::[^=]+)?=>|\\w+\\s*=>)");
    private static final Pattern CONTROL_FLOW = Pattern.compile(
        "\\b(?:if|else|case|catch|while|for|do)\\b|&&|\\|\\||\\?(?![.?])");
    private static final Pattern IMPORT_LINE = Pattern.compile("^\\s*import\\s+.*\\s+from\\s+['\"].*['\"];?\\s*$");
    private static final Pattern CONSOLE_LOG = Pattern.compile("console\\.log");
    private static final Pattern VAR_DECLARATION = Pattern.compile("\\bvar\\s");
    private static final Pattern DEBUGGER = Pattern.compile("\\bdebugger\\b");

    private static final int COMPLEXITY_WINDOW = 1000;
    private static final int REPORTED_FUNCTIONS = 20;
    private static final int COMPLEXITY_FINDINGS = 5;

    public CodeQualityAnalyzer(AnalyzerSettings settings) {
        super(settings);
    }

    @Override
    public AnalysisCategory getCategory() {
        return AnalysisCategory.CODE_QUALITY;
    }

    @Override
    protected AnalysisResult doAnalyze(AnalysisContext context) {
        QualityConfig.CodeQualityConfig config = context.configuration().analyzers().codeQuality();
        List<String> files = context.sourceFiles();

        List<FileQualityReport> reports = new ArrayList<>();
        for (String file : files) {
            analyzeFile(context, file, FileQualityReport.class, this::analyzeContent).ifPresent(reports::add);
        }
        log.debug("Analyzed code quality of {} of {} source files", reports.size(), files.size());

        CodeQualityMetrics metrics = new CodeQualityMetrics(
            aggregateComplexity(reports, files.size(), config),
            aggregateDuplication(reports),
            aggregateLinting(reports));

        List<Finding> findings = generateFindings(metrics, config);
        return buildResult(SubScores.codeQuality(metrics), findings, metrics);
    }

    // ==================== Per-File Analysis ====================

    FileQualityReport analyzeContent(String file, String content) {
        List<String> lines = splitLines(content);
        return new FileQualityReport(
            file,
            lines.size(),
            detectFunctions(content),
            detectViolations(file, lines),
            lines.stream()
                .filter(line -> IMPORT_LINE.matcher(line).matches())
                .map(String::trim)
                .toList());
    }

    private List<DetectedFunction> detectFunctions(String content) {
        Map<Integer, DetectedFunction> byOffset = new TreeMap<>();
        for (Pattern pattern : List.of(FUNCTION_DECLARATION, FUNCTION_EXPRESSION)) {
            Matcher matcher = pattern.matcher(content);
            while (matcher.find()) {
                int start = matcher.start();
                String window = content.substring(start, Math.min(content.length(), start + COMPLEXITY_WINDOW));
                byOffset.putIfAbsent(start, new DetectedFunction(
                    matcher.group(1), lineNumberAt(content, start), estimateComplexity(window)));
            }
        }
        return List.copyOf(byOffset.values());
    }

    /**
     * Keyword-counting complexity estimate: base 1, plus 0.5 per control-flow token, rounded up.
     *
     * @param code code window following a function declaration
     * @return estimated complexity
     */
    int estimateComplexity(String code) {
        return (int) Math.ceil(1 + countMatches(CONTROL_FLOW, code) * 0.5);
    }

    private List<LintViolation> detectViolations(String file, List<String> lines) {
        List<LintViolation> violations = new ArrayList<>();
        if (!isTestFile(file)) {
            for (LineMatch match : findLineMatches(CONSOLE_LOG, lines)) {
                violations.add(new LintViolation(file, match.line(), match.column(), Severity.MEDIUM,
                    "no-console", "Unexpected console statement", true));
            }
        }
        for (LineMatch match : findLineMatches(VAR_DECLARATION, lines)) {
            violations.add(new LintViolation(file, match.line(), match.column(), Severity.MEDIUM,
                "no-var", "Unexpected var, use let or const instead", true));
        }
        for (LineMatch match : findLineMatches(DEBUGGER, lines)) {
            violations.add(new LintViolation(file, match.line(), match.column(), Severity.HIGH,
                "no-debugger", "Unexpected 'debugger' statement", false));
        }
        violations.sort(Comparator.comparingInt(LintViolation::line).thenComparingInt(LintViolation::column));
        return violations;
    }

    // ==================== Aggregation ====================

    private ComplexityMetrics aggregateComplexity(List<FileQualityReport> reports, int fileCount,
                                                  QualityConfig.CodeQualityConfig config) {
        List<FunctionComplexity> functions = new ArrayList<>();
        int total = 0;
        int maximum = 0;
        int good = 0;
        int warning = 0;
        int critical = 0;

        for (FileQualityReport report : reports) {
            for (DetectedFunction function : report.functions()) {
                String status = bucket(function.complexity(), config);
                switch (status) {
                    case "critical" -> critical++;
                    case "warning" -> warning++;
                    default -> good++;
                }
                functions.add(new FunctionComplexity(report.file(), function.name(), function.line(),
                    function.complexity(), status));
                total += function.complexity();
                maximum = Math.max(maximum, function.complexity());
            }
        }

        functions.sort(Comparator.comparingInt(FunctionComplexity::complexity).reversed());
        double averagePerFile = fileCount > 0 ? (double) total / fileCount : 0;
        return new ComplexityMetrics(
            functions.subList(0, Math.min(REPORTED_FUNCTIONS, functions.size())),
            averagePerFile,
            maximum,
            new ComplexityDistribution(good, warning, critical));
    }

    private static String bucket(int complexity, QualityConfig.CodeQualityConfig config) {
        if (complexity <= config.complexityWarning()) {
            return "good";
        }
        if (complexity <= config.complexityCritical()) {
            return "warning";
        }
        return "critical";
    }

    private DuplicationMetrics aggregateDuplication(List<FileQualityReport> reports) {
        Map<String, Integer> importCounts = new HashMap<>();
        int totalLines = 0;
        for (FileQualityReport report : reports) {
            totalLines += report.lineCount();
            for (String importLine : report.importLines()) {
                importCounts.merge(importLine, 1, Integer::sum);
            }
        }

        int duplicated = importCounts.values().stream()
            .filter(count -> count > 1)
            .mapToInt(count -> count - 1)
            .sum();
        double percent = totalLines > 0 ? Math.min(100, duplicated * 100.0 / totalLines) : 0;
        String status = percent < 3 ? "good" : percent < 5 ? "warning" : "critical";
        return new DuplicationMetrics(percent, duplicated, status);
    }

    private LintingMetrics aggregateLinting(List<FileQualityReport> reports) {
        List<LintViolation> violations = reports.stream()
            .flatMap(report -> report.violations().stream())
            .toList();
        Map<String, Integer> byRule = new TreeMap<>();
        int errors = 0;
        int warnings = 0;
        int info = 0;
        for (LintViolation violation : violations) {
            byRule.merge(violation.rule(), 1, Integer::sum);
            if (violation.severity().isAtLeast(Severity.HIGH)) {
                errors++;
            } else if (violation.severity() == Severity.MEDIUM) {
                warnings++;
            } else {
                info++;
            }
        }
        return new LintingMetrics(errors, warnings, info, violations, byRule);
    }

    // ==================== Findings ====================

    private List<Finding> generateFindings(CodeQualityMetrics metrics, QualityConfig.CodeQualityConfig config) {
        List<Finding> findings = new ArrayList<>();

        metrics.complexity().functions().stream()
            .filter(function -> "critical".equals(function.status()))
            .limit(COMPLEXITY_FINDINGS)
            .forEach(function -> findings.add(finding(
                "cc-" + function.file() + "-" + function.line(),
                Severity.HIGH,
                "High cyclomatic complexity",
                String.format("Function '%s' has complexity of %d, exceeding threshold of %d",
                    function.name(), function.complexity(), config.complexityCritical()),
                "Extract complex logic into smaller functions, use guard clauses instead of nested if statements",
                FileLocation.of(function.file(), function.line()),
                "Complexity: " + function.complexity())));

        DuplicationMetrics duplication = metrics.duplication();
        if (duplication.percent() > config.duplicationMaxPercent()) {
            findings.add(finding(
                "dup-high",
                Severity.MEDIUM,
                "High code duplication",
                String.format("%.1f%% of code appears to be duplicated", duplication.percent()),
                "Extract duplicated code into reusable components or utility functions",
                null,
                String.format("Duplication: %.1f%%", duplication.percent())));
        }

        LintingMetrics linting = metrics.linting();
        if (linting.errors() > 0) {
            String firstFile = linting.violations().stream()
                .filter(v -> v.severity().isAtLeast(Severity.HIGH))
                .map(LintViolation::file)
                .findFirst()
                .orElse(null);
            findings.add(finding(
                "lint-errors",
                Severity.HIGH,
                "Linting errors",
                "Found " + linting.errors() + " linting errors",
                "Remove debugging statements and fix the reported rule violations",
                Optional.ofNullable(firstFile).map(FileLocation::of).orElse(null),
                "Errors: " + linting.errors()));
        }
        return findings;
    }
}
