package com.qualitygate.core.analyzer.impl.security;

import com.qualitygate.core.analyzer.AnalysisContext;
import com.qualitygate.core.analyzer.AnalyzerSettings;
import com.qualitygate.core.analyzer.base.AbstractLineAnalyzer;
import com.qualitygate.core.config.QualityConfig;
import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.AnalysisResult;
import com.qualitygate.core.model.FileLocation;
import com.qualitygate.core.model.Finding;
import com.qualitygate.core.model.SecurityMetrics;
import com.qualitygate.core.model.SecurityMetrics.PerformanceIssue;
import com.qualitygate.core.model.SecurityMetrics.SecurityPattern;
import com.qualitygate.core.model.SecurityMetrics.Vulnerability;
import com.qualitygate.core.model.Severity;
import com.qualitygate.core.scoring.SubScores;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Scans sources for insecure code patterns and rendering performance smells, and reads known
 * dependency vulnerabilities from a saved {@code npm audit --json} report.
 *
 * <p>Insecure patterns:
 * <ul>
 *   <li>hard-coded secrets ({@code password = "..."}, {@code apiKey: '...'}, ...): critical</li>
 *   <li>{@code eval(}: critical</li>
 *   <li>{@code dangerouslySetInnerHTML} and {@code innerHTML =}: high</li>
 * </ul>
 *
 * <p>Performance smells: inline arrow handlers in JSX, {@code .map(} without a {@code key}
 * prop on the same or next line, and inline object or array literals in props.
 */
public class SecurityAnalyzer extends AbstractLineAnalyzer {

    public static final String DEFAULT_NAME = "SecurityAnalyzer";

    private static final Pattern HARDCODED_SECRET = Pattern.compile(
        "(?i)\\b(?:password|passwd|secret|token|api[_-]?key|authorization|auth)\\s*[:=]\\s*['\"][^'\"]+['\"]");
    private static final Pattern EVAL = Pattern.compile("\\beval\\s*\\(");
    private static final Pattern DANGEROUS_HTML = Pattern.compile("dangerouslySetInnerHTML");
    private static final Pattern INNER_HTML_ASSIGNMENT = Pattern.compile("\\.innerHTML\\s*=(?!=)");

    private static final Pattern INLINE_HANDLER = Pattern.compile("\\bon[A-Z]\\w*=\\{\\s*\\([^)]*\\)\\s*=>");
    private static final Pattern LIST_MAP = Pattern.compile("\\.map\\s*\\(");
    private static final Pattern KEY_PROP = Pattern.compile("\\bkey=");
    private static final Pattern INLINE_LITERAL = Pattern.compile("=\\{\\{|=\\{\\[");

    static final int MAX_ITEMS = 20;
    private static final int VULNERABILITY_FINDINGS = 5;
    private static final int PATTERN_FINDINGS = 5;

    private final VulnerabilityReportReader reportReader;

    public SecurityAnalyzer(AnalyzerSettings settings) {
        this(settings, new VulnerabilityReportReader());
    }

    SecurityAnalyzer(AnalyzerSettings settings, VulnerabilityReportReader reportReader) {
        super(settings);
        this.reportReader = reportReader;
    }

    @Override
    public AnalysisCategory getCategory() {
        return AnalysisCategory.SECURITY;
    }

    @Override
    protected AnalysisResult doAnalyze(AnalysisContext context) {
        QualityConfig.SecurityConfig config = context.configuration().analyzers().security();

        List<SecurityPattern> patterns = new ArrayList<>();
        List<PerformanceIssue> performanceIssues = new ArrayList<>();
        for (String file : context.sourceFiles()) {
            analyzeFile(context, file, SecurityFileReport.class, this::scanContent).ifPresent(report -> {
                patterns.addAll(report.patterns());
                performanceIssues.addAll(report.performanceIssues());
            });
        }

        List<Vulnerability> vulnerabilities = reportReader.read(context.resolve(config.auditReport()));

        SecurityMetrics metrics = new SecurityMetrics(
            limit(vulnerabilities),
            limit(patterns),
            limit(performanceIssues));

        return buildResult(SubScores.security(metrics), generateFindings(metrics), metrics);
    }

    private static <T> List<T> limit(List<T> items) {
        return items.subList(0, Math.min(MAX_ITEMS, items.size()));
    }

    // ==================== Per-File Scanning ====================

    SecurityFileReport scanContent(String file, String content) {
        List<String> lines = splitLines(content);
        return new SecurityFileReport(file, detectSecurityPatterns(file, lines),
            detectPerformanceIssues(file, lines));
    }

    private List<SecurityPattern> detectSecurityPatterns(String file, List<String> lines) {
        List<SecurityPattern> patterns = new ArrayList<>();
        for (LineMatch match : findLineMatches(HARDCODED_SECRET, lines)) {
            patterns.add(new SecurityPattern(file, match.line(), "secret", Severity.CRITICAL,
                abbreviate(lines.get(match.line() - 1)),
                "Use environment variables or secure configuration management for sensitive data"));
        }
        for (LineMatch match : findLineMatches(EVAL, lines)) {
            patterns.add(new SecurityPattern(file, match.line(), "eval", Severity.CRITICAL,
                match.text(),
                "Never use eval(); parse data with JSON.parse() or restructure the code"));
        }
        for (LineMatch match : findLineMatches(DANGEROUS_HTML, lines)) {
            patterns.add(new SecurityPattern(file, match.line(), "unsafeDom", Severity.HIGH,
                match.text(),
                "Sanitize HTML content with DOMPurify or render it as text"));
        }
        for (LineMatch match : findLineMatches(INNER_HTML_ASSIGNMENT, lines)) {
            patterns.add(new SecurityPattern(file, match.line(), "unsafeDom", Severity.HIGH,
                match.text().trim(),
                "Use textContent for text or createElement/appendChild for safe DOM manipulation"));
        }
        patterns.sort((a, b) -> Integer.compare(a.line(), b.line()));
        return patterns;
    }

    private List<PerformanceIssue> detectPerformanceIssues(String file, List<String> lines) {
        List<PerformanceIssue> issues = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (isComment(line)) {
                continue;
            }
            int lineNumber = i + 1;
            if (INLINE_HANDLER.matcher(line).find()) {
                issues.add(new PerformanceIssue(file, lineNumber, "inlineFunction", Severity.MEDIUM,
                    "Define the handler outside JSX or wrap it in useCallback"));
            }
            if (LIST_MAP.matcher(line).find() && !KEY_PROP.matcher(line).find()
                && (i + 1 >= lines.size() || !KEY_PROP.matcher(lines.get(i + 1)).find())) {
                issues.add(new PerformanceIssue(file, lineNumber, "missingKey", Severity.HIGH,
                    "Add a unique key prop to each list item"));
            }
            if (INLINE_LITERAL.matcher(line).find()) {
                issues.add(new PerformanceIssue(file, lineNumber, "inlineObject", Severity.MEDIUM,
                    "Move the literal out of render or memoize it with useMemo"));
            }
        }
        return issues;
    }

    private static String abbreviate(String line) {
        String trimmed = line.trim();
        return trimmed.length() > 50 ? trimmed.substring(0, 50) + "..." : trimmed;
    }

    // ==================== Findings ====================

    private List<Finding> generateFindings(SecurityMetrics metrics) {
        List<Finding> findings = new ArrayList<>();

        metrics.vulnerabilities().stream()
            .limit(VULNERABILITY_FINDINGS)
            .forEach(vulnerability -> findings.add(finding(
                "vuln-" + vulnerability.packageName(),
                vulnerability.severity() == Severity.CRITICAL ? Severity.CRITICAL : Severity.HIGH,
                "Vulnerability in " + vulnerability.packageName(),
                vulnerability.title(),
                vulnerability.fixAvailable()
                    ? "Run npm audit fix or update " + vulnerability.packageName()
                    : "No fix available yet; consider replacing " + vulnerability.packageName(),
                null,
                vulnerability.severity().id() + " severity in range " + vulnerability.range())));

        metrics.codePatterns().stream()
            .limit(PATTERN_FINDINGS)
            .forEach(pattern -> findings.add(finding(
                "pattern-" + pattern.file() + "-" + pattern.line(),
                pattern.severity(),
                describe(pattern.type()),
                pattern.type() + " pattern detected",
                pattern.remediation(),
                FileLocation.of(pattern.file(), pattern.line()),
                pattern.evidence())));

        if (!metrics.performanceIssues().isEmpty()) {
            PerformanceIssue first = metrics.performanceIssues().get(0);
            findings.add(finding(
                "perf-issues",
                Severity.MEDIUM,
                "Rendering performance issues",
                "Found " + metrics.performanceIssues().size() + " potential rendering performance issues",
                first.suggestion(),
                FileLocation.of(first.file(), first.line()),
                "Issues: " + metrics.performanceIssues().size()));
        }
        return findings;
    }

    private static String describe(String type) {
        return switch (type) {
            case "secret" -> "Possible hard-coded secret detected";
            case "eval" -> "eval() usage detected";
            default -> "Unsafe DOM manipulation";
        };
    }
}
