package com.qualitygate.core.analyzer.impl.coverage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qualitygate.core.model.CoverageMetrics.CoverageMetric;
import com.qualitygate.core.model.CoverageMetrics.CoverageSummary;
import com.qualitygate.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads Istanbul coverage reports.
 *
 * <p>Two layouts are understood:
 * <ul>
 *   <li>summary ({@code coverage-summary.json}): every entry holds
 *       {@code lines/branches/functions/statements} objects with {@code total} and {@code covered}</li>
 *   <li>raw ({@code coverage-final.json}): every entry holds hit counters {@code s}, {@code f},
 *       {@code b} and a {@code statementMap}; totals are derived from the counters</li>
 * </ul>
 * When the report has no {@code total} entry, the project summary is summed from the files.
 */
public class CoverageReportReader {

    private static final Logger log = LoggerFactory.getLogger(CoverageReportReader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Parsed report.
     *
     * @param source report file that was read
     * @param overall project-wide summary
     * @param byFile per-file summaries keyed by project-relative path
     */
    public record CoverageReport(Path source, CoverageSummary overall, Map<String, CoverageSummary> byFile) {}

    /**
     * Reads the first existing report among the candidates.
     *
     * @param projectRoot project root
     * @param candidates report paths relative to the root, in preference order
     * @return parsed report, or empty if none exists or none can be parsed
     */
    public Optional<CoverageReport> read(Path projectRoot, List<String> candidates) {
        for (String candidate : candidates) {
            Path report = projectRoot.resolve(candidate);
            if (!Files.isRegularFile(report)) {
                continue;
            }
            try {
                return Optional.of(parse(projectRoot, report, MAPPER.readTree(report.toFile())));
            } catch (IOException e) {
                log.warn("Cannot parse coverage report {}: {}", report, e.getMessage());
            }
        }
        log.debug("No coverage report found among {}", candidates);
        return Optional.empty();
    }

    private CoverageReport parse(Path projectRoot, Path source, JsonNode root) {
        Map<String, CoverageSummary> byFile = new LinkedHashMap<>();
        CoverageSummary total = null;

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            if (!node.isObject()) {
                continue;
            }
            if ("total".equals(field.getKey())) {
                total = parseSummary(node);
                continue;
            }
            CoverageSummary summary = node.has("lines") ? parseSummary(node) : parseRaw(node);
            byFile.put(relativize(projectRoot, field.getKey()), summary);
        }

        if (total == null) {
            total = sum(byFile.values());
        }
        log.debug("Read coverage for {} files from {}", byFile.size(), source);
        return new CoverageReport(source, total, byFile);
    }

    private CoverageSummary parseSummary(JsonNode node) {
        return new CoverageSummary(
            parseMetric(node.path("lines")),
            parseMetric(node.path("branches")),
            parseMetric(node.path("functions")),
            parseMetric(node.path("statements")));
    }

    private CoverageMetric parseMetric(JsonNode node) {
        if (node.isMissingNode() || !node.isObject()) {
            return CoverageMetric.zero();
        }
        return CoverageMetric.of(node.path("total").asInt(0), node.path("covered").asInt(0));
    }

    private CoverageSummary parseRaw(JsonNode node) {
        JsonNode statementHits = node.path("s");
        JsonNode statementMap = node.path("statementMap");

        Set<Integer> lines = new HashSet<>();
        Set<Integer> coveredLines = new HashSet<>();
        int statements = 0;
        int coveredStatements = 0;
        Iterator<Map.Entry<String, JsonNode>> hits = statementHits.fields();
        while (hits.hasNext()) {
            Map.Entry<String, JsonNode> hit = hits.next();
            statements++;
            int line = statementMap.path(hit.getKey()).path("start").path("line").asInt(-1);
            if (line >= 0) {
                lines.add(line);
            }
            if (hit.getValue().asInt(0) > 0) {
                coveredStatements++;
                if (line >= 0) {
                    coveredLines.add(line);
                }
            }
        }

        int functions = 0;
        int coveredFunctions = 0;
        for (JsonNode count : node.path("f")) {
            functions++;
            if (count.asInt(0) > 0) {
                coveredFunctions++;
            }
        }

        int branches = 0;
        int coveredBranches = 0;
        for (JsonNode branch : node.path("b")) {
            for (JsonNode count : branch) {
                branches++;
                if (count.asInt(0) > 0) {
                    coveredBranches++;
                }
            }
        }

        return new CoverageSummary(
            CoverageMetric.of(lines.size(), coveredLines.size()),
            CoverageMetric.of(branches, coveredBranches),
            CoverageMetric.of(functions, coveredFunctions),
            CoverageMetric.of(statements, coveredStatements));
    }

    private CoverageSummary sum(Iterable<CoverageSummary> summaries) {
        int[] totals = new int[8];
        for (CoverageSummary summary : summaries) {
            List<CoverageMetric> metrics = List.of(
                summary.lines(), summary.branches(), summary.functions(), summary.statements());
            for (int i = 0; i < metrics.size(); i++) {
                totals[i * 2] += metrics.get(i).total();
                totals[i * 2 + 1] += metrics.get(i).covered();
            }
        }
        return new CoverageSummary(
            CoverageMetric.of(totals[0], totals[1]),
            CoverageMetric.of(totals[2], totals[3]),
            CoverageMetric.of(totals[4], totals[5]),
            CoverageMetric.of(totals[6], totals[7]));
    }

    private String relativize(Path projectRoot, String reportedPath) {
        Path path = Path.of(reportedPath);
        if (path.isAbsolute() && path.normalize().startsWith(projectRoot.toAbsolutePath().normalize())) {
            return FileUtils.toRelativePath(projectRoot, path);
        }
        return FileUtils.normalizePath(reportedPath);
    }
}
