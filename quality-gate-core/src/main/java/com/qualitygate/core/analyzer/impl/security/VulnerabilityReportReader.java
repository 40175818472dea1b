package com.qualitygate.core.analyzer.impl.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qualitygate.core.model.SecurityMetrics.Vulnerability;
import com.qualitygate.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the output of {@code npm audit --json} saved to a file.
 *
 * <p>Both report layouts are supported: npm 7+ ({@code vulnerabilities} keyed by package)
 * and npm 6 ({@code advisories} keyed by advisory id). Vulnerabilities are returned most
 * severe first.
 */
public class VulnerabilityReportReader {

    private static final Logger log = LoggerFactory.getLogger(VulnerabilityReportReader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Reads a report.
     *
     * @param report report file
     * @return vulnerabilities, empty if the file is missing or unparseable
     */
    public List<Vulnerability> read(Path report) {
        if (!Files.isRegularFile(report)) {
            log.debug("No audit report at {}", report);
            return List.of();
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(report.toFile());
        } catch (IOException e) {
            log.warn("Cannot parse audit report {}: {}", report, e.getMessage());
            return List.of();
        }

        List<Vulnerability> vulnerabilities = new ArrayList<>();
        if (root.has("vulnerabilities")) {
            readPackageEntries(root.path("vulnerabilities"), vulnerabilities);
        } else if (root.has("advisories")) {
            readAdvisories(root.path("advisories"), vulnerabilities);
        }
        vulnerabilities.sort(Comparator.comparing(Vulnerability::severity));
        log.debug("Read {} vulnerabilities from {}", vulnerabilities.size(), report);
        return vulnerabilities;
    }

    private void readPackageEntries(JsonNode entries, List<Vulnerability> target) {
        Iterator<Map.Entry<String, JsonNode>> fields = entries.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode entry = field.getValue();
            target.add(new Vulnerability(
                entry.path("name").asText(field.getKey()),
                toSeverity(entry.path("severity").asText()),
                titleOf(entry.path("via")),
                entry.path("range").asText(""),
                isFixAvailable(entry.path("fixAvailable"))));
        }
    }

    private void readAdvisories(JsonNode advisories, List<Vulnerability> target) {
        for (JsonNode advisory : advisories) {
            String patched = advisory.path("patched_versions").asText("");
            target.add(new Vulnerability(
                advisory.path("module_name").asText("unknown"),
                toSeverity(advisory.path("severity").asText()),
                advisory.path("title").asText("No description"),
                advisory.path("vulnerable_versions").asText(""),
                !patched.isEmpty() && !"<0.0.0".equals(patched)));
        }
    }

    private String titleOf(JsonNode via) {
        for (JsonNode source : via) {
            if (source.isObject() && source.hasNonNull("title")) {
                return source.get("title").asText();
            }
        }
        // Only transitive sources: name the package it comes through
        if (via.size() > 0 && via.get(0).isTextual()) {
            return "Vulnerable through " + via.get(0).asText();
        }
        return "No description";
    }

    private boolean isFixAvailable(JsonNode fixAvailable) {
        return fixAvailable.isObject() || fixAvailable.asBoolean(false);
    }

    /**
     * Maps an npm severity label onto {@link Severity}; npm's {@code moderate} is medium.
     *
     * @param label npm severity
     * @return severity, medium for unknown labels
     */
    static Severity toSeverity(String label) {
        return switch (label == null ? "" : label.toLowerCase()) {
            case "critical" -> Severity.CRITICAL;
            case "high" -> Severity.HIGH;
            case "low" -> Severity.LOW;
            case "info" -> Severity.INFO;
            default -> Severity.MEDIUM;
        };
    }
}
