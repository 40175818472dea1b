package com.qualitygate.core.model;

import java.util.List;
import java.util.Map;

/**
 * Metrics produced by the architecture analyzer.
 *
 * @param components component size and type metrics
 * @param dependencies dependency graph metrics
 * @param patterns pattern compliance metrics
 */
public record ArchitectureMetrics(
    ComponentMetrics components,
    DependencyMetrics dependencies,
    PatternMetrics patterns
) implements AnalysisMetrics {

    /**
     * @param totalCount analyzed components
     * @param byType count per component type (atoms, molecules, organisms, templates, unknown)
     * @param oversized components above the size limit, largest first
     * @param averageSize average line count
     */
    public record ComponentMetrics(
        int totalCount,
        Map<String, Integer> byType,
        List<OversizedComponent> oversized,
        double averageSize
    ) {
        public ComponentMetrics {
            byType = byType == null ? Map.of() : Map.copyOf(byType);
            oversized = oversized == null ? List.of() : List.copyOf(oversized);
        }
    }

    public record OversizedComponent(String file, String name, int lines, String suggestion) {}

    /**
     * @param totalModules nodes in the import graph
     * @param totalEdges intra-project import edges
     * @param circularDependencies detected cycles (at most five)
     * @param layerViolations detected layer violations
     * @param externalDependencies import frequency per external package
     */
    public record DependencyMetrics(
        int totalModules,
        int totalEdges,
        List<CircularDependency> circularDependencies,
        int layerViolations,
        Map<String, Integer> externalDependencies
    ) {
        public DependencyMetrics {
            circularDependencies = circularDependencies == null ? List.of() : List.copyOf(circularDependencies);
            externalDependencies = externalDependencies == null ? Map.of() : Map.copyOf(externalDependencies);
        }
    }

    /**
     * @param stateManagement state mutation checks on store and slice files
     * @param hookUsage conditional hook call checks
     */
    public record PatternMetrics(PatternCompliance stateManagement, PatternCompliance hookUsage) {

        public double averageScore() {
            return (stateManagement.score() + hookUsage.score()) / 2;
        }
    }

    public record PatternCompliance(List<PatternIssue> issues, double score) {
        public PatternCompliance {
            issues = issues == null ? List.of() : List.copyOf(issues);
        }
    }

    public record PatternIssue(
        String file,
        Integer line,
        String pattern,
        String issue,
        String suggestion,
        Severity severity
    ) {}
}
