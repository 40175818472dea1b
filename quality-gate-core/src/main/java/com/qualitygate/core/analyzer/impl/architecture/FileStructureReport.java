package com.qualitygate.core.analyzer.impl.architecture;

import com.qualitygate.core.model.ArchitectureMetrics.PatternIssue;

import java.util.List;

/**
 * Cached structural facts about one source file.
 *
 * @param file project-relative path
 * @param lineCount number of lines
 * @param imports module specifiers in order of appearance
 * @param stateIssues state mutation issues (store and slice files only)
 * @param hookIssues conditional hook call issues
 */
public record FileStructureReport(
    String file,
    int lineCount,
    List<String> imports,
    List<PatternIssue> stateIssues,
    List<PatternIssue> hookIssues
) {
    public FileStructureReport {
        imports = imports == null ? List.of() : List.copyOf(imports);
        stateIssues = stateIssues == null ? List.of() : List.copyOf(stateIssues);
        hookIssues = hookIssues == null ? List.of() : List.copyOf(hookIssues);
    }
}
