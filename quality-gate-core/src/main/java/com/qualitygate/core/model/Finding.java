package com.qualitygate.core.model;

import java.util.Objects;

/**
 * One discrete, severity-tagged issue surfaced by an analyzer.
 *
 * <p>The {@code id} is stable across runs and is used to deduplicate findings when the
 * results of several analyzers are merged: the first finding with a given id wins.
 *
 * @param id stable identifier (e.g. "circular-src/a.ts")
 * @param severity severity of the issue
 * @param category category of the analyzer that raised it
 * @param title short title
 * @param description human-readable description
 * @param remediation suggested fix
 * @param location optional location in the source tree
 * @param evidence optional supporting evidence (matched text, measured value)
 */
public record Finding(
    String id,
    Severity severity,
    AnalysisCategory category,
    String title,
    String description,
    String remediation,
    FileLocation location,
    String evidence
) {
    /**
     * Compact constructor with validation.
     */
    public Finding {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(category, "category must not be null");
        if (title == null) {
            title = "";
        }
        if (description == null) {
            description = "";
        }
        if (remediation == null) {
            remediation = "";
        }
    }
}
