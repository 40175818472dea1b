package com.qualitygate.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A non-empty cycle in the intra-project import graph.
 *
 * <p>Severity is always {@link Severity#HIGH}; cycle length does not affect it.
 *
 * @param path nodes of the cycle in traversal order, without repeating the first node
 * @param severity cycle severity
 */
public record CircularDependency(
    List<String> path,
    Severity severity
) {
    /**
     * Compact constructor with validation.
     */
    public CircularDependency {
        Objects.requireNonNull(path, "path must not be null");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("A circular dependency needs at least one node");
        }
        path = List.copyOf(path);
        if (severity == null) {
            severity = Severity.HIGH;
        }
    }

    public static CircularDependency of(List<String> path) {
        return new CircularDependency(path, Severity.HIGH);
    }

    /**
     * Renders the cycle closed back onto its first node, e.g. {@code a.ts -> b.ts -> a.ts}.
     *
     * @return printable cycle
     */
    public String describe() {
        return String.join(" -> ", path) + " -> " + path.get(0);
    }
}
