package com.qualitygate.core.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed import graph between project files.
 *
 * <p>Nodes and edges keep insertion order, so traversals follow the order of the analyzed
 * file list. Imports of external packages are not edges; they are tallied in
 * {@link #externalDependencies()}.
 */
public final class DependencyGraph {

    private final Map<String, Set<String>> edges = new LinkedHashMap<>();
    private final Map<String, Integer> externalDependencies = new LinkedHashMap<>();

    /**
     * Adds a node without edges. Adding an existing node has no effect.
     *
     * @param node project-relative path
     */
    public void addNode(String node) {
        edges.computeIfAbsent(node, n -> new LinkedHashSet<>());
    }

    /**
     * Adds a directed edge {@code from -> to}, adding missing nodes.
     *
     * @param from importing file
     * @param to imported file
     */
    public void addEdge(String from, String to) {
        addNode(to);
        edges.computeIfAbsent(from, n -> new LinkedHashSet<>()).add(to);
    }

    /**
     * Counts one import of an external package.
     *
     * @param packageName package name
     */
    public void recordExternal(String packageName) {
        externalDependencies.merge(packageName, 1, Integer::sum);
    }

    public List<String> nodes() {
        return List.copyOf(edges.keySet());
    }

    public boolean containsNode(String node) {
        return edges.containsKey(node);
    }

    /**
     * Returns the direct dependencies of a node in insertion order.
     *
     * @param node project-relative path
     * @return dependencies, empty for unknown nodes
     */
    public Set<String> dependenciesOf(String node) {
        Set<String> targets = edges.get(node);
        return targets == null ? Set.of() : Collections.unmodifiableSet(targets);
    }

    public int nodeCount() {
        return edges.size();
    }

    public int edgeCount() {
        return edges.values().stream().mapToInt(Set::size).sum();
    }

    public Map<String, Integer> externalDependencies() {
        return Collections.unmodifiableMap(externalDependencies);
    }
}
