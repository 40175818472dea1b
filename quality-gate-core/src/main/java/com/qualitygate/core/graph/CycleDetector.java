package com.qualitygate.core.graph;

import com.qualitygate.core.model.CircularDependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Finds import cycles with a three-color depth-first search.
 *
 * <p>Every node is {@code UNVISITED}, {@code IN_PROGRESS} (on the current DFS stack) or
 * {@code DONE}. An edge into an {@code IN_PROGRESS} node closes a cycle: the stack slice from
 * that node to the current one is recorded and the edge is not followed. An edge into a
 * {@code DONE} node is pruned. Roots are taken in graph node order and at most
 * {@link #DEFAULT_MAX_CYCLES} cycles are kept, first found first kept.
 *
 * <p>The search uses an explicit stack, so deep import chains cannot overflow the thread stack.
 */
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    public static final int DEFAULT_MAX_CYCLES = 5;

    private enum Color { UNVISITED, IN_PROGRESS, DONE }

    private final int maxCycles;

    public CycleDetector() {
        this(DEFAULT_MAX_CYCLES);
    }

    public CycleDetector(int maxCycles) {
        if (maxCycles < 1) {
            throw new IllegalArgumentException("maxCycles must be at least 1, got " + maxCycles);
        }
        this.maxCycles = maxCycles;
    }

    /**
     * Detects cycles in the graph.
     *
     * @param graph import graph
     * @return cycles in discovery order, each path starting at the node the back edge points to
     */
    public List<CircularDependency> detect(DependencyGraph graph) {
        Map<String, Color> colors = new HashMap<>();
        List<CircularDependency> cycles = new ArrayList<>();

        for (String root : graph.nodes()) {
            if (colors.getOrDefault(root, Color.UNVISITED) != Color.UNVISITED) {
                continue;
            }
            if (visit(root, graph, colors, cycles)) {
                break;
            }
        }

        if (!cycles.isEmpty()) {
            log.debug("Detected {} circular dependencies", cycles.size());
        }
        return cycles;
    }

    /**
     * Runs one DFS tree from a root.
     *
     * @return true when the cycle limit has been reached
     */
    private boolean visit(String root, DependencyGraph graph, Map<String, Color> colors,
                          List<CircularDependency> cycles) {
        Deque<Frame> stack = new ArrayDeque<>();
        List<String> path = new ArrayList<>();

        colors.put(root, Color.IN_PROGRESS);
        stack.push(new Frame(root, graph.dependenciesOf(root).iterator()));
        path.add(root);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.edges().hasNext()) {
                colors.put(frame.node(), Color.DONE);
                stack.pop();
                path.remove(path.size() - 1);
                continue;
            }

            String next = frame.edges().next();
            switch (colors.getOrDefault(next, Color.UNVISITED)) {
                case IN_PROGRESS -> {
                    cycles.add(CircularDependency.of(path.subList(path.indexOf(next), path.size())));
                    if (cycles.size() >= maxCycles) {
                        return true;
                    }
                }
                case UNVISITED -> {
                    colors.put(next, Color.IN_PROGRESS);
                    stack.push(new Frame(next, graph.dependenciesOf(next).iterator()));
                    path.add(next);
                }
                case DONE -> {
                    // Already fully explored
                }
            }
        }
        return false;
    }

    private record Frame(String node, Iterator<String> edges) {}
}
