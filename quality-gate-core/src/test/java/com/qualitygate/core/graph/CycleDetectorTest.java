package com.qualitygate.core.graph;

import com.qualitygate.core.model.CircularDependency;
import com.qualitygate.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CycleDetector}.
 */
class CycleDetectorTest {

    private final CycleDetector detector = new CycleDetector();

    @Test
    void detect_acyclicDiamond_findsNothing() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("a", "b");
        graph.addEdge("a", "c");
        graph.addEdge("b", "d");
        graph.addEdge("c", "d");

        assertThat(detector.detect(graph)).isEmpty();
    }

    @Test
    void detect_twoNodeCycle_startsAtBackEdgeTarget() {
        DependencyGraph graph = new DependencyGraph();
        graph.addNode("src/a.ts");
        graph.addEdge("src/a.ts", "src/b.ts");
        graph.addEdge("src/b.ts", "src/a.ts");

        List<CircularDependency> cycles = detector.detect(graph);

        assertThat(cycles).hasSize(1);
        assertThat(cycles.get(0).path()).containsExactly("src/a.ts", "src/b.ts");
        assertThat(cycles.get(0).severity()).isEqualTo(Severity.HIGH);
        assertThat(cycles.get(0).describe()).isEqualTo("src/a.ts -> src/b.ts -> src/a.ts");
    }

    @Test
    void detect_threeNodeRingBehindEntry_excludesEntryNode() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("entry", "a");
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");
        graph.addEdge("c", "a");

        List<CircularDependency> cycles = detector.detect(graph);

        assertThat(cycles).singleElement()
            .extracting(CircularDependency::path)
            .isEqualTo(List.of("a", "b", "c"));
    }

    @Test
    void detect_selfImport_isSingleNodeCycle() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("a", "a");

        assertThat(detector.detect(graph)).singleElement()
            .extracting(CircularDependency::path)
            .isEqualTo(List.of("a"));
    }

    @Test
    void detect_manyCycles_stopsAtDefaultMaximum() {
        DependencyGraph graph = new DependencyGraph();
        for (int i = 0; i < 8; i++) {
            graph.addEdge("x" + i, "y" + i);
            graph.addEdge("y" + i, "x" + i);
        }

        assertThat(detector.detect(graph)).hasSize(CycleDetector.DEFAULT_MAX_CYCLES);
        assertThat(new CycleDetector(2).detect(graph)).hasSize(2);
    }

    @Test
    void detect_longChain_doesNotOverflowStack() {
        DependencyGraph graph = new DependencyGraph();
        for (int i = 0; i < 20_000; i++) {
            graph.addEdge("n" + i, "n" + (i + 1));
        }
        graph.addEdge("n20000", "n0");

        List<CircularDependency> cycles = detector.detect(graph);

        assertThat(cycles).hasSize(1);
        assertThat(cycles.get(0).path()).hasSize(20_001);
    }

    @Test
    void constructor_nonPositiveMaximum_isRejected() {
        assertThatThrownBy(() -> new CycleDetector(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxCycles");
    }
}
