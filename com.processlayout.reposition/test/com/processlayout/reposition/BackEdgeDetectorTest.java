package com.processlayout.reposition;

import static com.processlayout.reposition.DiagramFixtures.end;
import static com.processlayout.reposition.DiagramFixtures.start;
import static com.processlayout.reposition.DiagramFixtures.task;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;

import org.junit.jupiter.api.Test;

import com.processlayout.reposition.model.DiagramSnapshot;

class BackEdgeDetectorTest {

    private final FlowGraphExtractor extractor = new FlowGraphExtractor();
    private final BackEdgeDetector detector = new BackEdgeDetector();

    @Test
    void acyclicGraphHasNoBackEdges() {
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(start("s")).node(task("a")).node(end("e"))
                .sequenceFlow("f1", "s", "a")
                .sequenceFlow("f2", "a", "e")
                .build();

        assertThat(detector.detect(extractor.extract(diagram, null))).isEmpty();
    }

    @Test
    void loopBackToEarlierTaskIsReported() {
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(start("s")).node(task("a")).node(task("b")).node(task("c")).node(end("e"))
                .sequenceFlow("f1", "s", "a")
                .sequenceFlow("f2", "a", "b")
                .sequenceFlow("f3", "b", "c")
                .sequenceFlow("loop", "c", "a")
                .sequenceFlow("f4", "c", "e")
                .build();

        assertThat(detector.detect(extractor.extract(diagram, null))).containsExactly("loop");
    }

    @Test
    void selfLoopIsABackEdge() {
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(start("s")).node(task("a"))
                .sequenceFlow("f1", "s", "a")
                .sequenceFlow("again", "a", "a")
                .build();

        assertThat(detector.detect(extractor.extract(diagram, null))).containsExactly("again");
    }

    @Test
    void cycleWithoutAnySourceIsStillBroken() {
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(task("a")).node(task("b")).node(task("c"))
                .sequenceFlow("ab", "a", "b")
                .sequenceFlow("bc", "b", "c")
                .sequenceFlow("ca", "c", "a")
                .build();

        Set<String> backEdges = detector.detect(extractor.extract(diagram, null));

        assertThat(backEdges).containsExactly("ca");
    }

    @Test
    void removingBackEdgesLeavesAnAcyclicGraph() {
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(start("s")).node(task("a")).node(task("b")).node(task("c")).node(task("d"))
                .sequenceFlow("f1", "s", "a")
                .sequenceFlow("f2", "a", "b")
                .sequenceFlow("f3", "b", "c")
                .sequenceFlow("f4", "c", "d")
                .sequenceFlow("r1", "d", "b")
                .sequenceFlow("r2", "c", "a")
                .sequenceFlow("r3", "d", "a")
                .build();
        FlowGraph graph = extractor.extract(diagram, null);

        Set<String> backEdges = detector.detect(graph);
        LayerAssignment layers = new TopologicalSorter().sort(graph, backEdges);

        assertThat(backEdges).containsExactlyInAnyOrder("r1", "r2", "r3");
        assertThat(layers.getLayerMap()).hasSize(graph.size());
    }

    @Test
    void startEventsAreTraversedBeforeOtherSources() {
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(task("orphan"))
                .node(start("s"))
                .sequenceFlow("f1", "s", "orphan")
                .build();

        assertThat(BackEdgeDetector.traversalRoots(extractor.extract(diagram, null)))
                .containsExactly("s", "orphan");
    }
}
