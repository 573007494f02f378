package com.processlayout.reposition;

import static com.processlayout.reposition.DiagramFixtures.end;
import static com.processlayout.reposition.DiagramFixtures.gateway;
import static com.processlayout.reposition.DiagramFixtures.start;
import static com.processlayout.reposition.DiagramFixtures.task;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;

import org.junit.jupiter.api.Test;

import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramSnapshot;

class TopologicalSorterTest {

    private final FlowGraphExtractor extractor = new FlowGraphExtractor();
    private final TopologicalSorter sorter = new TopologicalSorter();

    @Test
    void layerIsLongestPathFromASource() {
        // s -> g -> a -> b -> j and g -> j directly: j must follow the long branch
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(start("s")).node(gateway("g")).node(task("a")).node(task("b")).node(gateway("j"))
                .sequenceFlow("f1", "s", "g")
                .sequenceFlow("f2", "g", "a")
                .sequenceFlow("f3", "a", "b")
                .sequenceFlow("f4", "b", "j")
                .sequenceFlow("f5", "g", "j")
                .build();

        LayerAssignment layers = sorter.sort(extractor.extract(diagram, null), Set.of());

        assertThat(layers.getLayer("s")).isZero();
        assertThat(layers.getLayer("g")).isEqualTo(1);
        assertThat(layers.getLayer("b")).isEqualTo(3);
        assertThat(layers.getLayer("j")).isEqualTo(4);
        assertThat(layers.getLayerCount()).isEqualTo(5);
    }

    @Test
    void backEdgesDoNotInfluenceLayers() {
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(start("s")).node(task("a")).node(task("b")).node(end("e"))
                .sequenceFlow("f1", "s", "a")
                .sequenceFlow("f2", "a", "b")
                .sequenceFlow("loop", "b", "a")
                .sequenceFlow("f3", "b", "e")
                .build();
        FlowGraph graph = extractor.extract(diagram, null);

        LayerAssignment layers = sorter.sort(graph, Set.of("loop"));

        assertThat(layers.getLayer("a")).isEqualTo(1);
        assertThat(layers.getLayer("b")).isEqualTo(2);
        for (DiagramEdge edge : graph.getEdges()) {
            if (!edge.getId().equals("loop")) {
                assertThat(layers.getLayer(edge.getSourceId())).isLessThan(layers.getLayer(edge.getTargetId()));
            }
        }
    }

    @Test
    void disconnectedNodesSitInLayerZeroInDeclarationOrder() {
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(task("x")).node(task("y")).node(task("z"))
                .build();

        LayerAssignment layers = sorter.sort(extractor.extract(diagram, null), Set.of());

        assertThat(layers.getLayer(0)).containsExactly("x", "y", "z");
        assertThat(layers.getTopologicalOrder()).containsExactly("x", "y", "z");
    }

    @Test
    void topologicalOrderRespectsForwardEdges() {
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(task("c")).node(task("b")).node(start("a"))
                .sequenceFlow("f1", "a", "b")
                .sequenceFlow("f2", "b", "c")
                .build();

        LayerAssignment layers = sorter.sort(extractor.extract(diagram, null), Set.of());

        assertThat(layers.getTopologicalOrder()).containsExactly("a", "b", "c");
    }
}
