package com.processlayout.reposition;

import static com.processlayout.reposition.DiagramFixtures.association;
import static com.processlayout.reposition.DiagramFixtures.boundary;
import static com.processlayout.reposition.DiagramFixtures.shape;
import static com.processlayout.reposition.DiagramFixtures.start;
import static com.processlayout.reposition.DiagramFixtures.task;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;

import org.junit.jupiter.api.Test;

import com.processlayout.reposition.model.DiagramSnapshot;
import com.processlayout.reposition.model.ElementKind;

class FlowGraphExtractorTest {

    private final FlowGraphExtractor extractor = new FlowGraphExtractor();

    @Test
    void keepsOnlyDirectFlowChildrenOfTheContainer() {
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(start("s"))
                .node(task("a"))
                .node(shape("sub", ElementKind.SUB_PROCESS).expanded(true).build())
                .node(shape("inner", ElementKind.TASK).parent("sub").build())
                .node(boundary("timer", "a"))
                .node(shape("note", ElementKind.TEXT_ANNOTATION).build())
                .node(shape("events", ElementKind.SUB_PROCESS).expanded(true).eventTriggered(true).build())
                .sequenceFlow("f1", "s", "a")
                .sequenceFlow("f2", "a", "sub")
                .sequenceFlow("f3", "timer", "a")
                .edge(association("n1", "note", "a"))
                .build();

        FlowGraph root = extractor.extract(diagram, null);

        assertThat(root.getNodeIds()).containsExactly("s", "a", "sub");
        assertThat(root.getEdges()).extracting(e -> e.getId()).containsExactly("f1", "f2");

        FlowGraph inner = extractor.extract(diagram, "sub");
        assertThat(inner.getNodeIds()).containsExactly("inner");
        assertThat(inner.getContainerId()).isEqualTo("sub");
    }

    @Test
    void skipsDanglingEdges() {
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(task("a"))
                .node(task("b"))
                .sequenceFlow("ok", "a", "b")
                .sequenceFlow("noTarget", "a", "ghost")
                .sequenceFlow("noSource", null, "b")
                .build();

        FlowGraph graph = extractor.extract(diagram, null);

        assertThat(graph.getEdges()).extracting(e -> e.getId()).containsExactly("ok");
        assertThat(graph.getOutgoing("a")).hasSize(1);
        assertThat(graph.getIncoming("b")).hasSize(1);
    }

    @Test
    void emptyContainerGivesEmptyGraph() {
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(shape("sub", ElementKind.SUB_PROCESS).expanded(true).build())
                .build();

        assertThat(extractor.extract(diagram, "sub").isEmpty()).isTrue();
    }

    @Test
    void withoutDropsNodesAndTheirEdges() {
        DiagramSnapshot diagram = DiagramSnapshot.builder()
                .node(task("a"))
                .node(task("b"))
                .node(task("c"))
                .sequenceFlow("f1", "a", "b")
                .sequenceFlow("f2", "b", "c")
                .build();

        FlowGraph graph = extractor.extract(diagram, null).without(Set.of("b"));

        assertThat(graph.getNodeIds()).containsExactly("a", "c");
        assertThat(graph.getEdges()).isEmpty();
    }
}
