package com.processlayout.reposition;

import static com.processlayout.reposition.DiagramFixtures.lane;
import static com.processlayout.reposition.DiagramFixtures.shape;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.processlayout.reposition.model.Bounds;
import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramSnapshot;
import com.processlayout.reposition.model.ElementKind;
import com.processlayout.reposition.model.Point;

class ElementMoverTest {

    private static DiagramSnapshot nested() {
        return DiagramSnapshot.builder()
                .node(shape("pool", ElementKind.POOL).bounds(0, 0, 600, 300).build())
                .node(shape("sp", ElementKind.SUB_PROCESS).expanded(true).parent("pool").bounds(100, 50, 300, 200)
                        .build())
                .node(shape("a", ElementKind.TASK).parent("sp").bounds(120, 80, 100, 80).build())
                .node(shape("b", ElementKind.END_EVENT).parent("sp").bounds(260, 102, 36, 36).build())
                .node(shape("outside", ElementKind.TASK).bounds(700, 0, 100, 80).build())
                .edge(DiagramEdge.sequenceFlow("inner", "a", "b")
                        .withWaypoints(List.of(new Point(220, 120), new Point(260, 120))))
                .edge(DiagramEdge.sequenceFlow("out", "sp", "outside")
                        .withWaypoints(List.of(new Point(400, 150), new Point(700, 40))))
                .lane(lane("l", "pool", 0, new Bounds(30, 0, 570, 300)))
                .label("b", new Bounds(250, 150, 56, 14))
                .build();
    }

    @Test
    void movingAContainerCarriesItsWholeContent() {
        DiagramSnapshot diagram = nested();

        boolean moved = new ElementMover(diagram).moveBy("pool", 10, 20);

        assertThat(moved).isTrue();
        assertThat(diagram.getNode("pool").getBounds()).isEqualTo(new Bounds(10, 20, 600, 300));
        assertThat(diagram.getNode("sp").getBounds()).isEqualTo(new Bounds(110, 70, 300, 200));
        assertThat(diagram.getNode("a").getBounds()).isEqualTo(new Bounds(130, 100, 100, 80));
        assertThat(diagram.getLane("l").getBounds()).isEqualTo(new Bounds(40, 20, 570, 300));
        assertThat(diagram.getEdge("inner").getWaypoints()).containsExactly(new Point(230, 140),
                new Point(270, 140));
        assertThat(diagram.getLabelBounds("b")).isEqualTo(new Bounds(260, 170, 56, 14));
        assertThat(diagram.getNode("outside").getBounds()).isEqualTo(new Bounds(700, 0, 100, 80));
        assertThat(diagram.getEdge("out").getWaypoints()).containsExactly(new Point(400, 150), new Point(700, 40));
    }

    @Test
    void movingAPlainNodeLeavesOthersAlone() {
        DiagramSnapshot diagram = nested();

        new ElementMover(diagram).moveTo("a", new Bounds(0, 0, 100, 80));

        assertThat(diagram.getNode("b").getBounds()).isEqualTo(new Bounds(260, 102, 36, 36));
        assertThat(diagram.getEdge("inner").getWaypoints()).hasSize(2).startsWith(new Point(220, 120));
    }

    @Test
    void unknownNodeIsReported() {
        assertThat(new ElementMover(nested()).moveBy("ghost", 5, 5)).isFalse();
    }

    @Test
    void descendantsAreCollectedAtEveryDepth() {
        assertThat(new ElementMover(nested()).descendantsOf("pool")).containsExactly("sp", "a", "b");
    }
}
