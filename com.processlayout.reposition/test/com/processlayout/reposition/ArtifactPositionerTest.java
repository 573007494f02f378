package com.processlayout.reposition;

import static com.processlayout.reposition.DiagramFixtures.association;
import static com.processlayout.reposition.DiagramFixtures.shape;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.processlayout.reposition.model.Bounds;
import com.processlayout.reposition.model.DiagramSnapshot;
import com.processlayout.reposition.model.ElementKind;

class ArtifactPositionerTest {

    private final ArtifactPositioner positioner = new ArtifactPositioner();

    private DiagramSnapshot.Builder withTask() {
        return DiagramSnapshot.builder().node(shape("t", ElementKind.TASK).bounds(200, 200, 100, 80).build());
    }

    @Test
    void annotationGoesAboveRight() {
        DiagramSnapshot diagram = withTask()
                .node(shape("note", ElementKind.TEXT_ANNOTATION).build())
                .edge(association("a1", "note", "t"))
                .build();

        List<String> moved = positioner.position(diagram, n -> true, Set.of());

        assertThat(moved).containsExactly("note");
        assertThat(diagram.getNode("note").getBounds()).isEqualTo(new Bounds(300, 120, 100, 30));
    }

    @Test
    void dataObjectsGoBelowRightAndStackSideways() {
        DiagramSnapshot diagram = withTask()
                .node(shape("d1", ElementKind.DATA_OBJECT).build())
                .node(shape("d2", ElementKind.DATA_OBJECT).build())
                .edge(association("a1", "t", "d1"))
                .edge(association("a2", "d2", "t"))
                .build();

        positioner.position(diagram, n -> true, Set.of());

        assertThat(diagram.getNode("d1").getBounds()).isEqualTo(new Bounds(290, 320, 36, 50));
        assertThat(diagram.getNode("d2").getBounds()).isEqualTo(new Bounds(336, 320, 36, 50));
    }

    @Test
    void unassociatedAndPinnedArtifactsStay() {
        DiagramSnapshot diagram = withTask()
                .node(shape("loose", ElementKind.TEXT_ANNOTATION).bounds(5, 5, 100, 30).build())
                .node(shape("fixed", ElementKind.TEXT_ANNOTATION).bounds(7, 7, 100, 30).build())
                .edge(association("a1", "fixed", "t"))
                .build();

        List<String> moved = positioner.position(diagram, n -> true, Set.of("fixed"));

        assertThat(moved).isEmpty();
        assertThat(diagram.getNode("loose").getBounds()).isEqualTo(new Bounds(5, 5, 100, 30));
        assertThat(diagram.getNode("fixed").getBounds()).isEqualTo(new Bounds(7, 7, 100, 30));
    }
}
