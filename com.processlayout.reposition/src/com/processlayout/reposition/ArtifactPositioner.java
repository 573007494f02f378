package com.processlayout.reposition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import com.processlayout.reposition.model.Bounds;
import com.processlayout.reposition.model.ConnectionKind;
import com.processlayout.reposition.model.DiagramAccessor;
import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramNode;
import com.processlayout.reposition.model.ElementKind;

/**
 * Places annotations and data objects next to the flow node they are
 * associated with.
 *
 * Annotations go above-right of the node, data objects and stores
 * below-right. When several artifacts of one template share a node, each
 * further annotation is stacked above the previous one and each further
 * data artifact to the right of the previous one. An artifact without an
 * association to a flow node stays where it is.
 */
public class ArtifactPositioner {

    /** Vertical distance between a node's top edge and its annotation */
    static final double ANNOTATION_OFFSET_Y = 50;
    /** Vertical distance between a node's bottom edge and its data artifact */
    static final double DATA_OFFSET_Y = 40;
    /** Data artifacts start slightly left of the node's right edge */
    static final double DATA_OFFSET_X = -10;
    static final double STACK_GAP = 10;
    private static final double MOVE_THRESHOLD = 1;

    /**
     * @return ids of the artifacts that were moved
     */
    public List<String> position(DiagramAccessor accessor, Predicate<DiagramNode> inScope, Set<String> pinnedIds) {
        List<String> moved = new ArrayList<>();
        Map<String, Integer> stackCount = new HashMap<>();

        for (DiagramNode artifact : new ArrayList<>(accessor.getNodes())) {
            if (!artifact.getKind().isArtifact() || pinnedIds.contains(artifact.getId()) || !inScope.test(artifact))
                continue;

            DiagramNode anchor = findAnchor(accessor, artifact.getId());
            if (anchor == null)
                continue;

            boolean annotation = artifact.getKind() == ElementKind.TEXT_ANNOTATION;
            String stackKey = anchor.getId() + (annotation ? "#annotation" : "#data");
            int index = stackCount.merge(stackKey, 1, Integer::sum) - 1;

            Bounds a = anchor.getBounds();
            double w = artifact.getWidth();
            double h = artifact.getHeight();
            Bounds target;
            if (annotation) {
                double cy = a.y - ANNOTATION_OFFSET_Y - h / 2 - index * (h + STACK_GAP);
                target = Bounds.centeredAt(a.getRight() + w / 2, cy, w, h);
            } else {
                double cx = a.getRight() + DATA_OFFSET_X + w / 2 + index * (w + STACK_GAP);
                target = Bounds.centeredAt(cx, a.getBottom() + DATA_OFFSET_Y + h / 2, w, h);
            }

            Bounds current = artifact.getBounds();
            if (Math.abs(target.x - current.x) > MOVE_THRESHOLD || Math.abs(target.y - current.y) > MOVE_THRESHOLD) {
                accessor.setNodeBounds(artifact.getId(), new Bounds(Math.round(target.x), Math.round(target.y), w, h));
                moved.add(artifact.getId());
            }
        }
        return moved;
    }

    /** First node, other than an artifact, joined to the artifact by an association. */
    private DiagramNode findAnchor(DiagramAccessor accessor, String artifactId) {
        for (DiagramEdge edge : accessor.getEdges()) {
            if (edge.getKind() != ConnectionKind.ASSOCIATION)
                continue;
            String other;
            if (artifactId.equals(edge.getSourceId())) {
                other = edge.getTargetId();
            } else if (artifactId.equals(edge.getTargetId())) {
                other = edge.getSourceId();
            } else {
                continue;
            }
            DiagramNode node = other == null ? null : accessor.getNode(other);
            if (node != null && !node.getKind().isArtifact())
                return node;
        }
        return null;
    }
}
