package com.processlayout.reposition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.processlayout.reposition.model.DiagramAccessor;

/**
 * What a layout would do, computed on a copy of the diagram. Nothing is
 * written to the original until {@link #apply(DiagramAccessor)} is called.
 */
public class LayoutPreview {

    /** Movement of one node's top-left corner */
    public static class Displacement {
        public final String nodeId;
        public final double dx;
        public final double dy;

        Displacement(String nodeId, double dx, double dy) {
            this.nodeId = nodeId;
            this.dx = dx;
            this.dy = dy;
        }

        public double getDistance() {
            return Math.hypot(dx, dy);
        }

        @Override
        public String toString() {
            return nodeId + " by (" + dx + ", " + dy + ")";
        }
    }

    private final LayoutResult result;
    private final LayoutChangeSet changeSet;
    private final List<Displacement> displacements;

    LayoutPreview(LayoutResult result, LayoutChangeSet changeSet) {
        this.result = result;
        this.changeSet = changeSet;
        List<Displacement> list = new ArrayList<>();
        for (LayoutChangeSet.NodeChange change : changeSet.getNodeChanges()) {
            double dx = change.newBounds.x - change.oldBounds.x;
            double dy = change.newBounds.y - change.oldBounds.y;
            if (dx != 0 || dy != 0) {
                list.add(new Displacement(change.id, dx, dy));
            }
        }
        this.displacements = Collections.unmodifiableList(list);
    }

    /** Result of the layout run on the copy. */
    public LayoutResult getResult() {
        return result;
    }

    public LayoutChangeSet getChangeSet() {
        return changeSet;
    }

    public List<Displacement> getDisplacements() {
        return displacements;
    }

    /** Nodes whose position would change. Resizes without a move are not counted. */
    public int getMovedCount() {
        return displacements.size();
    }

    public double getMaxDisplacement() {
        double max = 0;
        for (Displacement displacement : displacements) {
            max = Math.max(max, displacement.getDistance());
        }
        return max;
    }

    public double getAverageDisplacement() {
        if (displacements.isEmpty())
            return 0;
        double sum = 0;
        for (Displacement displacement : displacements) {
            sum += displacement.getDistance();
        }
        return sum / displacements.size();
    }

    /**
     * Writes the previewed geometry to the diagram.
     *
     * @return number of changes written
     */
    public int apply(DiagramAccessor accessor) {
        return changeSet.apply(accessor);
    }
}
