package com.processlayout.reposition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.processlayout.reposition.model.Bounds;
import com.processlayout.reposition.model.DiagramAccessor;
import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramNode;
import com.processlayout.reposition.model.Lane;
import com.processlayout.reposition.model.Point;

/**
 * Geometry differences between two states of the same diagram, kept with
 * both the old and the new value so they can be applied and reverted.
 */
public class LayoutChangeSet {

    /** A single recorded change, applicable in both directions */
    public interface Change {
        String getId();

        boolean apply(DiagramAccessor accessor);

        boolean revert(DiagramAccessor accessor);
    }

    public static class NodeChange implements Change {
        public final String id;
        public final Bounds oldBounds;
        public final Bounds newBounds;

        NodeChange(String id, Bounds oldBounds, Bounds newBounds) {
            this.id = id;
            this.oldBounds = oldBounds;
            this.newBounds = newBounds;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public boolean apply(DiagramAccessor accessor) {
            return accessor.setNodeBounds(id, newBounds);
        }

        @Override
        public boolean revert(DiagramAccessor accessor) {
            return accessor.setNodeBounds(id, oldBounds);
        }
    }

    public static class LaneChange implements Change {
        public final String id;
        public final Bounds oldBounds;
        public final Bounds newBounds;

        LaneChange(String id, Bounds oldBounds, Bounds newBounds) {
            this.id = id;
            this.oldBounds = oldBounds;
            this.newBounds = newBounds;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public boolean apply(DiagramAccessor accessor) {
            return accessor.setLaneBounds(id, newBounds);
        }

        @Override
        public boolean revert(DiagramAccessor accessor) {
            return accessor.setLaneBounds(id, oldBounds);
        }
    }

    public static class WaypointChange implements Change {
        public final String id;
        public final List<Point> oldWaypoints;
        public final List<Point> newWaypoints;

        WaypointChange(String id, List<Point> oldWaypoints, List<Point> newWaypoints) {
            this.id = id;
            this.oldWaypoints = oldWaypoints;
            this.newWaypoints = newWaypoints;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public boolean apply(DiagramAccessor accessor) {
            return accessor.setWaypoints(id, newWaypoints);
        }

        @Override
        public boolean revert(DiagramAccessor accessor) {
            return accessor.setWaypoints(id, oldWaypoints);
        }
    }

    public static class LabelChange implements Change {
        public final String ownerId;
        public final Bounds oldBounds;
        public final Bounds newBounds;

        LabelChange(String ownerId, Bounds oldBounds, Bounds newBounds) {
            this.ownerId = ownerId;
            this.oldBounds = oldBounds;
            this.newBounds = newBounds;
        }

        @Override
        public String getId() {
            return ownerId;
        }

        @Override
        public boolean apply(DiagramAccessor accessor) {
            return accessor.setLabelBounds(ownerId, newBounds);
        }

        @Override
        public boolean revert(DiagramAccessor accessor) {
            return accessor.setLabelBounds(ownerId, oldBounds);
        }
    }

    private final List<NodeChange> nodeChanges = new ArrayList<>();
    private final List<Change> changes = new ArrayList<>();

    /**
     * Compares two states of a diagram element by element. Elements present
     * in only one of them are ignored.
     */
    public static LayoutChangeSet between(DiagramAccessor before, DiagramAccessor after) {
        LayoutChangeSet set = new LayoutChangeSet();
        for (DiagramNode node : before.getNodes()) {
            DiagramNode updated = after.getNode(node.getId());
            if (updated != null && !updated.getBounds().equals(node.getBounds())) {
                NodeChange change = new NodeChange(node.getId(), node.getBounds(), updated.getBounds());
                set.nodeChanges.add(change);
                set.changes.add(change);
            }
            set.addLabelChange(before, after, node.getId());
        }
        for (Lane lane : before.getLanes()) {
            Lane updated = after.getLane(lane.getId());
            if (updated != null && !Objects.equals(updated.getBounds(), lane.getBounds())) {
                set.changes.add(new LaneChange(lane.getId(), lane.getBounds(), updated.getBounds()));
            }
        }
        for (DiagramEdge edge : before.getEdges()) {
            DiagramEdge updated = after.getEdge(edge.getId());
            if (updated != null && !updated.getWaypoints().equals(edge.getWaypoints())) {
                set.changes.add(new WaypointChange(edge.getId(), edge.getWaypoints(), updated.getWaypoints()));
            }
            set.addLabelChange(before, after, edge.getId());
        }
        return set;
    }

    private void addLabelChange(DiagramAccessor before, DiagramAccessor after, String ownerId) {
        Bounds oldLabel = before.getLabelBounds(ownerId);
        Bounds newLabel = after.getLabelBounds(ownerId);
        if (oldLabel != null && newLabel != null && !oldLabel.equals(newLabel)) {
            changes.add(new LabelChange(ownerId, oldLabel, newLabel));
        }
    }

    public List<NodeChange> getNodeChanges() {
        return Collections.unmodifiableList(nodeChanges);
    }

    public List<Change> getChanges() {
        return Collections.unmodifiableList(changes);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    /**
     * Writes the new values. Changes to elements that vanished in the
     * meantime are skipped.
     *
     * @return number of changes written
     */
    public int apply(DiagramAccessor accessor) {
        int applied = 0;
        for (Change change : changes) {
            if (change.apply(accessor)) {
                applied++;
            }
        }
        return applied;
    }

    /** Restores the old values, in reverse order. */
    public int revert(DiagramAccessor accessor) {
        int reverted = 0;
        for (int i = changes.size() - 1; i >= 0; i--) {
            if (changes.get(i).revert(accessor)) {
                reverted++;
            }
        }
        return reverted;
    }
}
