package com.processlayout.reposition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.processlayout.reposition.model.Bounds;
import com.processlayout.reposition.model.DiagramAccessor;
import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramNode;
import com.processlayout.reposition.model.Lane;
import com.processlayout.reposition.model.Point;

/**
 * Writes node positions back through the accessor.
 *
 * Moving a container carries its whole content along: nested nodes, lanes,
 * the waypoints of edges inside it and all their labels shift by the same
 * delta, so a layout computed inside the container survives.
 */
public class ElementMover {

    private final DiagramAccessor accessor;

    public ElementMover(DiagramAccessor accessor) {
        this.accessor = accessor;
    }

    /**
     * Moves a node to the given bounds. Nodes that no longer exist are
     * skipped.
     *
     * @return false if the node does not exist
     */
    public boolean moveTo(String nodeId, Bounds bounds) {
        DiagramNode node = accessor.getNode(nodeId);
        if (node == null)
            return false;

        Bounds old = node.getBounds();
        double dx = bounds.x - old.x;
        double dy = bounds.y - old.y;
        if (!accessor.setNodeBounds(nodeId, bounds))
            return false;
        translateLabel(nodeId, dx, dy);

        if (node.isContainer() && (dx != 0 || dy != 0)) {
            translateContent(nodeId, dx, dy);
        }
        return true;
    }

    /** Moves a node and its content by a delta. */
    public boolean moveBy(String nodeId, double dx, double dy) {
        DiagramNode node = accessor.getNode(nodeId);
        if (node == null)
            return false;
        return moveTo(nodeId, node.getBounds().translate(dx, dy));
    }

    private void translateContent(String containerId, double dx, double dy) {
        Set<String> subtree = descendantsOf(containerId);
        for (String id : subtree) {
            DiagramNode child = accessor.getNode(id);
            accessor.setNodeBounds(id, child.getBounds().translate(dx, dy));
            translateLabel(id, dx, dy);
        }

        subtree.add(containerId);
        for (Lane lane : new ArrayList<>(accessor.getLanes())) {
            if (lane.getContainerId() != null && subtree.contains(lane.getContainerId()) && lane.getBounds() != null) {
                accessor.setLaneBounds(lane.getId(), lane.getBounds().translate(dx, dy));
            }
        }
        for (DiagramEdge edge : new ArrayList<>(accessor.getEdges())) {
            if (!subtree.contains(edge.getSourceId()) || !subtree.contains(edge.getTargetId()))
                continue;
            if (edge.getSourceId().equals(containerId) || edge.getTargetId().equals(containerId))
                continue;
            List<Point> moved = new ArrayList<>();
            for (Point p : edge.getWaypoints()) {
                moved.add(p.translate(dx, dy));
            }
            accessor.setWaypoints(edge.getId(), moved);
            translateLabel(edge.getId(), dx, dy);
        }
    }

    private void translateLabel(String ownerId, double dx, double dy) {
        if (dx == 0 && dy == 0)
            return;
        Bounds label = accessor.getLabelBounds(ownerId);
        if (label != null) {
            accessor.setLabelBounds(ownerId, label.translate(dx, dy));
        }
    }

    /** All nodes nested (at any depth) inside a container, breadth first. */
    Set<String> descendantsOf(String containerId) {
        Map<String, List<String>> children = new HashMap<>();
        for (DiagramNode node : accessor.getNodes()) {
            if (node.getParentId() != null) {
                children.computeIfAbsent(node.getParentId(), k -> new ArrayList<>()).add(node.getId());
            }
        }
        Set<String> result = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(containerId);
        while (!queue.isEmpty()) {
            for (String child : children.getOrDefault(queue.poll(), List.of())) {
                if (!child.equals(containerId) && result.add(child)) {
                    queue.add(child);
                }
            }
        }
        return result;
    }
}
