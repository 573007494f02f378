package com.processlayout.reposition.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Narrow view of a diagram model used by the layout engines.
 *
 * Implementations expose the diagram as flat, id keyed collections. The
 * engines only ever write geometry: node bounds, lane bounds, edge
 * waypoints and label bounds. Every write returns {@code false} when the
 * addressed element does not exist, and changes nothing in that case.
 */
public interface DiagramAccessor {

    /** All nodes, in declaration order. */
    Collection<DiagramNode> getNodes();

    /** All edges, in declaration order. */
    Collection<DiagramEdge> getEdges();

    /** All lanes, in declaration order. */
    Collection<Lane> getLanes();

    DiagramNode getNode(String id);

    DiagramEdge getEdge(String id);

    Lane getLane(String id);

    /** Bounds of the label owned by a node or an edge, or {@code null} if it has none. */
    Bounds getLabelBounds(String ownerId);

    boolean setNodeBounds(String nodeId, Bounds bounds);

    boolean setLaneBounds(String laneId, Bounds bounds);

    boolean setWaypoints(String edgeId, List<Point> waypoints);

    boolean setLabelBounds(String ownerId, Bounds bounds);

    /**
     * Direct children of a container, in declaration order.
     *
     * @param containerId the container, or {@code null} for the diagram root
     */
    default List<DiagramNode> getChildren(String containerId) {
        List<DiagramNode> children = new ArrayList<>();
        for (DiagramNode node : getNodes()) {
            if (Objects.equals(node.getParentId(), containerId)) {
                children.add(node);
            }
        }
        return children;
    }

    /** Lanes owned by a container, in declaration order. */
    default List<Lane> getLanes(String containerId) {
        List<Lane> lanes = new ArrayList<>();
        for (Lane lane : getLanes()) {
            if (Objects.equals(lane.getContainerId(), containerId)) {
                lanes.add(lane);
            }
        }
        return lanes;
    }
}
