package com.processlayout.reposition.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory diagram: insertion ordered maps keyed by element id.
 *
 * Serves as the working copy of preview runs and as the model behind
 * synthetic test diagrams. Lane membership declared on a node through
 * {@link DiagramNode#getLaneId()} is merged into the lane's member set
 * when the snapshot is built.
 */
public class DiagramSnapshot implements DiagramAccessor {

    private final Map<String, DiagramNode> nodes = new LinkedHashMap<>();
    private final Map<String, DiagramEdge> edges = new LinkedHashMap<>();
    private final Map<String, Lane> lanes = new LinkedHashMap<>();
    private final Map<String, Bounds> labels = new LinkedHashMap<>();

    private DiagramSnapshot() {
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Deep copy of any accessor's current state. */
    public static DiagramSnapshot copyOf(DiagramAccessor source) {
        DiagramSnapshot copy = new DiagramSnapshot();
        for (DiagramNode node : source.getNodes()) {
            copy.nodes.put(node.getId(), node);
            Bounds label = source.getLabelBounds(node.getId());
            if (label != null) {
                copy.labels.put(node.getId(), label);
            }
        }
        for (DiagramEdge edge : source.getEdges()) {
            copy.edges.put(edge.getId(), edge);
            Bounds label = source.getLabelBounds(edge.getId());
            if (label != null) {
                copy.labels.put(edge.getId(), label);
            }
        }
        for (Lane lane : source.getLanes()) {
            copy.lanes.put(lane.getId(), lane);
        }
        return copy;
    }

    @Override
    public Collection<DiagramNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    @Override
    public Collection<DiagramEdge> getEdges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    @Override
    public Collection<Lane> getLanes() {
        return Collections.unmodifiableCollection(lanes.values());
    }

    @Override
    public DiagramNode getNode(String id) {
        return nodes.get(id);
    }

    @Override
    public DiagramEdge getEdge(String id) {
        return edges.get(id);
    }

    @Override
    public Lane getLane(String id) {
        return lanes.get(id);
    }

    @Override
    public Bounds getLabelBounds(String ownerId) {
        return labels.get(ownerId);
    }

    @Override
    public boolean setNodeBounds(String nodeId, Bounds bounds) {
        DiagramNode node = nodes.get(nodeId);
        if (node == null)
            return false;
        nodes.put(nodeId, node.withBounds(bounds));
        return true;
    }

    @Override
    public boolean setLaneBounds(String laneId, Bounds bounds) {
        Lane lane = lanes.get(laneId);
        if (lane == null)
            return false;
        lanes.put(laneId, lane.withBounds(bounds));
        return true;
    }

    @Override
    public boolean setWaypoints(String edgeId, List<Point> waypoints) {
        DiagramEdge edge = edges.get(edgeId);
        if (edge == null)
            return false;
        edges.put(edgeId, edge.withWaypoints(waypoints));
        return true;
    }

    @Override
    public boolean setLabelBounds(String ownerId, Bounds bounds) {
        if (!labels.containsKey(ownerId))
            return false;
        labels.put(ownerId, bounds);
        return true;
    }

    public static final class Builder {
        private final Map<String, DiagramNode> nodes = new LinkedHashMap<>();
        private final Map<String, DiagramEdge> edges = new LinkedHashMap<>();
        private final Map<String, Lane> lanes = new LinkedHashMap<>();
        private final Map<String, Bounds> labels = new LinkedHashMap<>();

        public Builder node(DiagramNode node) {
            nodes.put(node.getId(), node);
            return this;
        }

        public Builder edge(DiagramEdge edge) {
            edges.put(edge.getId(), edge);
            return this;
        }

        public Builder sequenceFlow(String id, String sourceId, String targetId) {
            return edge(DiagramEdge.sequenceFlow(id, sourceId, targetId));
        }

        public Builder lane(Lane lane) {
            lanes.put(lane.getId(), lane);
            return this;
        }

        /** Gives a node or edge a label of the given bounds. */
        public Builder label(String ownerId, Bounds bounds) {
            labels.put(ownerId, bounds);
            return this;
        }

        public DiagramSnapshot build() {
            DiagramSnapshot snapshot = new DiagramSnapshot();
            snapshot.nodes.putAll(nodes);
            snapshot.edges.putAll(edges);
            snapshot.labels.putAll(labels);
            for (Lane lane : lanes.values()) {
                Set<String> members = new LinkedHashSet<>(lane.getMemberIds());
                for (DiagramNode node : nodes.values()) {
                    if (lane.getId().equals(node.getLaneId())) {
                        members.add(node.getId());
                    }
                }
                snapshot.lanes.put(lane.getId(),
                        new Lane(lane.getId(), lane.getContainerId(), lane.getBandIndex(), members, lane.getBounds()));
            }
            return snapshot;
        }
    }
}
