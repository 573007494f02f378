package com.processlayout.reposition.model;

import java.util.List;
import java.util.Objects;

/**
 * A connection between two nodes. Waypoints are absolute and include both
 * end points once routed; an empty list means "not routed yet".
 */
public final class DiagramEdge {

    private final String id;
    private final ConnectionKind kind;
    private final String sourceId;
    private final String targetId;
    private final List<Point> waypoints;
    private final boolean defaultFlow;

    public DiagramEdge(String id, ConnectionKind kind, String sourceId, String targetId,
            List<Point> waypoints, boolean defaultFlow) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
        this.defaultFlow = defaultFlow;
    }

    public static DiagramEdge sequenceFlow(String id, String sourceId, String targetId) {
        return new DiagramEdge(id, ConnectionKind.SEQUENCE_FLOW, sourceId, targetId, List.of(), false);
    }

    public String getId() {
        return id;
    }

    public ConnectionKind getKind() {
        return kind;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public List<Point> getWaypoints() {
        return waypoints;
    }

    /** Marks the outgoing edge taken when no condition of a gateway holds. */
    public boolean isDefaultFlow() {
        return defaultFlow;
    }

    public DiagramEdge withWaypoints(List<Point> newWaypoints) {
        return new DiagramEdge(id, kind, sourceId, targetId, newWaypoints, defaultFlow);
    }

    @Override
    public String toString() {
        return kind + "(" + id + ": " + sourceId + " -> " + targetId + ")";
    }
}
