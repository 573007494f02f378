package com.processlayout.reposition.model;

import java.util.Objects;
import java.util.Set;

/**
 * A horizontal band inside a pool. Membership is declared input: the engine
 * reads it but never changes it.
 */
public final class Lane {

    private final String id;
    private final String containerId;
    private final int bandIndex;
    private final Set<String> memberIds;
    private final Bounds bounds;

    public Lane(String id, String containerId, int bandIndex, Set<String> memberIds, Bounds bounds) {
        this.id = Objects.requireNonNull(id, "id");
        this.containerId = containerId;
        this.bandIndex = bandIndex;
        this.memberIds = Set.copyOf(memberIds);
        this.bounds = bounds;
    }

    public String getId() {
        return id;
    }

    public String getContainerId() {
        return containerId;
    }

    public int getBandIndex() {
        return bandIndex;
    }

    public Set<String> getMemberIds() {
        return memberIds;
    }

    public Bounds getBounds() {
        return bounds;
    }

    public Lane withBounds(Bounds newBounds) {
        return new Lane(id, containerId, bandIndex, memberIds, newBounds);
    }

    @Override
    public String toString() {
        return "Lane(" + id + ", band " + bandIndex + ", " + memberIds.size() + " members)";
    }
}
