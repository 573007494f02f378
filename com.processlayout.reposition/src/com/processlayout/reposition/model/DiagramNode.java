package com.processlayout.reposition.model;

import java.util.Objects;

/**
 * A shape on the diagram: a flow node, a container, a boundary event or an
 * artifact. Everything but the bounds is fixed for the lifetime of a layout
 * call; the bounds reflect the state at the time the node was read.
 */
public final class DiagramNode {

    private final String id;
    private final ElementKind kind;
    private final Bounds bounds;
    private final String parentId;
    private final String laneId;
    private final String hostId;
    private final boolean expanded;
    private final boolean eventTriggered;

    private DiagramNode(Builder builder, Bounds bounds) {
        this.id = builder.id;
        this.kind = builder.kind;
        this.bounds = bounds;
        this.parentId = builder.parentId;
        this.laneId = builder.laneId;
        this.hostId = builder.hostId;
        this.expanded = builder.expanded;
        this.eventTriggered = builder.eventTriggered;
    }

    public static Builder builder(String id, ElementKind kind) {
        return new Builder(id, kind);
    }

    public String getId() {
        return id;
    }

    public ElementKind getKind() {
        return kind;
    }

    public Bounds getBounds() {
        return bounds;
    }

    /** The owning container, or {@code null} for nodes at the diagram root. */
    public String getParentId() {
        return parentId;
    }

    public String getLaneId() {
        return laneId;
    }

    /** For attached (boundary) nodes, the node they sit on. */
    public String getHostId() {
        return hostId;
    }

    public boolean isAttached() {
        return hostId != null;
    }

    public boolean isExpanded() {
        return expanded;
    }

    public boolean isEventTriggered() {
        return eventTriggered;
    }

    /** True for pools, and for sub-processes drawn expanded. */
    public boolean isContainer() {
        return kind == ElementKind.POOL || (kind == ElementKind.SUB_PROCESS && expanded);
    }

    /** Width, falling back to the kind's default for unset sizes. */
    public double getWidth() {
        return bounds.width > 0 ? bounds.width : kind.getDefaultWidth();
    }

    public double getHeight() {
        return bounds.height > 0 ? bounds.height : kind.getDefaultHeight();
    }

    public DiagramNode withBounds(Bounds newBounds) {
        return new DiagramNode(toBuilder(), newBounds);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(id, kind);
        builder.bounds = bounds;
        builder.parentId = parentId;
        builder.laneId = laneId;
        builder.hostId = hostId;
        builder.expanded = expanded;
        builder.eventTriggered = eventTriggered;
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DiagramNode))
            return false;
        return id.equals(((DiagramNode) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return kind + "(" + id + ")";
    }

    public static final class Builder {
        private final String id;
        private final ElementKind kind;
        private Bounds bounds = new Bounds(0, 0, 0, 0);
        private String parentId;
        private String laneId;
        private String hostId;
        private boolean expanded;
        private boolean eventTriggered;

        private Builder(String id, ElementKind kind) {
            this.id = Objects.requireNonNull(id, "id");
            this.kind = Objects.requireNonNull(kind, "kind");
            this.expanded = kind == ElementKind.POOL;
        }

        public Builder bounds(double x, double y, double width, double height) {
            this.bounds = new Bounds(x, y, width, height);
            return this;
        }

        public Builder bounds(Bounds bounds) {
            this.bounds = Objects.requireNonNull(bounds, "bounds");
            return this;
        }

        public Builder parent(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder lane(String laneId) {
            this.laneId = laneId;
            return this;
        }

        public Builder host(String hostId) {
            this.hostId = hostId;
            return this;
        }

        public Builder expanded(boolean expanded) {
            this.expanded = expanded;
            return this;
        }

        public Builder eventTriggered(boolean eventTriggered) {
            this.eventTriggered = eventTriggered;
            return this;
        }

        public DiagramNode build() {
            return new DiagramNode(this, bounds);
        }
    }
}
