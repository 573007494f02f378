package com.processlayout.reposition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.processlayout.reposition.model.Point;

/**
 * Immutable configuration of one layout call. Every value is optional;
 * {@link #defaults()} gives the standard spacing.
 */
public class LayoutOptions {

    /** Center of the first main-flow row, left edge of the first column */
    public static final double DEFAULT_ORIGIN_X = 180;
    public static final double DEFAULT_ORIGIN_Y = 200;
    /** Horizontal edge-to-edge gap between consecutive layers */
    public static final double DEFAULT_GAP = 50;
    /** Vertical center-to-center distance between sibling branches */
    public static final double DEFAULT_BRANCH_SPACING = 130;
    /** Inner padding between a container's border and its content */
    public static final double DEFAULT_CONTAINER_PADDING = 30;
    /** Vertical gap between stacked pools */
    public static final double DEFAULT_POOL_GAP = 50;
    public static final double DEFAULT_LANE_PADDING = 30;
    public static final double DEFAULT_MIN_LANE_HEIGHT = 120;

    private final Point origin;
    private final double gap;
    private final double branchSpacing;
    private final String scopeId;
    private final Set<String> pinnedIds;
    private final double gridQuantum;
    private final boolean autoResizeContainers;
    private final double containerPadding;
    private final double poolGap;
    private final double lanePadding;
    private final double minLaneHeight;
    private final HappyPathPolicy happyPathPolicy;

    private LayoutOptions(Builder builder) {
        this.origin = new Point(builder.originX, builder.originY);
        this.gap = builder.gap;
        this.branchSpacing = builder.branchSpacing;
        this.scopeId = builder.scopeId;
        this.pinnedIds = Collections.unmodifiableSet(new LinkedHashSet<>(builder.pinnedIds));
        this.gridQuantum = builder.gridQuantum;
        this.autoResizeContainers = builder.autoResizeContainers;
        this.containerPadding = builder.containerPadding;
        this.poolGap = builder.poolGap;
        this.lanePadding = builder.lanePadding;
        this.minLaneHeight = builder.minLaneHeight;
        this.happyPathPolicy = builder.happyPathPolicy;
    }

    public static LayoutOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Point getOrigin() {
        return origin;
    }

    public double getGap() {
        return gap;
    }

    public double getBranchSpacing() {
        return branchSpacing;
    }

    /** The single container to lay out, or {@code null} for the whole diagram. */
    public String getScopeId() {
        return scopeId;
    }

    public boolean isScoped() {
        return scopeId != null;
    }

    public Set<String> getPinnedIds() {
        return pinnedIds;
    }

    /** Grid size target centers snap to; 0 disables snapping. */
    public double getGridQuantum() {
        return gridQuantum;
    }

    public boolean isAutoResizeContainers() {
        return autoResizeContainers;
    }

    public double getContainerPadding() {
        return containerPadding;
    }

    public double getPoolGap() {
        return poolGap;
    }

    public double getLanePadding() {
        return lanePadding;
    }

    public double getMinLaneHeight() {
        return minLaneHeight;
    }

    public HappyPathPolicy getHappyPathPolicy() {
        return happyPathPolicy;
    }

    /** Rounds a value to the grid, or returns it unchanged when snapping is off. */
    public double snap(double value) {
        if (gridQuantum <= 0)
            return value;
        return Math.round(value / gridQuantum) * gridQuantum;
    }

    public static final class Builder {
        private double originX = DEFAULT_ORIGIN_X;
        private double originY = DEFAULT_ORIGIN_Y;
        private double gap = DEFAULT_GAP;
        private double branchSpacing = DEFAULT_BRANCH_SPACING;
        private String scopeId;
        private final Set<String> pinnedIds = new LinkedHashSet<>();
        private double gridQuantum;
        private boolean autoResizeContainers = true;
        private double containerPadding = DEFAULT_CONTAINER_PADDING;
        private double poolGap = DEFAULT_POOL_GAP;
        private double lanePadding = DEFAULT_LANE_PADDING;
        private double minLaneHeight = DEFAULT_MIN_LANE_HEIGHT;
        private HappyPathPolicy happyPathPolicy = new DefaultFlowHappyPath();

        private Builder() {
        }

        public Builder origin(double x, double y) {
            this.originX = x;
            this.originY = y;
            return this;
        }

        public Builder gap(double gap) {
            this.gap = requireNonNegative("gap", gap);
            return this;
        }

        public Builder branchSpacing(double branchSpacing) {
            this.branchSpacing = requireNonNegative("branchSpacing", branchSpacing);
            return this;
        }

        public Builder scope(String containerId) {
            this.scopeId = containerId;
            return this;
        }

        public Builder pin(String... nodeIds) {
            Collections.addAll(pinnedIds, nodeIds);
            return this;
        }

        public Builder pinned(Set<String> nodeIds) {
            pinnedIds.addAll(nodeIds);
            return this;
        }

        public Builder gridQuantum(double quantum) {
            this.gridQuantum = requireNonNegative("gridQuantum", quantum);
            return this;
        }

        public Builder autoResizeContainers(boolean enabled) {
            this.autoResizeContainers = enabled;
            return this;
        }

        public Builder containerPadding(double padding) {
            this.containerPadding = requireNonNegative("containerPadding", padding);
            return this;
        }

        public Builder poolGap(double poolGap) {
            this.poolGap = requireNonNegative("poolGap", poolGap);
            return this;
        }

        public Builder lanePadding(double lanePadding) {
            this.lanePadding = requireNonNegative("lanePadding", lanePadding);
            return this;
        }

        public Builder minLaneHeight(double minLaneHeight) {
            this.minLaneHeight = requireNonNegative("minLaneHeight", minLaneHeight);
            return this;
        }

        public Builder happyPathPolicy(HappyPathPolicy policy) {
            if (policy == null)
                throw new IllegalArgumentException("happyPathPolicy must not be null");
            this.happyPathPolicy = policy;
            return this;
        }

        public LayoutOptions build() {
            return new LayoutOptions(this);
        }

        private static double requireNonNegative(String name, double value) {
            if (value < 0 || Double.isNaN(value))
                throw new IllegalArgumentException(name + " must be >= 0, was " + value);
            return value;
        }
    }
}
