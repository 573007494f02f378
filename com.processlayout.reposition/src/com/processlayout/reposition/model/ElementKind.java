package com.processlayout.reposition.model;

/**
 * Kinds of diagram shapes the engine distinguishes.
 *
 * Each kind carries the default size used whenever a node reports a
 * non-positive width or height.
 */
public enum ElementKind {

    START_EVENT(36, 36),
    INTERMEDIATE_EVENT(36, 36),
    END_EVENT(36, 36),
    BOUNDARY_EVENT(36, 36),
    TASK(100, 80),
    GATEWAY(50, 50),
    SUB_PROCESS(350, 200),
    POOL(600, 250),
    TEXT_ANNOTATION(100, 30),
    DATA_OBJECT(36, 50),
    DATA_STORE(50, 50);

    private final double defaultWidth;
    private final double defaultHeight;

    ElementKind(double defaultWidth, double defaultHeight) {
        this.defaultWidth = defaultWidth;
        this.defaultHeight = defaultHeight;
    }

    public double getDefaultWidth() {
        return defaultWidth;
    }

    public double getDefaultHeight() {
        return defaultHeight;
    }

    public boolean isEvent() {
        return this == START_EVENT || this == INTERMEDIATE_EVENT || this == END_EVENT || this == BOUNDARY_EVENT;
    }

    public boolean isGateway() {
        return this == GATEWAY;
    }

    /** Annotations, data objects and data stores: positioned by the artifact pass only. */
    public boolean isArtifact() {
        return this == TEXT_ANNOTATION || this == DATA_OBJECT || this == DATA_STORE;
    }

    /** Kinds that may own children. Sub-processes only do so when expanded. */
    public boolean isContainer() {
        return this == POOL || this == SUB_PROCESS;
    }

    /** Kinds that take part in sequence flow layering. */
    public boolean isFlowNode() {
        return this == START_EVENT || this == INTERMEDIATE_EVENT || this == END_EVENT
                || this == TASK || this == GATEWAY || this == SUB_PROCESS;
    }
}
