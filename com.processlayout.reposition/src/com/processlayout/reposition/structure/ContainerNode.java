package com.processlayout.reposition.structure;

import com.processlayout.reposition.model.ElementKind;

/**
 * One entry of the container hierarchy. The diagram root is represented by
 * an entry with a {@code null} id and depth 0.
 */
public class ContainerNode {

    public final String id;
    public final ElementKind kind;
    public final String parentId;
    public final int depth;
    public final boolean eventTriggered;

    public ContainerNode(String id, ElementKind kind, String parentId, int depth, boolean eventTriggered) {
        this.id = id;
        this.kind = kind;
        this.parentId = parentId;
        this.depth = depth;
        this.eventTriggered = eventTriggered;
    }

    public boolean isRoot() {
        return id == null;
    }

    public boolean isPool() {
        return kind == ElementKind.POOL;
    }

    @Override
    public String toString() {
        return isRoot() ? "<root>" : kind + "(" + id + ", depth " + depth + ")";
    }
}
