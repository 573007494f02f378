package com.processlayout.reposition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.processlayout.reposition.model.DiagramAccessor;
import com.processlayout.reposition.model.DiagramNode;
import com.processlayout.reposition.structure.ContainerNode;

/**
 * Orders containers for inside-out processing.
 *
 * The result is a flat worklist: deepest containers first, and within one
 * depth regular containers before event sub-processes, then declaration
 * order. For a whole-diagram run the root scope comes last. Depths are
 * computed by walking parent ids, guarded against cycles in malformed
 * input, so arbitrarily deep nesting needs no recursion.
 */
public class ContainerHierarchyBuilder {

    /**
     * @param scopeId container to confine the run to, or {@code null} for the whole diagram
     */
    public List<ContainerNode> build(DiagramAccessor accessor, String scopeId) {
        Map<String, Integer> declarationIndex = new HashMap<>();
        List<ContainerNode> containers = new ArrayList<>();
        int index = 0;
        for (DiagramNode node : accessor.getNodes()) {
            declarationIndex.put(node.getId(), index++);
            if (!node.isContainer())
                continue;
            if (scopeId != null && !isWithin(accessor, node.getId(), scopeId))
                continue;
            containers.add(new ContainerNode(node.getId(), node.getKind(), node.getParentId(),
                    depthOf(accessor, node), node.isEventTriggered()));
        }

        containers.sort(Comparator.comparingInt((ContainerNode c) -> -c.depth)
                .thenComparingInt(c -> c.eventTriggered ? 1 : 0)
                .thenComparingInt(c -> declarationIndex.get(c.id)));

        if (scopeId == null) {
            containers.add(new ContainerNode(null, null, null, 0, false));
        }
        return containers;
    }

    /** Depth of a node: 1 for children of the root, plus one per enclosing container. */
    static int depthOf(DiagramAccessor accessor, DiagramNode node) {
        int depth = 1;
        Set<String> seen = new HashSet<>();
        String parentId = node.getParentId();
        while (parentId != null && seen.add(parentId)) {
            DiagramNode parent = accessor.getNode(parentId);
            if (parent == null)
                break;
            depth++;
            parentId = parent.getParentId();
        }
        return depth;
    }

    /** True if {@code nodeId} is {@code ancestorId} or nested anywhere inside it. */
    static boolean isWithin(DiagramAccessor accessor, String nodeId, String ancestorId) {
        Set<String> seen = new HashSet<>();
        String current = nodeId;
        while (current != null && seen.add(current)) {
            if (current.equals(ancestorId))
                return true;
            DiagramNode node = accessor.getNode(current);
            if (node == null)
                return false;
            current = node.getParentId();
        }
        return false;
    }
}
