package com.processlayout.elk;

import java.util.LinkedHashMap;
import java.util.Map;

import org.eclipse.elk.alg.layered.options.CrossingMinimizationStrategy;
import org.eclipse.elk.alg.layered.options.LayeredOptions;
import org.eclipse.elk.alg.layered.options.LayeringStrategy;
import org.eclipse.elk.alg.layered.options.NodePlacementStrategy;
import org.eclipse.elk.core.math.ElkPadding;
import org.eclipse.elk.core.options.CoreOptions;
import org.eclipse.elk.core.options.Direction;
import org.eclipse.elk.core.options.EdgeRouting;
import org.eclipse.elk.core.options.HierarchyHandling;
import org.eclipse.elk.core.options.PortConstraints;
import org.eclipse.elk.graph.ElkEdge;
import org.eclipse.elk.graph.ElkNode;
import org.eclipse.elk.graph.util.ElkGraphUtil;

import com.processlayout.reposition.model.ConnectionKind;
import com.processlayout.reposition.model.DiagramAccessor;
import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramNode;

/**
 * ELK Graph Builder for the initial placement of freshly imported process
 * diagrams.
 *
 * FLOW DIRECTION:
 * - Left to right (Direction.RIGHT), one layer per step of the process
 * - Orthogonal edge routing (90-degree angles)
 *
 * CONTAINERS (pools, expanded sub-processes):
 * - Become hierarchical ELK nodes with padding; the top padding leaves room
 *   for the title
 * - Edges may cross container borders (HierarchyHandling.INCLUDE_CHILDREN)
 *
 * LEFT OUT:
 * - Boundary events and artifacts; they are placed relative to their
 *   host or anchor after ELK has run
 * - Lanes; ELK has no notion of bands
 *
 * EDGE PRIORITIES:
 * - Default flows (10): kept dead straight
 * - Other sequence flows (5)
 * - Message flows (1)
 */
public class ElkGraphBuilder {

    /** Same identifier ELK registers for its layered algorithm */
    public static final String LAYERED_ALGORITHM = "org.eclipse.elk.layered";

    static final double DEFAULT_NODE_SPACING = 50.0;
    static final double DEFAULT_LAYER_SPACING = 50.0;

    private final Map<String, ElkNode> nodeMap = new LinkedHashMap<>();

    public ElkNode buildGraph(DiagramAccessor accessor) {
        ElkNode rootNode = ElkGraphUtil.createGraph();

        // ── 1. Global Layout Algorithm ──────────────────────────────────────
        rootNode.setProperty(CoreOptions.ALGORITHM, LAYERED_ALGORITHM);
        rootNode.setProperty(CoreOptions.DIRECTION, Direction.RIGHT);
        rootNode.setProperty(CoreOptions.HIERARCHY_HANDLING, HierarchyHandling.INCLUDE_CHILDREN);
        rootNode.setProperty(CoreOptions.EDGE_ROUTING, EdgeRouting.ORTHOGONAL);
        rootNode.setProperty(CoreOptions.PORT_CONSTRAINTS, PortConstraints.FREE);

        // ── 2. Layering ─────────────────────────────────────────────────────
        rootNode.setProperty(LayeredOptions.LAYERING_STRATEGY, LayeringStrategy.NETWORK_SIMPLEX);
        rootNode.setProperty(LayeredOptions.CROSSING_MINIMIZATION_STRATEGY, CrossingMinimizationStrategy.LAYER_SWEEP);
        rootNode.setProperty(LayeredOptions.NODE_PLACEMENT_STRATEGY, NodePlacementStrategy.BRANDES_KOEPF);

        // ── 3. Spacing ─────────────────────────────────────────────────────
        rootNode.setProperty(CoreOptions.SPACING_NODE_NODE, DEFAULT_NODE_SPACING);
        rootNode.setProperty(LayeredOptions.SPACING_NODE_NODE_BETWEEN_LAYERS, DEFAULT_LAYER_SPACING);

        // ── 4. Build Graph ──────────────────────────────────────────────────
        for (DiagramNode node : accessor.getChildren(null)) {
            createNode(accessor, rootNode, node);
        }
        for (DiagramEdge edge : accessor.getEdges()) {
            createEdge(edge);
        }

        return rootNode;
    }

    /**
     * Creates an ELK node for a diagram node and, for expanded containers,
     * for all of its children. Nesting depth is bounded by the diagram, so
     * the recursion mirrors it.
     */
    private void createNode(DiagramAccessor accessor, ElkNode parentGraph, DiagramNode node) {
        if (!isPlaced(node))
            return;

        ElkNode elkNode = ElkGraphUtil.createNode(parentGraph);
        elkNode.setIdentifier(node.getId());
        elkNode.setWidth(node.getWidth());
        elkNode.setHeight(node.getHeight());
        nodeMap.put(node.getId(), elkNode);

        if (node.isContainer()) {
            elkNode.setProperty(CoreOptions.PADDING, new ElkPadding(45, 20, 20, 45));
            for (DiagramNode child : accessor.getChildren(node.getId())) {
                createNode(accessor, elkNode, child);
            }
        }
    }

    private void createEdge(DiagramEdge edge) {
        if (edge.getKind() == ConnectionKind.ASSOCIATION)
            return;
        ElkNode sourceNode = nodeMap.get(edge.getSourceId());
        ElkNode targetNode = nodeMap.get(edge.getTargetId());
        if (sourceNode == null || targetNode == null || sourceNode == targetNode)
            return;
        // ELK rejects edges between a hierarchical node and its own content
        if (isAncestor(sourceNode, targetNode) || isAncestor(targetNode, sourceNode))
            return;

        ElkEdge elkEdge = ElkGraphUtil.createSimpleEdge(sourceNode, targetNode);
        elkEdge.setIdentifier(edge.getId());
        if (edge.getKind() == ConnectionKind.MESSAGE_FLOW) {
            elkEdge.setProperty(LayeredOptions.PRIORITY, 1);
        } else if (edge.isDefaultFlow()) {
            elkEdge.setProperty(LayeredOptions.PRIORITY, 10);
        } else {
            elkEdge.setProperty(LayeredOptions.PRIORITY, 5);
        }
    }

    private static boolean isAncestor(ElkNode ancestor, ElkNode node) {
        for (ElkNode parent = node.getParent(); parent != null; parent = parent.getParent()) {
            if (parent == ancestor)
                return true;
        }
        return false;
    }

    /** Shapes ELK positions itself; everything else is placed afterwards. */
    static boolean isPlaced(DiagramNode node) {
        return !node.isAttached() && !node.getKind().isArtifact();
    }

    public ElkNode getElkNode(String nodeId) {
        return nodeMap.get(nodeId);
    }

    public Map<String, ElkNode> getNodeMap() {
        return nodeMap;
    }
}
