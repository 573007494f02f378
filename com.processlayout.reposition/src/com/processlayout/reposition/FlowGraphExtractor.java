package com.processlayout.reposition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processlayout.reposition.model.ConnectionKind;
import com.processlayout.reposition.model.DiagramAccessor;
import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramNode;

/**
 * Builds the sequence flow graph of a single container.
 *
 * Only direct children take part: nodes of nested containers belong to
 * those containers' own graphs. Attached (boundary) nodes, artifacts, pools
 * and event sub-processes are left out, as are edges with a missing or
 * out-of-scope endpoint.
 */
public class FlowGraphExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(FlowGraphExtractor.class);

    public FlowGraph extract(DiagramAccessor accessor, String containerId) {
        FlowGraph graph = new FlowGraph(containerId);

        for (DiagramNode node : accessor.getChildren(containerId)) {
            if (isMainFlowNode(node)) {
                graph.addNode(node);
            }
        }

        int skipped = 0;
        for (DiagramEdge edge : accessor.getEdges()) {
            if (edge.getKind() != ConnectionKind.SEQUENCE_FLOW)
                continue;
            boolean sourceIn = edge.getSourceId() != null && graph.contains(edge.getSourceId());
            boolean targetIn = edge.getTargetId() != null && graph.contains(edge.getTargetId());
            if (sourceIn && targetIn) {
                graph.addEdge(edge);
            } else if (sourceIn != targetIn && (accessor.getNode(edge.getSourceId()) == null
                    || accessor.getNode(edge.getTargetId()) == null)) {
                skipped++;
            }
        }

        if (skipped > 0) {
            LOG.debug("Skipped {} dangling edges while extracting {}", skipped, graph);
        }
        return graph;
    }

    static boolean isMainFlowNode(DiagramNode node) {
        if (node.isAttached() || !node.getKind().isFlowNode())
            return false;
        return !isEventSubProcess(node);
    }

    static boolean isEventSubProcess(DiagramNode node) {
        return node.isContainer() && node.isEventTriggered();
    }
}
