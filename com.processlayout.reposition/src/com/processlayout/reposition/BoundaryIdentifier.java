package com.processlayout.reposition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processlayout.reposition.model.ConnectionKind;
import com.processlayout.reposition.model.DiagramAccessor;
import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramNode;
import com.processlayout.reposition.structure.BoundaryAttachment;

/**
 * Finds the attached nodes of a container and their exception chains.
 *
 * A flow node belongs to an exception chain when it has at least one
 * incoming sequence flow and every one of them comes from a boundary event
 * or from another chain node. The set is grown to a fixpoint, then split per
 * boundary event by a breadth-first walk from each boundary event in
 * declaration order; a node reachable from two boundary events goes to the
 * first.
 */
public class BoundaryIdentifier {

    private static final Logger LOG = LoggerFactory.getLogger(BoundaryIdentifier.class);

    public List<BoundaryAttachment> identify(DiagramAccessor accessor, FlowGraph graph) {
        List<DiagramNode> boundaries = new ArrayList<>();
        for (DiagramNode node : accessor.getChildren(graph.getContainerId())) {
            if (node.isAttached() && graph.contains(node.getHostId())) {
                boundaries.add(node);
            }
        }
        if (boundaries.isEmpty())
            return List.of();

        Set<String> boundaryIds = new LinkedHashSet<>();
        for (DiagramNode boundary : boundaries) {
            boundaryIds.add(boundary.getId());
        }

        // Incoming sequence flows per graph node, including those leaving boundary events
        Map<String, List<DiagramEdge>> incoming = new HashMap<>();
        Map<String, List<DiagramEdge>> boundaryOutgoing = new HashMap<>();
        for (DiagramEdge edge : accessor.getEdges()) {
            if (edge.getKind() != ConnectionKind.SEQUENCE_FLOW || !graph.contains(edge.getTargetId()))
                continue;
            boolean fromBoundary = boundaryIds.contains(edge.getSourceId());
            if (fromBoundary || graph.contains(edge.getSourceId())) {
                incoming.computeIfAbsent(edge.getTargetId(), k -> new ArrayList<>()).add(edge);
            }
            if (fromBoundary) {
                boundaryOutgoing.computeIfAbsent(edge.getSourceId(), k -> new ArrayList<>()).add(edge);
            }
        }

        Set<String> chainNodes = new LinkedHashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String id : graph.getNodeIds()) {
                if (chainNodes.contains(id))
                    continue;
                List<DiagramEdge> in = incoming.get(id);
                if (in == null || in.isEmpty())
                    continue;
                boolean exclusive = true;
                for (DiagramEdge edge : in) {
                    String source = edge.getSourceId();
                    if (!boundaryIds.contains(source) && !chainNodes.contains(source)) {
                        exclusive = false;
                        break;
                    }
                }
                if (exclusive) {
                    chainNodes.add(id);
                    changed = true;
                }
            }
        }

        Set<String> assigned = new LinkedHashSet<>();
        List<BoundaryAttachment> attachments = new ArrayList<>();
        for (DiagramNode boundary : boundaries) {
            List<String> chain = new ArrayList<>();
            Deque<String> queue = new ArrayDeque<>();
            for (DiagramEdge edge : boundaryOutgoing.getOrDefault(boundary.getId(), List.of())) {
                String target = edge.getTargetId();
                if (chainNodes.contains(target) && assigned.add(target)) {
                    queue.add(target);
                }
            }
            while (!queue.isEmpty()) {
                String id = queue.poll();
                chain.add(id);
                for (DiagramEdge edge : graph.getOutgoing(id)) {
                    String target = edge.getTargetId();
                    if (chainNodes.contains(target) && assigned.add(target)) {
                        queue.add(target);
                    }
                }
            }
            attachments.add(new BoundaryAttachment(boundary.getId(), boundary.getHostId(), chain));
        }

        LOG.debug("Found {} boundary attachments with {} exception chain nodes in {}", attachments.size(),
                assigned.size(), graph);
        return attachments;
    }

    /** All chain node ids of the given attachments. */
    public static Set<String> chainNodeIds(List<BoundaryAttachment> attachments) {
        Set<String> ids = new LinkedHashSet<>();
        for (BoundaryAttachment attachment : attachments) {
            ids.addAll(attachment.chain);
        }
        return ids;
    }
}
