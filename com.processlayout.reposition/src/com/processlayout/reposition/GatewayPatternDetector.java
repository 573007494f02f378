package com.processlayout.reposition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.structure.GatewayPattern;

/**
 * Recognizes split/join constructs.
 *
 * Every node with two or more forward outgoing edges is a split. Its
 * branches start at the edge targets, in edge declaration order. The join
 * is the nearest node (lowest layer) that every branch reaches and that has
 * two or more forward incoming edges; gateways win ties. The nodes of a
 * branch are those reachable from its start before hitting the join.
 */
public class GatewayPatternDetector {

    private static final Logger LOG = LoggerFactory.getLogger(GatewayPatternDetector.class);

    public PatternLookup detect(FlowGraph graph, Set<String> backEdgeIds, LayerAssignment layers) {
        List<GatewayPattern> patterns = new ArrayList<>();
        Map<String, Integer> topoIndex = new HashMap<>();
        List<String> order = layers.getTopologicalOrder();
        for (int i = 0; i < order.size(); i++) {
            topoIndex.put(order.get(i), i);
        }

        for (String splitId : order) {
            List<DiagramEdge> outgoing = graph.getForwardOutgoing(splitId, backEdgeIds);
            if (outgoing.size() < 2)
                continue;

            List<String> branchStarts = new ArrayList<>();
            for (DiagramEdge edge : outgoing) {
                branchStarts.add(edge.getTargetId());
            }

            String mergeId = findMerge(graph, backEdgeIds, layers, topoIndex, splitId, branchStarts);

            List<List<String>> branches = new ArrayList<>();
            for (String start : branchStarts) {
                branches.add(collectBranch(graph, backEdgeIds, start, splitId, mergeId));
            }
            GatewayPattern pattern = new GatewayPattern(splitId, mergeId, branches);
            patterns.add(pattern);
            LOG.debug("Detected {}", pattern);
        }

        return new PatternLookup(patterns);
    }

    private String findMerge(FlowGraph graph, Set<String> backEdgeIds, LayerAssignment layers,
            Map<String, Integer> topoIndex, String splitId, List<String> branchStarts) {
        Set<String> common = null;
        for (String start : branchStarts) {
            Set<String> reachable = reachableFrom(graph, backEdgeIds, start);
            reachable.remove(splitId);
            if (common == null) {
                common = reachable;
            } else {
                common.retainAll(reachable);
            }
        }
        if (common == null || common.isEmpty())
            return null;

        String best = null;
        for (String candidate : common) {
            if (graph.getForwardIncoming(candidate, backEdgeIds).size() < 2)
                continue;
            if (best == null || isBetterMerge(graph, layers, topoIndex, candidate, best)) {
                best = candidate;
            }
        }
        return best;
    }

    private boolean isBetterMerge(FlowGraph graph, LayerAssignment layers, Map<String, Integer> topoIndex,
            String candidate, String best) {
        int candidateLayer = layers.getLayer(candidate);
        int bestLayer = layers.getLayer(best);
        if (candidateLayer != bestLayer)
            return candidateLayer < bestLayer;
        boolean candidateGateway = graph.getNode(candidate).getKind().isGateway();
        boolean bestGateway = graph.getNode(best).getKind().isGateway();
        if (candidateGateway != bestGateway)
            return candidateGateway;
        return topoIndex.get(candidate) < topoIndex.get(best);
    }

    /** Forward reachability, start node included. */
    private Set<String> reachableFrom(FlowGraph graph, Set<String> backEdgeIds, String start) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        visited.add(start);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            for (DiagramEdge edge : graph.getForwardOutgoing(id, backEdgeIds)) {
                if (visited.add(edge.getTargetId())) {
                    queue.add(edge.getTargetId());
                }
            }
        }
        return visited;
    }

    private List<String> collectBranch(FlowGraph graph, Set<String> backEdgeIds, String start, String splitId,
            String mergeId) {
        List<String> elements = new ArrayList<>();
        if (start.equals(mergeId) || start.equals(splitId))
            return elements;

        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        visited.add(start);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            elements.add(id);
            for (DiagramEdge edge : graph.getForwardOutgoing(id, backEdgeIds)) {
                String target = edge.getTargetId();
                if (target.equals(mergeId) || target.equals(splitId))
                    continue;
                if (visited.add(target)) {
                    queue.add(target);
                }
            }
        }
        return elements;
    }
}
