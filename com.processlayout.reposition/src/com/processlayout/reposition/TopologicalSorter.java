package com.processlayout.reposition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

import com.processlayout.reposition.model.DiagramEdge;

/**
 * Longest-path layering over the forward edges of a flow graph.
 *
 * Uses Kahn's algorithm (BFS topological sort) with back-edges removed. A
 * node's layer is the maximum over all forward paths from a source, so a
 * merge always lands right of every branch that feeds it. Nodes that are
 * not connected at all end up in layer 0.
 */
public class TopologicalSorter {

    public LayerAssignment sort(FlowGraph graph, Set<String> backEdgeIds) {
        List<String> nodeIds = graph.getNodeIds();
        Map<String, Integer> declarationIndex = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, Integer> layerOf = new LinkedHashMap<>();
        for (int i = 0; i < nodeIds.size(); i++) {
            String id = nodeIds.get(i);
            declarationIndex.put(id, i);
            inDegree.put(id, graph.getForwardIncoming(id, backEdgeIds).size());
            layerOf.put(id, 0);
        }

        Queue<String> queue = new ArrayDeque<>();
        for (String id : nodeIds) {
            if (inDegree.get(id) == 0) {
                queue.add(id);
            }
        }

        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            String id = queue.poll();
            order.add(id);
            int layer = layerOf.get(id);
            for (DiagramEdge edge : graph.getForwardOutgoing(id, backEdgeIds)) {
                String target = edge.getTargetId();
                layerOf.put(target, Math.max(layerOf.get(target), layer + 1));
                int remaining = inDegree.get(target) - 1;
                inDegree.put(target, remaining);
                if (remaining == 0) {
                    queue.add(target);
                }
            }
        }

        // Only reachable if the back-edge set was not produced by BackEdgeDetector
        if (order.size() < nodeIds.size()) {
            for (String id : nodeIds) {
                if (!order.contains(id)) {
                    order.add(id);
                }
            }
        }

        int layerCount = 0;
        for (int layer : layerOf.values()) {
            layerCount = Math.max(layerCount, layer + 1);
        }
        List<List<String>> layers = new ArrayList<>();
        for (int i = 0; i < layerCount; i++) {
            layers.add(new ArrayList<>());
        }
        for (String id : nodeIds) {
            layers.get(layerOf.get(id)).add(id);
        }
        for (List<String> layer : layers) {
            layer.sort(Comparator
                    .comparingDouble((String id) -> graph.getNode(id).getBounds().getCenterY())
                    .thenComparingInt(declarationIndex::get));
        }

        return new LayerAssignment(layerOf, layers, order);
    }
}
