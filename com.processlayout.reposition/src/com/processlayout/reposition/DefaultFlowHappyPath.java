package com.processlayout.reposition;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.processlayout.reposition.model.DiagramEdge;

/**
 * Walks from every source along one forward edge per node: the edge flagged
 * as default flow if there is one, otherwise the first declared edge.
 */
public class DefaultFlowHappyPath implements HappyPathPolicy {

    @Override
    public Set<String> selectEdges(FlowGraph graph, Set<String> backEdgeIds) {
        Set<String> path = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();

        for (String sourceId : BackEdgeDetector.traversalRoots(graph)) {
            if (!graph.getForwardIncoming(sourceId, backEdgeIds).isEmpty())
                continue;
            String current = sourceId;
            while (current != null && visited.add(current)) {
                DiagramEdge next = pick(graph.getForwardOutgoing(current, backEdgeIds));
                if (next == null)
                    break;
                path.add(next.getId());
                current = next.getTargetId();
            }
        }
        return path;
    }

    private DiagramEdge pick(List<DiagramEdge> outgoing) {
        if (outgoing.isEmpty())
            return null;
        for (DiagramEdge edge : outgoing) {
            if (edge.isDefaultFlow())
                return edge;
        }
        return outgoing.get(0);
    }
}
