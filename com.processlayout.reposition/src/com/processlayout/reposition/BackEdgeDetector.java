package com.processlayout.reposition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramNode;
import com.processlayout.reposition.model.ElementKind;

/**
 * Classifies loop edges with a depth-first search.
 *
 * The search starts from source nodes (no incoming edge at all), start
 * events first and then top to bottom, and afterwards from every node not
 * reached yet so that pure cycles are covered too. An edge into a node that
 * is still on the DFS stack closes a cycle and is reported as a back-edge.
 * Removing the reported edges always leaves a DAG.
 *
 * The traversal keeps its own stack of frames instead of recursing, so
 * long chains cannot exhaust the thread stack.
 */
public class BackEdgeDetector {

    private static final Logger LOG = LoggerFactory.getLogger(BackEdgeDetector.class);

    private enum State {
        UNVISITED, ON_STACK, DONE
    }

    /** One DFS frame: a node and the index of the next outgoing edge to explore. */
    private static class Frame {
        final String nodeId;
        final List<DiagramEdge> edges;
        int next;

        Frame(String nodeId, List<DiagramEdge> edges) {
            this.nodeId = nodeId;
            this.edges = edges;
        }
    }

    public Set<String> detect(FlowGraph graph) {
        Set<String> backEdges = new LinkedHashSet<>();
        Map<String, State> state = new HashMap<>();
        for (String id : graph.getNodeIds()) {
            state.put(id, State.UNVISITED);
        }

        for (String root : traversalRoots(graph)) {
            if (state.get(root) == State.UNVISITED) {
                visit(graph, root, state, backEdges);
            }
        }

        if (!backEdges.isEmpty()) {
            LOG.debug("Back-edges in {}: {}", graph, backEdges);
        }
        return backEdges;
    }

    private void visit(FlowGraph graph, String root, Map<String, State> state, Set<String> backEdges) {
        Deque<Frame> stack = new ArrayDeque<>();
        state.put(root, State.ON_STACK);
        stack.push(new Frame(root, graph.getOutgoing(root)));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next >= frame.edges.size()) {
                state.put(frame.nodeId, State.DONE);
                stack.pop();
                continue;
            }

            DiagramEdge edge = frame.edges.get(frame.next++);
            String target = edge.getTargetId();
            State targetState = state.get(target);
            if (targetState == State.ON_STACK) {
                backEdges.add(edge.getId());
            } else if (targetState == State.UNVISITED) {
                state.put(target, State.ON_STACK);
                stack.push(new Frame(target, graph.getOutgoing(target)));
            }
        }
    }

    /**
     * Sources first (start events before other kinds, then by vertical
     * position), followed by all remaining nodes in declaration order.
     */
    static List<String> traversalRoots(FlowGraph graph) {
        List<DiagramNode> sources = new ArrayList<>();
        for (DiagramNode node : graph.getNodes()) {
            if (graph.getIncoming(node.getId()).isEmpty()) {
                sources.add(node);
            }
        }
        sources.sort(Comparator
                .comparingInt((DiagramNode n) -> n.getKind() == ElementKind.START_EVENT ? 0 : 1)
                .thenComparingDouble(n -> n.getBounds().getCenterY()));

        Set<String> roots = new LinkedHashSet<>();
        for (DiagramNode source : sources) {
            roots.add(source.getId());
        }
        roots.addAll(graph.getNodeIds());
        return new ArrayList<>(roots);
    }
}
