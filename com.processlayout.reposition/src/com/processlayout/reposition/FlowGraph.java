package com.processlayout.reposition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramNode;

/**
 * Sequence flow graph of one container: its flow nodes and the edges whose
 * both endpoints belong to it. Node and edge order follow declaration order,
 * which every later phase uses as its final tie-break.
 */
public class FlowGraph {

    private final String containerId;
    private final Map<String, DiagramNode> nodes = new LinkedHashMap<>();
    private final List<DiagramEdge> edges = new ArrayList<>();
    private final Map<String, List<DiagramEdge>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<DiagramEdge>> incoming = new LinkedHashMap<>();

    FlowGraph(String containerId) {
        this.containerId = containerId;
    }

    void addNode(DiagramNode node) {
        nodes.put(node.getId(), node);
        outgoing.put(node.getId(), new ArrayList<>());
        incoming.put(node.getId(), new ArrayList<>());
    }

    void addEdge(DiagramEdge edge) {
        edges.add(edge);
        outgoing.get(edge.getSourceId()).add(edge);
        incoming.get(edge.getTargetId()).add(edge);
    }

    /** The container this graph was extracted from, {@code null} for the diagram root. */
    public String getContainerId() {
        return containerId;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public DiagramNode getNode(String nodeId) {
        return nodes.get(nodeId);
    }

    public Collection<DiagramNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<String> getNodeIds() {
        return new ArrayList<>(nodes.keySet());
    }

    public List<DiagramEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public List<DiagramEdge> getOutgoing(String nodeId) {
        List<DiagramEdge> list = outgoing.get(nodeId);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    public List<DiagramEdge> getIncoming(String nodeId) {
        List<DiagramEdge> list = incoming.get(nodeId);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    /** Outgoing edges that are not in {@code backEdgeIds}, in declaration order. */
    public List<DiagramEdge> getForwardOutgoing(String nodeId, Set<String> backEdgeIds) {
        List<DiagramEdge> result = new ArrayList<>();
        for (DiagramEdge edge : getOutgoing(nodeId)) {
            if (!backEdgeIds.contains(edge.getId())) {
                result.add(edge);
            }
        }
        return result;
    }

    /** Incoming edges that are not in {@code backEdgeIds}, in declaration order. */
    public List<DiagramEdge> getForwardIncoming(String nodeId, Set<String> backEdgeIds) {
        List<DiagramEdge> result = new ArrayList<>();
        for (DiagramEdge edge : getIncoming(nodeId)) {
            if (!backEdgeIds.contains(edge.getId())) {
                result.add(edge);
            }
        }
        return result;
    }

    /** A copy of this graph without the given nodes and their edges. */
    public FlowGraph without(Set<String> removedIds) {
        FlowGraph copy = new FlowGraph(containerId);
        for (DiagramNode node : nodes.values()) {
            if (!removedIds.contains(node.getId())) {
                copy.addNode(node);
            }
        }
        for (DiagramEdge edge : edges) {
            if (copy.contains(edge.getSourceId()) && copy.contains(edge.getTargetId())) {
                copy.addEdge(edge);
            }
        }
        return copy;
    }

    @Override
    public String toString() {
        return "FlowGraph[" + (containerId == null ? "<root>" : containerId) + ", " + nodes.size() + " nodes, "
                + edges.size() + " edges]";
    }
}
