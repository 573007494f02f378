package com.processlayout.reposition;

import java.util.Set;

/**
 * Chooses the dominant forward path of a flow graph: the edges that should
 * stay perfectly straight when a node could line up with more than one
 * predecessor.
 */
public interface HappyPathPolicy {

    /**
     * @param graph the main flow graph of one container
     * @param backEdgeIds edges classified as back-edges, never part of the path
     * @return ids of the edges on the happy path
     */
    Set<String> selectEdges(FlowGraph graph, Set<String> backEdgeIds);
}
