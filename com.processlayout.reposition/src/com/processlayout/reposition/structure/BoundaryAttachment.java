package com.processlayout.reposition.structure;

import java.util.List;

/**
 * A boundary event on its host, with the exception chain that is reachable
 * only through the boundary event, in traversal order.
 */
public class BoundaryAttachment {

    public final String boundaryId;
    public final String hostId;
    public final List<String> chain;

    public BoundaryAttachment(String boundaryId, String hostId, List<String> chain) {
        this.boundaryId = boundaryId;
        this.hostId = hostId;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String toString() {
        return "BoundaryAttachment[" + boundaryId + " on " + hostId + ", chain=" + chain + "]";
    }
}
