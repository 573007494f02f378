package com.processlayout.reposition.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A split node, the join its branches reconverge at, and the nodes of each
 * branch in between. {@code mergeId} is {@code null} for fans that never
 * reconverge.
 */
public class GatewayPattern {

    public final String splitId;
    public final String mergeId;
    public final List<List<String>> branches;

    public GatewayPattern(String splitId, String mergeId, List<List<String>> branches) {
        this.splitId = splitId;
        this.mergeId = mergeId;
        List<List<String>> copy = new ArrayList<>();
        for (List<String> branch : branches) {
            copy.add(List.copyOf(branch));
        }
        this.branches = Collections.unmodifiableList(copy);
    }

    public int getBranchCount() {
        return branches.size();
    }

    /**
     * Vertical offset factor of a branch: branches are spread symmetrically
     * around the split, so with three branches the factors are -1, 0 and 1.
     */
    public double getOffsetFactor(int branchIndex) {
        return branchIndex - (branches.size() - 1) / 2.0;
    }

    @Override
    public String toString() {
        return "GatewayPattern[split=" + splitId + ", merge=" + mergeId + ", branches=" + branches + "]";
    }
}
