package com.processlayout.reposition.structure;

/** Position of a node inside a gateway pattern. */
public class BranchMembership {

    public final GatewayPattern pattern;
    public final int branchIndex;

    public BranchMembership(GatewayPattern pattern, int branchIndex) {
        this.pattern = pattern;
        this.branchIndex = branchIndex;
    }

    public int getBranchSize() {
        return pattern.branches.get(branchIndex).size();
    }

    @Override
    public String toString() {
        return "branch " + branchIndex + " of " + pattern.splitId;
    }
}
