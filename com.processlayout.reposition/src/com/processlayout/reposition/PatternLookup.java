package com.processlayout.reposition;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.processlayout.reposition.structure.BranchMembership;
import com.processlayout.reposition.structure.GatewayPattern;

/**
 * Lookup tables over the detected gateway patterns: by split id, by merge
 * id, and element id to branch membership. An element inside nested
 * patterns is mapped to its innermost (smallest) branch.
 */
public class PatternLookup {

    private final List<GatewayPattern> patterns;
    private final Map<String, GatewayPattern> bySplit = new HashMap<>();
    private final Map<String, GatewayPattern> byMerge = new HashMap<>();
    private final Map<String, BranchMembership> byElement = new HashMap<>();

    PatternLookup(List<GatewayPattern> patterns) {
        this.patterns = Collections.unmodifiableList(patterns);
        for (GatewayPattern pattern : patterns) {
            bySplit.put(pattern.splitId, pattern);
            if (pattern.mergeId != null) {
                byMerge.putIfAbsent(pattern.mergeId, pattern);
            }
            for (int i = 0; i < pattern.branches.size(); i++) {
                BranchMembership membership = new BranchMembership(pattern, i);
                for (String elementId : pattern.branches.get(i)) {
                    BranchMembership existing = byElement.get(elementId);
                    if (existing == null || membership.getBranchSize() < existing.getBranchSize()) {
                        byElement.put(elementId, membership);
                    }
                }
            }
        }
    }

    public List<GatewayPattern> getPatterns() {
        return patterns;
    }

    public GatewayPattern getPatternBySplit(String splitId) {
        return bySplit.get(splitId);
    }

    public GatewayPattern getPatternByMerge(String mergeId) {
        return byMerge.get(mergeId);
    }

    public BranchMembership getMembership(String elementId) {
        return byElement.get(elementId);
    }

    public boolean isMerge(String nodeId) {
        return byMerge.containsKey(nodeId);
    }
}
