package com.processlayout.reposition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one layout call.
 */
public class LayoutResult {

    private final int movedCount;
    private final int reroutedCount;
    private final int labelsMoved;
    private final Map<String, EdgeClass> edgeClasses;
    private final Map<String, Integer> layers;
    private final List<String> warnings;

    LayoutResult(int movedCount, int reroutedCount, int labelsMoved, Map<String, EdgeClass> edgeClasses,
            Map<String, Integer> layers, List<String> warnings) {
        this.movedCount = movedCount;
        this.reroutedCount = reroutedCount;
        this.labelsMoved = labelsMoved;
        this.edgeClasses = Collections.unmodifiableMap(new LinkedHashMap<>(edgeClasses));
        this.layers = Collections.unmodifiableMap(new LinkedHashMap<>(layers));
        this.warnings = List.copyOf(warnings);
    }

    /** Nodes whose bounds changed. */
    public int getMovedCount() {
        return movedCount;
    }

    /** Edges that received new waypoints. */
    public int getReroutedCount() {
        return reroutedCount;
    }

    public int getLabelsMoved() {
        return labelsMoved;
    }

    /** Classification of every routed edge, keyed by edge id. */
    public Map<String, EdgeClass> getEdgeClasses() {
        return edgeClasses;
    }

    public EdgeClass getEdgeClass(String edgeId) {
        return edgeClasses.get(edgeId);
    }

    /** Layer index of every main flow node, keyed by node id. */
    public Map<String, Integer> getLayers() {
        return layers;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "LayoutResult[moved=" + movedCount + ", rerouted=" + reroutedCount + ", labels=" + labelsMoved
                + ", warnings=" + warnings.size() + "]";
    }
}
