package com.processlayout.reposition;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of layering: the layer index of every main flow node, the nodes of
 * each layer (top to bottom by their original position) and one
 * topological order consistent with the layers.
 */
public class LayerAssignment {

    private final Map<String, Integer> layerOf;
    private final List<List<String>> layers;
    private final List<String> topologicalOrder;

    LayerAssignment(Map<String, Integer> layerOf, List<List<String>> layers, List<String> topologicalOrder) {
        this.layerOf = Collections.unmodifiableMap(layerOf);
        this.layers = Collections.unmodifiableList(layers);
        this.topologicalOrder = Collections.unmodifiableList(topologicalOrder);
    }

    public int getLayer(String nodeId) {
        Integer layer = layerOf.get(nodeId);
        return layer == null ? -1 : layer;
    }

    public Map<String, Integer> getLayerMap() {
        return layerOf;
    }

    public int getLayerCount() {
        return layers.size();
    }

    public List<String> getLayer(int index) {
        return layers.get(index);
    }

    public List<List<String>> getLayers() {
        return layers;
    }

    public List<String> getTopologicalOrder() {
        return topologicalOrder;
    }
}
