package com.processlayout.reposition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.processlayout.reposition.model.Point;

/**
 * Separates nodes of the same layer that ended up too close vertically.
 *
 * Within each layer, nodes are sorted by y. Pairs whose centers are closer
 * than the branch spacing are pushed apart symmetrically around their
 * midpoint; this is repeated a bounded number of times. A final top-down
 * sweep then guarantees the minimum distance. Only y values change, so no
 * node ever leaves its layer.
 *
 * Pinned nodes stay in the layer as fixed obstacles: they are never moved
 * or counted, and a movable neighbour that is too close gives way alone.
 */
public class OverlapResolver {

    private static final int MAX_RELAXATION_PASSES = 50;
    private static final double EPSILON = 1e-6;

    /**
     * @return number of nodes whose y changed
     */
    public int resolve(Map<String, Point> centers, LayerAssignment layers, Set<String> pinnedIds,
            LayoutOptions options) {
        double spacing = options.getBranchSpacing();
        double quantum = options.getGridQuantum();
        if (quantum > 0) {
            spacing = Math.ceil(spacing / quantum) * quantum;
        }

        int changed = 0;
        for (List<String> layer : layers.getLayers()) {
            List<String> ids = new ArrayList<>();
            for (String id : layer) {
                if (centers.containsKey(id)) {
                    ids.add(id);
                }
            }
            if (ids.size() < 2)
                continue;

            Map<String, Integer> layerIndex = new HashMap<>();
            for (int i = 0; i < ids.size(); i++) {
                layerIndex.put(ids.get(i), i);
            }
            ids.sort(Comparator.comparingDouble((String id) -> centers.get(id).y)
                    .thenComparingInt(layerIndex::get));

            double[] ys = new double[ids.size()];
            boolean[] fixed = new boolean[ids.size()];
            List<Double> fixedYs = new ArrayList<>();
            for (int i = 0; i < ys.length; i++) {
                ys[i] = centers.get(ids.get(i)).y;
                fixed[i] = pinnedIds.contains(ids.get(i));
                if (fixed[i]) {
                    fixedYs.add(ys[i]);
                }
            }
            if (fixedYs.size() == ys.length)
                continue;
            double[] original = ys.clone();

            relax(ys, fixed, spacing);
            if (quantum > 0) {
                for (int i = 0; i < ys.length; i++) {
                    if (!fixed[i]) {
                        ys[i] = options.snap(ys[i]);
                    }
                }
            }
            sweep(ys, fixed, fixedYs, spacing);

            for (int i = 0; i < ys.length; i++) {
                if (!fixed[i] && Math.abs(ys[i] - original[i]) > EPSILON) {
                    String id = ids.get(i);
                    centers.put(id, new Point(centers.get(id).x, ys[i]));
                    changed++;
                }
            }
        }
        return changed;
    }

    private void relax(double[] ys, boolean[] fixed, double spacing) {
        for (int pass = 0; pass < MAX_RELAXATION_PASSES; pass++) {
            boolean moved = false;
            for (int i = 1; i < ys.length; i++) {
                if (ys[i] - ys[i - 1] >= spacing - EPSILON || (fixed[i - 1] && fixed[i]))
                    continue;
                if (fixed[i - 1]) {
                    ys[i] = ys[i - 1] + spacing;
                } else if (fixed[i]) {
                    ys[i - 1] = ys[i] - spacing;
                } else {
                    double mid = (ys[i] + ys[i - 1]) / 2;
                    ys[i - 1] = mid - spacing / 2;
                    ys[i] = mid + spacing / 2;
                }
                moved = true;
            }
            if (!moved)
                return;
        }
    }

    /**
     * Places movable nodes top-down, each at least one spacing below the
     * previous movable node and at least one spacing away from every fixed
     * one. {@code fixedYs} is ascending.
     */
    private void sweep(double[] ys, boolean[] fixed, List<Double> fixedYs, double spacing) {
        double last = -Double.MAX_VALUE;
        for (int i = 0; i < ys.length; i++) {
            if (fixed[i])
                continue;
            double y = last == -Double.MAX_VALUE ? ys[i] : Math.max(ys[i], last + spacing);
            for (double obstacle : fixedYs) {
                if (Math.abs(y - obstacle) < spacing - EPSILON) {
                    y = obstacle + spacing;
                }
            }
            ys[i] = y;
            last = y;
        }
    }
}
