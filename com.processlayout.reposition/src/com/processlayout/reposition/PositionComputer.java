package com.processlayout.reposition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramNode;
import com.processlayout.reposition.model.Point;
import com.processlayout.reposition.structure.BranchMembership;
import com.processlayout.reposition.structure.GatewayPattern;

/**
 * Forward pass assigning a target center to every main flow node.
 *
 * X: every layer is a column. Column i starts at
 * {@code x0 + sum(max width of columns 0..i-1) + i * gap} and its nodes are
 * centered in it.
 *
 * Y, in topological order:
 * - a join takes the y of its split
 * - a branch member is offset from its split by
 *   {@code (branchIndex - (branchCount - 1) / 2) * branchSpacing}
 * - any other node follows one placed forward predecessor, preferring the
 *   one connected by a happy-path edge, then the rightmost one
 * - sources are stacked from y0 downwards, one branch spacing apart
 *
 * A second pass then centers gateways on the nodes they connect: joins on
 * the average y of their predecessors, splits on the average y of their
 * successors. Pinned nodes keep their current center throughout.
 */
public class PositionComputer {

    private static final Logger LOG = LoggerFactory.getLogger(PositionComputer.class);

    public Map<String, Point> compute(FlowGraph graph, LayerAssignment layers, PatternLookup patterns,
            Set<String> backEdgeIds, Set<String> happyPathEdgeIds, Set<String> pinnedIds, Point origin,
            LayoutOptions options) {

        double[] columnCenters = computeColumnCenters(graph, layers, origin.x, options.getGap());
        double spacing = options.getBranchSpacing();

        Map<String, Point> centers = new LinkedHashMap<>();
        int sourceCount = 0;

        // ── First pass ──
        for (String id : layers.getTopologicalOrder()) {
            DiagramNode node = graph.getNode(id);
            if (pinnedIds.contains(id)) {
                centers.put(id, node.getBounds().getCenter());
                continue;
            }

            double x = columnCenters[layers.getLayer(id)];
            double y;

            GatewayPattern merged = patterns.getPatternByMerge(id);
            BranchMembership membership = patterns.getMembership(id);
            List<DiagramEdge> incoming = graph.getForwardIncoming(id, backEdgeIds);

            if (merged != null && centers.containsKey(merged.splitId)) {
                y = centers.get(merged.splitId).y;
            } else if (membership != null && centers.containsKey(membership.pattern.splitId)) {
                y = centers.get(membership.pattern.splitId).y
                        + membership.pattern.getOffsetFactor(membership.branchIndex) * spacing;
            } else if (incoming.isEmpty()) {
                y = origin.y + sourceCount++ * spacing;
            } else {
                y = alignedPredecessorY(incoming, centers, layers, happyPathEdgeIds, origin.y);
            }
            centers.put(id, new Point(x, y));
        }

        // ── Second pass: center gateways ──
        for (String id : layers.getTopologicalOrder()) {
            DiagramNode node = graph.getNode(id);
            if (!node.getKind().isGateway() || pinnedIds.contains(id))
                continue;

            List<DiagramEdge> incoming = graph.getForwardIncoming(id, backEdgeIds);
            List<DiagramEdge> outgoing = graph.getForwardOutgoing(id, backEdgeIds);
            List<String> neighbours = new ArrayList<>();
            if (incoming.size() >= 2) {
                for (DiagramEdge edge : incoming) {
                    neighbours.add(edge.getSourceId());
                }
            } else if (outgoing.size() >= 2) {
                for (DiagramEdge edge : outgoing) {
                    neighbours.add(edge.getTargetId());
                }
            } else {
                continue;
            }

            double sum = 0;
            for (String neighbour : neighbours) {
                sum += centers.get(neighbour).y;
            }
            Point current = centers.get(id);
            centers.put(id, new Point(current.x, sum / neighbours.size()));
        }

        LOG.debug("Computed {} positions over {} layers for {}", centers.size(), layers.getLayerCount(), graph);
        return centers;
    }

    private double alignedPredecessorY(List<DiagramEdge> incoming, Map<String, Point> centers,
            LayerAssignment layers, Set<String> happyPathEdgeIds, double fallbackY) {
        String chosen = null;
        for (DiagramEdge edge : incoming) {
            if (happyPathEdgeIds.contains(edge.getId()) && centers.containsKey(edge.getSourceId())) {
                chosen = edge.getSourceId();
                break;
            }
        }
        if (chosen == null) {
            int bestLayer = -1;
            for (DiagramEdge edge : incoming) {
                String source = edge.getSourceId();
                if (centers.containsKey(source) && layers.getLayer(source) > bestLayer) {
                    bestLayer = layers.getLayer(source);
                    chosen = source;
                }
            }
        }
        return chosen == null ? fallbackY : centers.get(chosen).y;
    }

    private double[] computeColumnCenters(FlowGraph graph, LayerAssignment layers, double x0, double gap) {
        int count = layers.getLayerCount();
        double[] maxWidths = new double[count];
        for (int i = 0; i < count; i++) {
            for (String id : layers.getLayer(i)) {
                maxWidths[i] = Math.max(maxWidths[i], graph.getNode(id).getWidth());
            }
        }

        double[] centers = new double[count];
        double left = x0;
        for (int i = 0; i < count; i++) {
            centers[i] = left + maxWidths[i] / 2;
            left += maxWidths[i] + gap;
        }
        return centers;
    }
}
