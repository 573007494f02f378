package com.processlayout.reposition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.processlayout.reposition.model.Bounds;
import com.processlayout.reposition.model.DiagramAccessor;
import com.processlayout.reposition.model.DiagramNode;
import com.processlayout.reposition.model.Lane;

/**
 * Fits the content of a pool into its lanes.
 *
 * Nodes keep their x. Per lane (in band order), the lane's members are
 * shifted vertically as one group so that they are centered in the lane's
 * band. Lanes are stacked without gaps from the pool's top edge and each is
 * made tall enough for its members plus padding, never lower than the
 * minimum lane height. Boundary events and exception chain nodes without a
 * lane of their own travel with their host's lane.
 *
 * A pinned pool keeps its bounds and the bounds of its lanes; members are
 * only shifted into the existing bands.
 */
public class LaneLayoutApplier {

    private static final Logger LOG = LoggerFactory.getLogger(LaneLayoutApplier.class);

    /** Width of the vertical title band on the left side of a pool */
    public static final double POOL_HEADER_WIDTH = 30;

    /**
     * @param hostOf maps boundary events and chain nodes to the node they hang off
     * @param fixedIds nodes whose targets must not be shifted, and the pool itself if it is pinned
     * @return the new bounds of the pool
     */
    public Bounds apply(DiagramAccessor accessor, DiagramNode pool, LaneMembership membership,
            Map<String, Bounds> targets, Map<String, String> hostOf, Set<String> fixedIds, LayoutOptions options) {
        double padding = options.getLanePadding();
        Bounds poolBounds = pool.getBounds();
        boolean poolPinned = fixedIds.contains(pool.getId());

        Map<String, List<String>> membersByLane = new LinkedHashMap<>();
        for (Lane lane : membership.getLanes()) {
            membersByLane.put(lane.getId(), new ArrayList<>());
        }
        for (String id : targets.keySet()) {
            if (fixedIds.contains(id))
                continue;
            String laneId = effectiveLane(accessor, id, membership, hostOf);
            if (laneId != null && membersByLane.containsKey(laneId)) {
                membersByLane.get(laneId).add(id);
            }
        }

        double laneTop = poolBounds.y;
        double maxRight = poolBounds.x + POOL_HEADER_WIDTH;
        for (Bounds bounds : targets.values()) {
            maxRight = Math.max(maxRight, bounds.getRight());
        }
        double poolWidth = maxRight + options.getContainerPadding() - poolBounds.x;
        if (!options.isAutoResizeContainers()) {
            poolWidth = Math.max(poolWidth, poolBounds.width);
        }

        for (Lane lane : membership.getLanes()) {
            List<String> members = membersByLane.get(lane.getId());
            double minTop = Double.MAX_VALUE;
            double maxBottom = -Double.MAX_VALUE;
            for (String id : members) {
                Bounds bounds = targets.get(id);
                minTop = Math.min(minTop, bounds.y);
                maxBottom = Math.max(maxBottom, bounds.getBottom());
            }
            double contentHeight = members.isEmpty() ? 0 : maxBottom - minTop;

            double laneHeight = Math.max(options.getMinLaneHeight(), contentHeight + 2 * padding);
            if (!options.isAutoResizeContainers() && lane.getBounds() != null) {
                laneHeight = Math.max(laneHeight, lane.getBounds().height);
            }

            Bounds laneBounds;
            if (poolPinned && lane.getBounds() != null) {
                laneBounds = lane.getBounds();
            } else {
                laneBounds = new Bounds(poolBounds.x + POOL_HEADER_WIDTH, laneTop, poolWidth - POOL_HEADER_WIDTH,
                        laneHeight);
            }

            if (!members.isEmpty()) {
                double dy = laneBounds.y + (laneBounds.height - contentHeight) / 2 - minTop;
                for (String id : members) {
                    targets.put(id, targets.get(id).translate(0, dy));
                }
            }

            if (!poolPinned) {
                accessor.setLaneBounds(lane.getId(), laneBounds);
            }
            LOG.debug("Lane {} band y={}..{} with {} members", lane.getId(), laneBounds.y, laneBounds.getBottom(),
                    members.size());
            laneTop = laneBounds.getBottom();
        }

        if (poolPinned) {
            LOG.debug("Pool {} is pinned, lane bounds kept", pool.getId());
            return poolBounds;
        }

        Bounds newPool = new Bounds(poolBounds.x, poolBounds.y, poolWidth, laneTop - poolBounds.y);
        accessor.setNodeBounds(pool.getId(), newPool);
        return newPool;
    }

    private String effectiveLane(DiagramAccessor accessor, String id, LaneMembership membership,
            Map<String, String> hostOf) {
        Set<String> seen = new HashSet<>();
        String current = id;
        DiagramNode node = accessor.getNode(id);
        // Boundary events always share their host's band
        if (node != null && node.isAttached()) {
            current = node.getHostId();
        }
        while (current != null && seen.add(current)) {
            String laneId = membership.getLaneOf(current);
            if (laneId != null)
                return laneId;
            current = hostOf.get(current);
        }
        return null;
    }
}
