package com.processlayout.reposition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.processlayout.reposition.model.Bounds;
import com.processlayout.reposition.model.DiagramAccessor;
import com.processlayout.reposition.model.DiagramNode;
import com.processlayout.reposition.structure.BoundaryAttachment;

/**
 * Places boundary events on their hosts and lays out exception chains.
 *
 * Slots on a host are handed out in attachment order: the first boundary
 * event sits on the bottom-center, the second on the left-center, further
 * ones continue along the bottom edge to the right of the center.
 *
 * An exception chain becomes a single row below the host, starting right
 * of its boundary event and advancing by the regular gap. If the row would
 * intersect anything already placed, it moves down until it is clear.
 */
public class BoundaryPlacer {

    /** Vertical distance between a host's bottom edge and its exception chain row */
    static final double BOUNDARY_GAP = 40;
    /** Horizontal distance between boundary events sharing the bottom edge */
    static final double BOUNDARY_SPREAD = 10;

    /**
     * Adds target bounds for every boundary event and chain node to
     * {@code targets}, which must already hold the main flow.
     */
    public void place(List<BoundaryAttachment> attachments, Map<String, Bounds> targets, DiagramAccessor accessor,
            Set<String> pinnedIds, LayoutOptions options) {
        Map<String, Integer> slotsUsed = new HashMap<>();
        List<Bounds> occupied = new ArrayList<>(targets.values());

        for (BoundaryAttachment attachment : attachments) {
            DiagramNode boundary = accessor.getNode(attachment.boundaryId);
            Bounds host = hostBounds(attachment.hostId, targets, accessor);
            if (boundary == null || host == null)
                continue;

            int slot = slotsUsed.merge(attachment.hostId, 1, Integer::sum) - 1;
            Bounds boundaryBounds;
            if (pinnedIds.contains(boundary.getId())) {
                boundaryBounds = boundary.getBounds();
            } else {
                boundaryBounds = slotBounds(host, boundary, slot);
            }
            targets.put(boundary.getId(), boundaryBounds);

            if (!attachment.chain.isEmpty()) {
                placeChain(attachment, host, boundaryBounds, targets, occupied, accessor, pinnedIds, options);
            }
        }
    }

    private Bounds slotBounds(Bounds host, DiagramNode boundary, int slot) {
        double w = boundary.getWidth();
        double h = boundary.getHeight();
        if (slot == 0) {
            return Bounds.centeredAt(host.getCenterX(), host.getBottom(), w, h);
        }
        if (slot == 1) {
            return Bounds.centeredAt(host.x, host.getCenterY(), w, h);
        }
        double cx = Math.min(host.getCenterX() + (slot - 1) * (w + BOUNDARY_SPREAD), host.getRight());
        return Bounds.centeredAt(cx, host.getBottom(), w, h);
    }

    private void placeChain(BoundaryAttachment attachment, Bounds host, Bounds boundary, Map<String, Bounds> targets,
            List<Bounds> occupied, DiagramAccessor accessor, Set<String> pinnedIds, LayoutOptions options) {
        double maxHeight = 0;
        for (String id : attachment.chain) {
            DiagramNode node = accessor.getNode(id);
            if (node != null) {
                maxHeight = Math.max(maxHeight, node.getHeight());
            }
        }

        double rowCenterY = Math.max(host.getBottom(), boundary.getBottom()) + BOUNDARY_GAP + maxHeight / 2;
        List<Bounds> row = layoutRow(attachment.chain, boundary.getRight() + options.getGap(), rowCenterY, targets,
                accessor, pinnedIds, options.getGap());

        // Bounded: each step moves the row below at least one more obstacle
        for (int attempt = 0; attempt <= occupied.size() && intersectsAny(row, occupied); attempt++) {
            rowCenterY += maxHeight + BOUNDARY_GAP;
            row = layoutRow(attachment.chain, boundary.getRight() + options.getGap(), rowCenterY, targets, accessor,
                    pinnedIds, options.getGap());
        }

        for (int i = 0; i < attachment.chain.size(); i++) {
            Bounds bounds = row.get(i);
            if (bounds != null) {
                targets.put(attachment.chain.get(i), bounds);
                occupied.add(bounds);
            }
        }
    }

    private List<Bounds> layoutRow(List<String> chain, double startX, double centerY, Map<String, Bounds> targets,
            DiagramAccessor accessor, Set<String> pinnedIds, double gap) {
        List<Bounds> row = new ArrayList<>();
        double left = startX;
        for (String id : chain) {
            DiagramNode node = accessor.getNode(id);
            if (node == null) {
                row.add(null);
                continue;
            }
            Bounds bounds;
            if (pinnedIds.contains(id)) {
                bounds = node.getBounds();
            } else {
                bounds = new Bounds(left, centerY - node.getHeight() / 2, node.getWidth(), node.getHeight());
            }
            row.add(bounds);
            left = bounds.getRight() + gap;
        }
        return row;
    }

    private boolean intersectsAny(List<Bounds> row, List<Bounds> occupied) {
        for (Bounds bounds : row) {
            if (bounds == null)
                continue;
            for (Bounds other : occupied) {
                if (bounds.intersects(other))
                    return true;
            }
        }
        return false;
    }

    private Bounds hostBounds(String hostId, Map<String, Bounds> targets, DiagramAccessor accessor) {
        Bounds bounds = targets.get(hostId);
        if (bounds != null)
            return bounds;
        DiagramNode host = accessor.getNode(hostId);
        return host == null ? null : host.getBounds();
    }
}
