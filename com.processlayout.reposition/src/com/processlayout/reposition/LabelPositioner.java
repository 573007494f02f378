package com.processlayout.reposition;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import com.processlayout.reposition.model.Bounds;
import com.processlayout.reposition.model.DiagramAccessor;
import com.processlayout.reposition.model.DiagramEdge;
import com.processlayout.reposition.model.DiagramNode;
import com.processlayout.reposition.model.ElementKind;
import com.processlayout.reposition.model.Point;

/**
 * Moves external labels after everything else is final.
 *
 * Events, gateways and data artifacts carry their label below the shape,
 * horizontally centered, {@value #ELEMENT_LABEL_DISTANCE} units under the
 * bottom edge. Tasks and containers draw their label inside and are left
 * alone. Edge labels are centered on the midpoint of the routed path.
 */
public class LabelPositioner {

    public static final double ELEMENT_LABEL_DISTANCE = 10;

    /**
     * @return number of labels whose bounds changed
     */
    public int position(DiagramAccessor accessor, Predicate<DiagramNode> nodeInScope,
            Predicate<DiagramEdge> edgeInScope) {
        int moved = 0;
        for (DiagramNode node : new ArrayList<>(accessor.getNodes())) {
            if (!hasExternalLabel(node.getKind()) || !nodeInScope.test(node))
                continue;
            Bounds label = accessor.getLabelBounds(node.getId());
            if (label == null)
                continue;
            Bounds shape = node.getBounds();
            Bounds target = new Bounds(shape.getCenterX() - label.width / 2,
                    shape.getBottom() + ELEMENT_LABEL_DISTANCE, label.width, label.height);
            if (!target.equals(label) && accessor.setLabelBounds(node.getId(), target)) {
                moved++;
            }
        }

        for (DiagramEdge edge : new ArrayList<>(accessor.getEdges())) {
            if (!edgeInScope.test(edge))
                continue;
            Bounds label = accessor.getLabelBounds(edge.getId());
            Point mid = pathMidpoint(edge.getWaypoints());
            if (label == null || mid == null)
                continue;
            Bounds target = label.withCenter(mid.x, mid.y);
            if (!target.equals(label) && accessor.setLabelBounds(edge.getId(), target)) {
                moved++;
            }
        }
        return moved;
    }

    static boolean hasExternalLabel(ElementKind kind) {
        return kind.isEvent() || kind.isGateway() || kind == ElementKind.DATA_OBJECT
                || kind == ElementKind.DATA_STORE;
    }

    /**
     * Point halfway along a polyline, measured by cumulative segment length.
     *
     * @return {@code null} for an empty path
     */
    public static Point pathMidpoint(List<Point> path) {
        if (path == null || path.isEmpty())
            return null;
        if (path.size() == 1)
            return path.get(0);

        double total = 0;
        for (int i = 1; i < path.size(); i++) {
            total += path.get(i - 1).distanceTo(path.get(i));
        }
        if (total == 0)
            return path.get(0);

        double remaining = total / 2;
        for (int i = 1; i < path.size(); i++) {
            Point a = path.get(i - 1);
            Point b = path.get(i);
            double length = a.distanceTo(b);
            if (remaining <= length && length > 0) {
                double t = remaining / length;
                return new Point(a.x + (b.x - a.x) * t, a.y + (b.y - a.y) * t);
            }
            remaining -= length;
        }
        return path.get(path.size() - 1);
    }
}
