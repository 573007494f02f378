package com.processlayout.reposition;

import java.util.ArrayList;
import java.util.List;

import com.processlayout.reposition.model.Bounds;
import com.processlayout.reposition.model.Point;

/**
 * Orthogonal waypoint computation from final endpoint geometry.
 *
 * Every method is a pure function of its arguments, so routing unchanged
 * endpoints again yields the same waypoints. Returned lists contain both
 * end points and never two consecutive equal points.
 */
public class ConnectionRouter {

    /** Clearance below the lowest node a back-edge detours around */
    public static final double BACK_EDGE_MARGIN = 30;
    /** Extra vertical offset between parallel back-edge detours */
    public static final double BACK_EDGE_STAGGER = 15;

    private static final double ALIGNMENT_TOLERANCE = 1;

    // ═══════════════════════════════════════════════════════════════════════
    // Sequence flows
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Left-to-right edge. Straight when both centers share a row, otherwise
     * an L leaving a split from its top or bottom vertex, an L entering a
     * join from its top or bottom vertex, or a Z bending halfway between
     * the two shapes.
     */
    public List<Point> routeForward(Bounds source, Bounds target, boolean sourceIsSplit, boolean targetIsJoin) {
        double sy = source.getCenterY();
        double ty = target.getCenterY();

        if (target.x < source.getRight()) {
            return routeVertical(source, target);
        }
        if (Math.abs(sy - ty) < ALIGNMENT_TOLERANCE) {
            return points(source.getRight(), sy, target.x, sy);
        }
        boolean down = ty > sy;
        if (sourceIsSplit) {
            double sx = source.getCenterX();
            return points(sx, down ? source.getBottom() : source.y, sx, ty, target.x, ty);
        }
        if (targetIsJoin) {
            double tx = target.getCenterX();
            return points(source.getRight(), sy, tx, sy, tx, down ? target.y : target.getBottom());
        }
        double midX = (source.getRight() + target.x) / 2;
        return points(source.getRight(), sy, midX, sy, midX, ty, target.x, ty);
    }

    /**
     * Loop edge running right to left: down from the source, along
     * {@code detourY}, and up into the target's bottom.
     */
    public List<Point> routeBackEdge(Bounds source, Bounds target, double detourY) {
        double sx = source.getCenterX();
        double tx = target.getCenterX();
        return points(sx, source.getBottom(), sx, detourY, tx, detourY, tx, target.getBottom());
    }

    /** From a boundary event down and then right into the first exception chain node. */
    public List<Point> routeException(Bounds boundary, Bounds target) {
        double bx = boundary.getCenterX();
        double ty = target.getCenterY();
        if (target.x > bx && ty > boundary.getBottom()) {
            return points(bx, boundary.getBottom(), bx, ty, target.x, ty);
        }
        return routeForward(boundary, target, false, false);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Cross-container and artifact edges
    // ═══════════════════════════════════════════════════════════════════════

    /** Message flows and other edges between containers: vertical first. */
    public List<Point> routeCrossContainer(Bounds source, Bounds target) {
        if (target.y >= source.getBottom() || target.getBottom() <= source.y) {
            return routeVertical(source, target);
        }
        return routeForward(source, target, false, false);
    }

    /** Straight segment between the two shapes' borders along the line of centers. */
    public List<Point> routeAssociation(Bounds source, Bounds target) {
        Point from = clipToBorder(source, target.getCenter());
        Point to = clipToBorder(target, source.getCenter());
        return simplify(List.of(from, to));
    }

    private List<Point> routeVertical(Bounds source, Bounds target) {
        double sx = source.getCenterX();
        double tx = target.getCenterX();
        boolean down = target.getCenterY() >= source.getCenterY();
        double startY = down ? source.getBottom() : source.y;
        double endY = down ? target.y : target.getBottom();
        double midY = (startY + endY) / 2;
        return points(sx, startY, sx, midY, tx, midY, tx, endY);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Geometry helpers
    // ═══════════════════════════════════════════════════════════════════════

    /** Point where the ray from the center of {@code shape} towards {@code toward} leaves the shape. */
    static Point clipToBorder(Bounds shape, Point toward) {
        double cx = shape.getCenterX();
        double cy = shape.getCenterY();
        double dx = toward.x - cx;
        double dy = toward.y - cy;
        if (dx == 0 && dy == 0)
            return new Point(cx, cy);
        double scaleX = dx == 0 ? Double.MAX_VALUE : (shape.width / 2) / Math.abs(dx);
        double scaleY = dy == 0 ? Double.MAX_VALUE : (shape.height / 2) / Math.abs(dy);
        double scale = Math.min(1, Math.min(scaleX, scaleY));
        return new Point(cx + dx * scale, cy + dy * scale);
    }

    private static List<Point> points(double... coordinates) {
        List<Point> result = new ArrayList<>();
        for (int i = 0; i + 1 < coordinates.length; i += 2) {
            result.add(new Point(coordinates[i], coordinates[i + 1]));
        }
        return simplify(result);
    }

    /** Drops repeated points and middle points of collinear runs. */
    static List<Point> simplify(List<Point> input) {
        List<Point> result = new ArrayList<>();
        for (Point p : input) {
            if (!result.isEmpty() && result.get(result.size() - 1).equals(p))
                continue;
            if (result.size() >= 2) {
                Point a = result.get(result.size() - 2);
                Point b = result.get(result.size() - 1);
                if ((a.x == b.x && b.x == p.x) || (a.y == b.y && b.y == p.y)) {
                    result.set(result.size() - 1, p);
                    continue;
                }
            }
            result.add(p);
        }
        return result;
    }
}
