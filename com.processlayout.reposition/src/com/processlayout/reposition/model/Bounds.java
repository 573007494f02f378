package com.processlayout.reposition.model;

import java.util.Objects;

/**
 * Immutable rectangle in diagram coordinates. (x, y) is the top-left
 * corner; all derived values (center, right, bottom) are computed.
 */
public final class Bounds {

    public final double x;
    public final double y;
    public final double width;
    public final double height;

    public Bounds(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /** Creates bounds of the given size centered on (cx, cy). */
    public static Bounds centeredAt(double cx, double cy, double width, double height) {
        return new Bounds(cx - width / 2, cy - height / 2, width, height);
    }

    public double getCenterX() {
        return x + width / 2;
    }

    public double getCenterY() {
        return y + height / 2;
    }

    public Point getCenter() {
        return new Point(getCenterX(), getCenterY());
    }

    public double getRight() {
        return x + width;
    }

    public double getBottom() {
        return y + height;
    }

    public Bounds translate(double dx, double dy) {
        return new Bounds(x + dx, y + dy, width, height);
    }

    public Bounds withCenter(double cx, double cy) {
        return centeredAt(cx, cy, width, height);
    }

    public Bounds withSize(double newWidth, double newHeight) {
        return new Bounds(x, y, newWidth, newHeight);
    }

    /** Smallest rectangle enclosing both this and {@code other}. */
    public Bounds union(Bounds other) {
        double minX = Math.min(x, other.x);
        double minY = Math.min(y, other.y);
        double maxX = Math.max(getRight(), other.getRight());
        double maxY = Math.max(getBottom(), other.getBottom());
        return new Bounds(minX, minY, maxX - minX, maxY - minY);
    }

    public Bounds expand(double amount) {
        return new Bounds(x - amount, y - amount, width + 2 * amount, height + 2 * amount);
    }

    public boolean contains(double px, double py) {
        return px >= x && px <= getRight() && py >= y && py <= getBottom();
    }

    public boolean intersects(Bounds other) {
        return x < other.getRight() && other.x < getRight()
                && y < other.getBottom() && other.y < getBottom();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Bounds))
            return false;
        Bounds other = (Bounds) o;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0
                && Double.compare(width, other.width) == 0 && Double.compare(height, other.height) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return "Bounds[x=" + x + ", y=" + y + ", w=" + width + ", h=" + height + "]";
    }
}
