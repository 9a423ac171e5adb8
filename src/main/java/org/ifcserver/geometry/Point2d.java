package org.ifcserver.geometry;

import java.util.Locale;

/**
 * 平面点 / 向量。
 */
public record Point2d(double x, double y) {

    public static final Point2d ORIGIN = new Point2d(0, 0);

    public double distanceTo(Point2d other) {
        return Math.hypot(other.x - x, other.y - y);
    }

    public Point2d midpoint(Point2d other) {
        return new Point2d((x + other.x) / 2.0, (y + other.y) / 2.0);
    }

    public boolean isEqualTo(Point2d other, double tolerance) {
        return distanceTo(other) <= tolerance;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%s, %s)", x, y);
    }
}
