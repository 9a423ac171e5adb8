package org.ifcserver.geometry;

/**
 * 直线段。
 */
public record LineSegment(Point2d start, Point2d end) {

    public double length() {
        return start.distanceTo(end);
    }

    public Point2d midPoint() {
        return start.midpoint(end);
    }

    /**
     * 单位方向向量；零长度线段返回 (0, 0)。
     */
    public Point2d direction() {
        double length = length();
        if (length == 0) {
            return Point2d.ORIGIN;
        }
        return new Point2d((end.x() - start.x()) / length, (end.y() - start.y()) / length);
    }
}
