package org.ifcserver.geometry;

/**
 * 由凸度定义的圆弧段。
 *
 * @param start  起点
 * @param end    终点
 * @param center 圆心
 * @param radius 半径（正数）
 * @param bulge  凸度
 */
public record ArcSegment(Point2d start, Point2d end, Point2d center, double radius, double bulge) {

    /**
     * 由弦端点与凸度计算圆弧：圆心角 {@code 4·atan(bulge)}，半径 {@code chord / (2·sin(angle/2))}。
     * 正凸度为逆时针，圆心位于弦方向的左侧（|bulge| &lt; 1 时）。
     */
    public static ArcSegment fromBulge(Point2d start, Point2d end, double bulge) {
        if (bulge == 0) {
            throw new IllegalArgumentException("凸度为 0 的线段不是圆弧");
        }
        double chord = start.distanceTo(end);
        if (chord == 0) {
            throw new IllegalArgumentException("零长度弦无法构成圆弧");
        }
        double angle = 4.0 * Math.atan(bulge);
        double radius = Math.abs(chord / (2.0 * Math.sin(angle / 2.0)));

        // 圆心到弦中点的有向距离（沿弦的左法向）
        double offset = chord * (1.0 - bulge * bulge) / (4.0 * bulge);
        double nx = -(end.y() - start.y()) / chord;
        double ny = (end.x() - start.x()) / chord;
        Point2d mid = start.midpoint(end);
        Point2d center = new Point2d(mid.x() + nx * offset, mid.y() + ny * offset);
        return new ArcSegment(start, end, center, radius, bulge);
    }

    /**
     * 圆心角（弧度，带符号）。
     */
    public double includedAngle() {
        return 4.0 * Math.atan(bulge);
    }
}
