package org.ifcserver.geometry;

/**
 * 多段线顶点。
 *
 * @param x          X 坐标
 * @param y          Y 坐标
 * @param bulge      凸度：从本顶点出发的线段为圆弧时非 0（圆心角的 1/4 的正切，正值为逆时针）
 * @param startWidth 本顶点处的起始宽度
 * @param endWidth   下一顶点处的结束宽度
 */
public record PolylineVertex(double x, double y, double bulge, double startWidth, double endWidth) {

    public static PolylineVertex of(double x, double y) {
        return new PolylineVertex(x, y, 0, 0, 0);
    }

    public static PolylineVertex of(double x, double y, double bulge) {
        return new PolylineVertex(x, y, bulge, 0, 0);
    }

    public Point2d point() {
        return new Point2d(x, y);
    }
}
