package org.ifcserver.geometry;

import java.util.List;
import java.util.Objects;

/**
 * 二维多段线：有序顶点 + 是否闭合。
 * <p>
 * 线段 {@code i} 从顶点 {@code i} 指向顶点 {@code i+1}；闭合多段线的最后一段回到顶点 0。
 * 因此开放多段线有 {@code n-1} 段有效线段，最后一个顶点的类型为 {@link SegmentType#POINT}。
 */
public final class Polyline {

    /**
     * 判定两点重合的容差。
     */
    public static final double TOLERANCE = 1e-9;

    private final List<PolylineVertex> vertices;
    private final boolean closed;

    public Polyline(List<PolylineVertex> vertices, boolean closed) {
        Objects.requireNonNull(vertices, "vertices");
        if (vertices.size() < 2) {
            throw new IllegalArgumentException("多段线至少需要 2 个顶点，实际为 " + vertices.size());
        }
        for (PolylineVertex v : vertices) {
            if (v == null || !Double.isFinite(v.x()) || !Double.isFinite(v.y()) || !Double.isFinite(v.bulge())) {
                throw new IllegalArgumentException("多段线顶点坐标/凸度必须为有限数值：" + v);
            }
        }
        this.vertices = List.copyOf(vertices);
        this.closed = closed;
    }

    public List<PolylineVertex> getVertices() {
        return vertices;
    }

    public boolean isClosed() {
        return closed;
    }

    public int numberOfVertices() {
        return vertices.size();
    }

    public PolylineVertex vertexAt(int index) {
        return vertices.get(index);
    }

    public SegmentType segmentType(int index) {
        checkIndex(index);
        Integer endIndex = endIndexOf(index);
        if (endIndex == null) {
            return SegmentType.POINT;
        }
        PolylineVertex start = vertices.get(index);
        PolylineVertex end = vertices.get(endIndex);
        if (start.point().isEqualTo(end.point(), TOLERANCE)) {
            return SegmentType.COINCIDENT;
        }
        return start.bulge() != 0 ? SegmentType.ARC : SegmentType.LINE;
    }

    public LineSegment lineSegmentAt(int index) {
        if (segmentType(index) != SegmentType.LINE) {
            throw new IllegalArgumentException("线段 " + index + " 不是直线段：" + segmentType(index));
        }
        return new LineSegment(vertices.get(index).point(), vertices.get(endIndexOf(index)).point());
    }

    public ArcSegment arcSegmentAt(int index) {
        if (segmentType(index) != SegmentType.ARC) {
            throw new IllegalArgumentException("线段 " + index + " 不是圆弧段：" + segmentType(index));
        }
        PolylineVertex start = vertices.get(index);
        return ArcSegment.fromBulge(start.point(), vertices.get(endIndexOf(index)).point(), start.bulge());
    }

    private Integer endIndexOf(int index) {
        if (index + 1 < vertices.size()) {
            return index + 1;
        }
        return closed ? 0 : null;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= vertices.size()) {
            throw new IndexOutOfBoundsException("线段索引越界：" + index + "（顶点数 " + vertices.size() + "）");
        }
    }
}
