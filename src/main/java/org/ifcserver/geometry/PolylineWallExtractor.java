package org.ifcserver.geometry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 把多段线逐段转换为建墙请求。
 * <p>
 * 每个顶点索引产生一个结果（与顶点数相同）：
 * <ul>
 *   <li>直线段：{@link SegmentOutcome.WallRequest}，宽高取 {@link WallDimensions}；</li>
 *   <li>圆弧段：{@link SegmentOutcome.UnsupportedArc}，只输出几何诊断；</li>
 *   <li>零长度线段 / 开放多段线末端：{@link SegmentOutcome.SkippedSegment}。</li>
 * </ul>
 * 不支持的线段不会抛异常，后续线段继续处理。
 */
public class PolylineWallExtractor {

    private final WallDimensions dimensions;

    public PolylineWallExtractor(WallDimensions dimensions) {
        this.dimensions = Objects.requireNonNull(dimensions, "dimensions");
    }

    public WallDimensions getDimensions() {
        return dimensions;
    }

    public List<SegmentOutcome> extract(Polyline polyline) {
        List<SegmentOutcome> out = new ArrayList<>(polyline.numberOfVertices());
        for (int i = 0; i < polyline.numberOfVertices(); i++) {
            out.add(extractSegment(polyline, i));
        }
        return out;
    }

    public SegmentOutcome extractSegment(Polyline polyline, int index) {
        PolylineVertex vertex = polyline.vertexAt(index);
        SegmentType type = polyline.segmentType(index);
        return switch (type) {
            case LINE -> {
                LineSegment line = polyline.lineSegmentAt(index);
                Point2d mid = line.midPoint();
                Point2d dir = line.direction();
                List<String> diagnostics = List.of(
                        "Segment " + index + " - Line -",
                        "Start point:  " + line.start(),
                        "End point:    " + line.end(),
                        "Mid point:    " + mid,
                        "Direction:    " + dir,
                        "Length:       " + line.length());
                yield new SegmentOutcome.WallRequest(index, mid.x(), mid.y(), dir.x(), dir.y(), line.length(),
                        dimensions.width(), dimensions.height(), diagnostics);
            }
            case ARC -> {
                ArcSegment arc = polyline.arcSegmentAt(index);
                List<String> diagnostics = List.of(
                        "Segment " + index + " - Arc - (not converted to a wall)",
                        "Start width:  " + vertex.startWidth(),
                        "End width:    " + vertex.endWidth(),
                        "Bulge:        " + arc.bulge(),
                        "Start point:  " + arc.start(),
                        "End point:    " + arc.end(),
                        "Radius:       " + arc.radius(),
                        "Center:       " + arc.center());
                yield new SegmentOutcome.UnsupportedArc(index, arc, vertex.startWidth(), vertex.endWidth(), diagnostics);
            }
            case COINCIDENT -> skipped(index, type, "zero length segment", vertex);
            case POINT -> skipped(index, type, "end of open polyline", vertex);
        };
    }

    private static SegmentOutcome.SkippedSegment skipped(int index, SegmentType type, String reason, PolylineVertex vertex) {
        List<String> diagnostics = new ArrayList<>();
        diagnostics.add("Segment " + index + " : " + reason);
        diagnostics.add("Start width:  " + vertex.startWidth());
        diagnostics.add("End width:    " + vertex.endWidth());
        diagnostics.add("Bulge:        " + vertex.bulge());
        return new SegmentOutcome.SkippedSegment(index, type, reason, diagnostics);
    }
}
