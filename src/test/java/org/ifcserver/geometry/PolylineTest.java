package org.ifcserver.geometry;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PolylineTest {

    @Test
    void segmentType_classifiesLinesArcsCoincidentAndEndPoint() {
        Polyline polyline = new Polyline(List.of(
                PolylineVertex.of(0, 0),
                PolylineVertex.of(10, 0, 1),
                PolylineVertex.of(20, 0),
                PolylineVertex.of(20, 0)
        ), false);

        assertThat(polyline.segmentType(0)).isEqualTo(SegmentType.LINE);
        assertThat(polyline.segmentType(1)).isEqualTo(SegmentType.ARC);
        assertThat(polyline.segmentType(2)).isEqualTo(SegmentType.COINCIDENT);
        assertThat(polyline.segmentType(3)).isEqualTo(SegmentType.POINT);
    }

    @Test
    void closedPolyline_lastSegmentReturnsToFirstVertex() {
        Polyline polyline = new Polyline(List.of(
                PolylineVertex.of(0, 0),
                PolylineVertex.of(4, 0),
                PolylineVertex.of(4, 3)
        ), true);

        LineSegment closing = polyline.lineSegmentAt(2);
        assertThat(closing.start()).isEqualTo(new Point2d(4, 3));
        assertThat(closing.end()).isEqualTo(new Point2d(0, 0));
        assertThat(closing.length()).isCloseTo(5.0, within(1e-12));
    }

    @Test
    void arcSegmentAt_semicircleFromBulgeOne() {
        Polyline polyline = new Polyline(List.of(
                PolylineVertex.of(0, 0, 1),
                PolylineVertex.of(2, 0)
        ), false);

        ArcSegment arc = polyline.arcSegmentAt(0);

        assertThat(arc.radius()).isCloseTo(1.0, within(1e-12));
        assertThat(arc.center().x()).isCloseTo(1.0, within(1e-12));
        assertThat(arc.center().y()).isCloseTo(0.0, within(1e-12));
        assertThat(arc.includedAngle()).isCloseTo(Math.PI, within(1e-12));
    }

    @Test
    void arcFromBulge_quarterCircleCenterIsLeftOfChordForPositiveBulge() {
        // 90° 逆时针圆弧：bulge = tan(90°/4)
        double bulge = Math.tan(Math.PI / 8);
        ArcSegment arc = ArcSegment.fromBulge(new Point2d(1, 0), new Point2d(0, 1), bulge);

        assertThat(arc.radius()).isCloseTo(1.0, within(1e-9));
        assertThat(arc.center().x()).isCloseTo(0.0, within(1e-9));
        assertThat(arc.center().y()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void wrongSegmentAccessorFails() {
        Polyline polyline = new Polyline(List.of(PolylineVertex.of(0, 0), PolylineVertex.of(1, 0)), false);

        assertThatThrownBy(() -> polyline.arcSegmentAt(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> polyline.lineSegmentAt(1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> polyline.segmentType(2)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void constructor_rejectsTooFewOrNonFiniteVertices() {
        assertThatThrownBy(() -> new Polyline(List.of(PolylineVertex.of(0, 0)), false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Polyline(List.of(PolylineVertex.of(0, 0), PolylineVertex.of(Double.NaN, 0)), false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
