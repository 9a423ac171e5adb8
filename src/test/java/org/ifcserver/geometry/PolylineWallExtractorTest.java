package org.ifcserver.geometry;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PolylineWallExtractorTest {

    private final PolylineWallExtractor extractor = new PolylineWallExtractor(WallDimensions.DEFAULT);

    @Test
    void extract_twoLineSegmentsGiveMidpointDirectionAndLength() {
        Polyline polyline = new Polyline(List.of(
                PolylineVertex.of(0, 0),
                PolylineVertex.of(10, 0),
                PolylineVertex.of(10, 5)
        ), false);

        List<SegmentOutcome> outcomes = extractor.extract(polyline);

        assertThat(outcomes).hasSize(3);
        SegmentOutcome.WallRequest a = (SegmentOutcome.WallRequest) outcomes.get(0);
        assertThat(a.posX()).isCloseTo(5.0, within(1e-12));
        assertThat(a.posY()).isCloseTo(0.0, within(1e-12));
        assertThat(a.dirX()).isCloseTo(1.0, within(1e-12));
        assertThat(a.dirY()).isCloseTo(0.0, within(1e-12));
        assertThat(a.length()).isCloseTo(10.0, within(1e-12));
        assertThat(a.width()).isEqualTo(0.5);
        assertThat(a.height()).isEqualTo(2.0);

        SegmentOutcome.WallRequest b = (SegmentOutcome.WallRequest) outcomes.get(1);
        assertThat(b.posX()).isCloseTo(10.0, within(1e-12));
        assertThat(b.posY()).isCloseTo(2.5, within(1e-12));
        assertThat(b.dirX()).isCloseTo(0.0, within(1e-12));
        assertThat(b.dirY()).isCloseTo(1.0, within(1e-12));
        assertThat(b.length()).isCloseTo(5.0, within(1e-12));

        SegmentOutcome.SkippedSegment end = (SegmentOutcome.SkippedSegment) outcomes.get(2);
        assertThat(end.type()).isEqualTo(SegmentType.POINT);
        assertThat(end.diagnostics().get(0)).isEqualTo("Segment 2 : end of open polyline");
    }

    @Test
    void extract_arcAndZeroLengthSegmentsProduceNoWallRequests() {
        Polyline polyline = new Polyline(List.of(
                PolylineVertex.of(0, 0, 1),
                PolylineVertex.of(2, 0),
                PolylineVertex.of(2, 0)
        ), false);

        List<SegmentOutcome> outcomes = extractor.extract(polyline);

        assertThat(outcomes).noneMatch(o -> o instanceof SegmentOutcome.WallRequest);
        SegmentOutcome.UnsupportedArc arc = (SegmentOutcome.UnsupportedArc) outcomes.get(0);
        assertThat(arc.arc().radius()).isCloseTo(1.0, within(1e-12));
        assertThat(arc.diagnostics()).anyMatch(line -> line.startsWith("Radius:"));
        assertThat(arc.diagnostics()).anyMatch(line -> line.startsWith("Center:"));

        SegmentOutcome.SkippedSegment zero = (SegmentOutcome.SkippedSegment) outcomes.get(1);
        assertThat(zero.type()).isEqualTo(SegmentType.COINCIDENT);
        assertThat(zero.reason()).isEqualTo("zero length segment");
    }

    @Test
    void extract_closedPolylineGivesOneWallPerEdge() {
        Polyline square = new Polyline(List.of(
                PolylineVertex.of(0, 0),
                PolylineVertex.of(4, 0),
                PolylineVertex.of(4, 4),
                PolylineVertex.of(0, 4)
        ), true);

        List<SegmentOutcome> outcomes = extractor.extract(square);

        assertThat(outcomes).allMatch(o -> o instanceof SegmentOutcome.WallRequest);
        SegmentOutcome.WallRequest closing = (SegmentOutcome.WallRequest) outcomes.get(3);
        assertThat(closing.posX()).isCloseTo(0.0, within(1e-12));
        assertThat(closing.posY()).isCloseTo(2.0, within(1e-12));
        assertThat(closing.dirY()).isCloseTo(-1.0, within(1e-12));
    }

    @Test
    void extract_usesConfiguredDimensions() {
        PolylineWallExtractor custom = new PolylineWallExtractor(new WallDimensions(0.3, 3.2));
        Polyline polyline = new Polyline(List.of(PolylineVertex.of(0, 0), PolylineVertex.of(3, 4)), false);

        SegmentOutcome.WallRequest wall = (SegmentOutcome.WallRequest) custom.extract(polyline).get(0);

        assertThat(wall.width()).isEqualTo(0.3);
        assertThat(wall.height()).isEqualTo(3.2);
        assertThat(wall.length()).isCloseTo(5.0, within(1e-12));
        assertThat(wall.dirX()).isCloseTo(0.6, within(1e-12));
        assertThat(wall.dirY()).isCloseTo(0.8, within(1e-12));
    }
}
