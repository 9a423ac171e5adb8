package org.ifcserver.geometry;

import java.util.List;

/**
 * 单个多段线线段的提取结果：要么是一次建墙请求，要么是带原因的跳过。
 */
public sealed interface SegmentOutcome
        permits SegmentOutcome.WallRequest, SegmentOutcome.UnsupportedArc, SegmentOutcome.SkippedSegment {

    int index();

    List<String> diagnostics();

    /**
     * 直线段对应的建墙参数：放置在线段中点，参考方向为线段单位方向，长度为线段长度。
     */
    record WallRequest(
            int index,
            double posX,
            double posY,
            double dirX,
            double dirY,
            double length,
            double width,
            double height,
            List<String> diagnostics
    ) implements SegmentOutcome {
        public WallRequest {
            diagnostics = List.copyOf(diagnostics);
        }
    }

    /**
     * 圆弧段：几何已计算，但不会生成墙体。
     */
    record UnsupportedArc(
            int index,
            ArcSegment arc,
            double startWidth,
            double endWidth,
            List<String> diagnostics
    ) implements SegmentOutcome {
        public UnsupportedArc {
            diagnostics = List.copyOf(diagnostics);
        }
    }

    /**
     * 零长度线段或没有后继顶点的端点。
     */
    record SkippedSegment(
            int index,
            SegmentType type,
            String reason,
            List<String> diagnostics
    ) implements SegmentOutcome {
        public SkippedSegment {
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
