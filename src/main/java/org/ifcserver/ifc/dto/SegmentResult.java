package org.ifcserver.ifc.dto;

import java.util.List;

/**
 * 单个线段的处理结果。
 *
 * @param index       线段索引（起点顶点索引）
 * @param outcome     WALL / UNSUPPORTED_ARC / SKIPPED
 * @param reason      跳过原因（WALL 为 null）
 * @param diagnostics 诊断输出
 */
public record SegmentResult(
        int index,
        String outcome,
        String reason,
        List<String> diagnostics
) {
}
