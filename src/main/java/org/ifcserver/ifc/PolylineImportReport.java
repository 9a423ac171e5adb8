package org.ifcserver.ifc;

import org.ifcserver.geometry.SegmentOutcome;
import org.ifcserver.ifc.validation.SaveOutcome;

import java.util.List;

/**
 * 一次多段线建墙的汇总。
 *
 * @param storeyGlobalId 墙体所在楼层
 * @param outcomes       每个线段的提取结果（与顶点一一对应）
 * @param wallGlobalIds  成功创建的墙体 GlobalId（按线段顺序）
 * @param failures       建墙事务失败的说明（该线段的事务已回滚，其余线段不受影响）
 * @param diagnostics    所有线段的诊断输出
 * @param saveOutcome    未请求保存时为 null
 */
public record PolylineImportReport(
        String storeyGlobalId,
        List<SegmentOutcome> outcomes,
        List<String> wallGlobalIds,
        List<String> failures,
        List<String> diagnostics,
        SaveOutcome saveOutcome
) {

    public int wallsCreated() {
        return wallGlobalIds.size();
    }

    public long arcsSkipped() {
        return outcomes.stream().filter(o -> o instanceof SegmentOutcome.UnsupportedArc).count();
    }

    public long segmentsSkipped() {
        return outcomes.stream().filter(o -> o instanceof SegmentOutcome.SkippedSegment).count();
    }
}
