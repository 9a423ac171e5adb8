package org.ifcserver.ifc.dto;

import java.util.List;

/**
 * {@code ifc_create_walls_from_polyline} 的返回结果。
 *
 * @param storeyGlobalId  墙体所在楼层
 * @param segmentCount    线段数（等于顶点数）
 * @param wallsCreated    创建的墙体数
 * @param arcsSkipped     未转换的圆弧段数
 * @param segmentsSkipped 跳过的零长度/端点线段数
 * @param wallGlobalIds   新墙体 GlobalId
 * @param segments        每段明细
 * @param failures        建墙失败说明
 * @param save            保存结果（未请求保存时为 null）
 */
public record PolylineWallsResult(
        String storeyGlobalId,
        int segmentCount,
        int wallsCreated,
        int arcsSkipped,
        int segmentsSkipped,
        List<String> wallGlobalIds,
        List<SegmentResult> segments,
        List<String> failures,
        SaveResult save
) {
}
