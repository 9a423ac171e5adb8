package org.ifcserver.ifc.dto;

import java.util.List;

/**
 * {@code ifc_model_status} 的返回结果。
 *
 * @param projectName       项目名
 * @param projectGlobalId   IfcProject 的 GlobalId
 * @param schema            模式标识（IFC4）
 * @param instanceCount     已注册实例数
 * @param activeTransaction 进行中的事务名（无则为 null）
 * @param buildings         建筑/楼层层级
 * @param outputFile        保存目标文件
 * @param savePolicy        保存策略
 */
public record ModelStatusResult(
        String projectName,
        String projectGlobalId,
        String schema,
        int instanceCount,
        String activeTransaction,
        List<BuildingInfo> buildings,
        String outputFile,
        String savePolicy
) {
}
