package org.ifcserver.ifc.dto;

/**
 * 建筑/楼层/墙/空间创建工具的返回结果。
 *
 * @param globalId       新实体的 GlobalId
 * @param type           STEP 类型名
 * @param name           名称
 * @param label          STEP 实例标签
 * @param parentGlobalId 所挂接父对象的 GlobalId
 * @param instanceCount  创建后模型的实例总数
 */
public record EntityCreatedResult(
        String globalId,
        String type,
        String name,
        int label,
        String parentGlobalId,
        int instanceCount
) {
}
