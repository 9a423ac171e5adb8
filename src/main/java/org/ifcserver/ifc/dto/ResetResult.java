package org.ifcserver.ifc.dto;

/**
 * {@code ifc_reset_model} 的返回结果。
 *
 * @param discarded             是否丢弃了已有模型
 * @param previousInstanceCount 被丢弃模型的实例数（没有则为 0）
 * @param projectName           新模型的项目名
 * @param instanceCount         新模型的实例数
 */
public record ResetResult(
        boolean discarded,
        int previousInstanceCount,
        String projectName,
        int instanceCount
) {
}
