package org.ifcserver.ifc.validation;

import java.nio.file.Path;

/**
 * {@link IfcModelPersister#validateAndSave} 的结果。
 *
 * @param saved      是否写出了 {@code .ifc} 文件
 * @param file       目标文件路径（未写出时也会给出，便于提示）
 * @param reportFile 校验报告文件；仅 {@link SavePolicy#SAVE_WITH_REPORT} 时非空
 * @param bytes      写出的字节数；未写出为 0
 * @param policy     生效的保存策略
 * @param report     内存模型与序列化文本的合并校验报告
 */
public record SaveOutcome(
        boolean saved,
        Path file,
        Path reportFile,
        long bytes,
        SavePolicy policy,
        ValidationReport report
) {
}
