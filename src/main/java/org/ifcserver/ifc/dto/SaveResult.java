package org.ifcserver.ifc.dto;

/**
 * {@code ifc_validate_and_save} 的返回结果。
 *
 * @param saved      是否写出了 .ifc 文件
 * @param file       目标文件
 * @param reportFile 校验报告文件（仅 SAVE_WITH_REPORT）
 * @param bytes      写出字节数
 * @param policy     保存策略
 * @param validation 校验结果
 */
public record SaveResult(
        boolean saved,
        String file,
        String reportFile,
        long bytes,
        String policy,
        ValidationResult validation
) {
}
