package org.ifcserver.ifc.dto;

import org.ifcserver.ifc.step.IfcFileSummary;

/**
 * {@code ifc_read_model_file} 的返回结果。
 *
 * @param path      读取的文件（绝对路径，'/' 分隔）
 * @param sizeBytes 文件大小
 * @param summary   文件摘要
 */
public record ModelFileInfoResult(
        String path,
        long sizeBytes,
        IfcFileSummary summary
) {
}
