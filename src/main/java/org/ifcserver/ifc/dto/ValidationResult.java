package org.ifcserver.ifc.dto;

import java.util.List;

/**
 * {@code ifc_validate_model} 的返回结果。
 *
 * @param valid      违规数为 0 时为 true
 * @param errorCount 违规数
 * @param violations 违规明细
 */
public record ValidationResult(
        boolean valid,
        int errorCount,
        List<ViolationEntry> violations
) {
}
