package org.ifcserver.ifc.validation;

/**
 * 一条校验违规。
 *
 * @param label      实例标签（{@code #label}）；与具体实例无关的违规为 0
 * @param entityType STEP 实体类型名（大写）
 * @param rule       违反的规则
 * @param message    可读说明
 */
public record ValidationViolation(
        int label,
        String entityType,
        ValidationRule rule,
        String message
) {

    public String toLine() {
        String where = label > 0 ? "#" + label + " " : "";
        return "[" + rule + "] " + where + entityType + ": " + message;
    }
}
