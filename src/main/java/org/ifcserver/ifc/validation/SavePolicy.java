package org.ifcserver.ifc.validation;

/**
 * 保存策略。
 */
public enum SavePolicy {
    /**
     * 仅当校验通过时写出 {@code .ifc} 文件。
     */
    VALIDATE_THEN_SAVE,
    /**
     * 总是写出 {@code .ifc} 文件，并在旁边写出 {@code .ifc.validation.txt} 校验报告。
     */
    SAVE_WITH_REPORT
}
