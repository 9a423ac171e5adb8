package org.ifcserver.ifc.model;

import java.util.Locale;

/**
 * 空间结构元素的组合类型（IfcElementCompositionEnum）。
 */
public enum ElementCompositionType {
    ELEMENT,
    COMPLEX,
    PARTIAL;

    /**
     * 宽松解析：忽略大小写与首尾空白；为空时返回 {@link #ELEMENT}。
     */
    public static ElementCompositionType parse(String value) {
        if (value == null || value.isBlank()) {
            return ELEMENT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("未知的组合类型：" + value + "（可选 ELEMENT/COMPLEX/PARTIAL）", e);
        }
    }
}
