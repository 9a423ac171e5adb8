package org.ifcserver.ifc.model;

/**
 * STEP 参数值的辅助类型。
 * <p>
 * {@link IfcEntity#stepArguments()} 中允许出现的值：
 * <ul>
 *   <li>{@code null}：写为 {@code $}（可选属性未赋值）</li>
 *   <li>{@link #DERIVED}：写为 {@code *}（派生属性）</li>
 *   <li>{@link String}：字符串字面量（非 ASCII 字符按 {@code \X2\...\X0\} 转义）</li>
 *   <li>{@link Double}/{@link Integer}/{@link Long}：实数/整数</li>
 *   <li>{@link Boolean}：{@code .T.}/{@code .F.}</li>
 *   <li>{@link Enum}：枚举 {@code .NAME.}</li>
 *   <li>{@link IfcEntity}：实例引用 {@code #label}</li>
 *   <li>{@link java.util.List}：聚合 {@code (a,b,c)}</li>
 *   <li>{@link Typed}：带类型的 select 值，例如 {@code IFCLABEL('x')}</li>
 * </ul>
 */
public final class StepValues {

    public static final Object DERIVED = new Object() {
        @Override
        public String toString() {
            return "*";
        }
    };

    private StepValues() {
    }

    public static Typed typed(String typeName, Object value) {
        return new Typed(typeName, value);
    }

    public record Typed(String typeName, Object value) {
    }
}
