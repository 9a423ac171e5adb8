package org.ifcserver.ifc.model;

import java.util.List;

/**
 * IFC 实体的最小抽象：只描述“如何写成一条 STEP 实例语句”。
 * <p>
 * 约定：
 * <ul>
 *   <li>{@link #stepType()} 返回大写的 STEP 实体名（例如 {@code IFCWALLSTANDARDCASE}）。</li>
 *   <li>{@link #stepArguments()} 按 IFC4 属性顺序返回参数值；取值类型见 {@link StepValues}。</li>
 *   <li>实体本身不持有 {@code #label}：标签由 {@link IfcModel} 在注册时分配，保证“先注册、后引用”。</li>
 * </ul>
 */
public interface IfcEntity {

    String stepType();

    List<Object> stepArguments();
}
