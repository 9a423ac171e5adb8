package org.ifcserver.ifc.model;

/**
 * 模型状态不满足操作前置条件（缺少项目/建筑/楼层、事务嵌套、事务外修改等）。
 */
public class InvalidModelStateException extends IllegalStateException {

    public InvalidModelStateException(String message) {
        super(message);
    }
}
