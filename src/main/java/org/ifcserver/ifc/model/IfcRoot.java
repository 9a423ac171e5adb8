package org.ifcserver.ifc.model;

import java.util.Objects;

/**
 * 所有“有身份”的 IFC 实体（对象、关系）的基类：GlobalId + 归属历史 + 名称/描述。
 * <p>
 * 与 {@link IfcGeometry} 中的值型实体不同，这些实体按引用比较（同名实体也是不同对象）。
 */
public abstract class IfcRoot implements IfcEntity {

    private final String globalId;
    private final IfcResources.OwnerHistory ownerHistory;
    private final String name;
    private final String description;

    protected IfcRoot(String globalId, IfcResources.OwnerHistory ownerHistory, String name, String description) {
        this.globalId = Objects.requireNonNull(globalId, "globalId");
        this.ownerHistory = ownerHistory;
        this.name = name;
        this.description = description;
    }

    public String getGlobalId() {
        return globalId;
    }

    public IfcResources.OwnerHistory getOwnerHistory() {
        return ownerHistory;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return stepType() + "[" + globalId + ", name=" + name + "]";
    }
}
