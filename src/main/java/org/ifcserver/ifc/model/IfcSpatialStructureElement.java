package org.ifcserver.ifc.model;

/**
 * 空间结构元素（建筑、楼层、空间）的公共部分：长名称与组合类型。
 */
public abstract class IfcSpatialStructureElement extends IfcProduct {

    private final String longName;
    private final ElementCompositionType compositionType;

    protected IfcSpatialStructureElement(String globalId, IfcResources.OwnerHistory ownerHistory, String name,
                                         String description, IfcGeometry.LocalPlacement objectPlacement,
                                         String longName, ElementCompositionType compositionType) {
        super(globalId, ownerHistory, name, description, objectPlacement, null);
        this.longName = longName;
        this.compositionType = compositionType;
    }

    public String getLongName() {
        return longName;
    }

    public ElementCompositionType getCompositionType() {
        return compositionType;
    }
}
