package org.ifcserver.ifc.model;

/**
 * 具有空间位置（placement）与可选形体表达（representation）的对象。
 */
public abstract class IfcProduct extends IfcRoot {

    private final IfcGeometry.LocalPlacement objectPlacement;
    private final IfcGeometry.ProductDefinitionShape representation;

    protected IfcProduct(String globalId, IfcResources.OwnerHistory ownerHistory, String name, String description,
                         IfcGeometry.LocalPlacement objectPlacement, IfcGeometry.ProductDefinitionShape representation) {
        super(globalId, ownerHistory, name, description);
        this.objectPlacement = objectPlacement;
        this.representation = representation;
    }

    public IfcGeometry.LocalPlacement getObjectPlacement() {
        return objectPlacement;
    }

    public IfcGeometry.ProductDefinitionShape getRepresentation() {
        return representation;
    }
}
