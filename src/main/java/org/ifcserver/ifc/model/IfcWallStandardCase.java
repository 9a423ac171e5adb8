package org.ifcserver.ifc.model;

import java.util.Arrays;
import java.util.List;

/**
 * 标准墙。IFC 规则要求标准墙通过材料关联携带 {@link IfcResources.MaterialLayerSetUsage}。
 */
public class IfcWallStandardCase extends IfcProduct {

    public IfcWallStandardCase(String globalId, IfcResources.OwnerHistory ownerHistory, String name,
                               IfcGeometry.LocalPlacement objectPlacement,
                               IfcGeometry.ProductDefinitionShape representation) {
        super(globalId, ownerHistory, name, null, objectPlacement, representation);
    }

    @Override
    public String stepType() {
        return "IFCWALLSTANDARDCASE";
    }

    @Override
    public List<Object> stepArguments() {
        return Arrays.asList(getGlobalId(), getOwnerHistory(), getName(), getDescription(), null,
                getObjectPlacement(), getRepresentation(), null, null);
    }
}
