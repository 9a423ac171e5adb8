package org.ifcserver.ifc.model;

import java.util.Arrays;
import java.util.List;

/**
 * 楼层；{@code elevation} 相对于所属建筑的原点。
 */
public class IfcBuildingStorey extends IfcSpatialStructureElement {

    private final double elevation;

    public IfcBuildingStorey(String globalId, IfcResources.OwnerHistory ownerHistory, String name, double elevation) {
        super(globalId, ownerHistory, name, null, null, null, null);
        this.elevation = elevation;
    }

    public double getElevation() {
        return elevation;
    }

    @Override
    public String stepType() {
        return "IFCBUILDINGSTOREY";
    }

    @Override
    public List<Object> stepArguments() {
        return Arrays.asList(getGlobalId(), getOwnerHistory(), getName(), getDescription(), null,
                getObjectPlacement(), getRepresentation(), getLongName(), getCompositionType(), elevation);
    }
}
