package org.ifcserver.ifc.model;

import java.util.Arrays;
import java.util.List;

public class IfcBuilding extends IfcSpatialStructureElement {

    public IfcBuilding(String globalId, IfcResources.OwnerHistory ownerHistory, String name,
                       IfcGeometry.LocalPlacement objectPlacement, ElementCompositionType compositionType) {
        super(globalId, ownerHistory, name, null, objectPlacement, null, compositionType);
    }

    @Override
    public String stepType() {
        return "IFCBUILDING";
    }

    @Override
    public List<Object> stepArguments() {
        return Arrays.asList(getGlobalId(), getOwnerHistory(), getName(), getDescription(), null,
                getObjectPlacement(), getRepresentation(), getLongName(), getCompositionType(), null, null, null);
    }
}
