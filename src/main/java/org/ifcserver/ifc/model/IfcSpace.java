package org.ifcserver.ifc.model;

import java.util.Arrays;
import java.util.List;

public class IfcSpace extends IfcSpatialStructureElement {

    public IfcSpace(String globalId, IfcResources.OwnerHistory ownerHistory, String name, String description,
                    String longName, ElementCompositionType compositionType) {
        super(globalId, ownerHistory, name, description, null, longName, compositionType);
    }

    @Override
    public String stepType() {
        return "IFCSPACE";
    }

    @Override
    public List<Object> stepArguments() {
        return Arrays.asList(getGlobalId(), getOwnerHistory(), getName(), getDescription(), null,
                getObjectPlacement(), getRepresentation(), getLongName(), getCompositionType(), null, null);
    }
}
