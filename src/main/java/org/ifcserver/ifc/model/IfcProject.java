package org.ifcserver.ifc.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 空间层级的根：持有单位与几何表达上下文。
 */
public class IfcProject extends IfcRoot {

    private final List<IfcGeometry.GeometricRepresentationContext> representationContexts;
    private final IfcResources.UnitAssignment unitsInContext;

    public IfcProject(String globalId, IfcResources.OwnerHistory ownerHistory, String name,
                      List<IfcGeometry.GeometricRepresentationContext> representationContexts,
                      IfcResources.UnitAssignment unitsInContext) {
        super(globalId, ownerHistory, name, null);
        this.representationContexts = List.copyOf(representationContexts);
        this.unitsInContext = unitsInContext;
    }

    public List<IfcGeometry.GeometricRepresentationContext> getRepresentationContexts() {
        return representationContexts;
    }

    public IfcResources.UnitAssignment getUnitsInContext() {
        return unitsInContext;
    }

    @Override
    public String stepType() {
        return "IFCPROJECT";
    }

    @Override
    public List<Object> stepArguments() {
        return Arrays.asList(getGlobalId(), getOwnerHistory(), getName(), getDescription(), null, null, null,
                new ArrayList<Object>(representationContexts), unitsInContext);
    }
}
