package org.ifcserver.ifc.model;

import java.util.Arrays;
import java.util.List;

/**
 * 本模型用到的关系实体：聚合分解、空间包含、材料关联、空间边界。
 */
public final class IfcRelations {

    private IfcRelations() {
    }

    public enum PhysicalOrVirtual {
        PHYSICAL,
        VIRTUAL,
        NOTDEFINED
    }

    public enum InternalOrExternal {
        INTERNAL,
        EXTERNAL,
        NOTDEFINED
    }

    /**
     * 空间分解：项目→建筑、建筑→楼层、楼层→空间。每个 relating 对象只使用一个聚合关系。
     */
    public static final class Aggregates extends IfcRelationship<IfcRoot> {

        private final IfcRoot relatingObject;

        public Aggregates(String globalId, IfcResources.OwnerHistory ownerHistory, IfcRoot relatingObject) {
            super(globalId, ownerHistory);
            this.relatingObject = relatingObject;
        }

        public IfcRoot getRelatingObject() {
            return relatingObject;
        }

        @Override
        public String stepType() {
            return "IFCRELAGGREGATES";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(getGlobalId(), getOwnerHistory(), getName(), getDescription(), relatingObject,
                    relatedAsArgument());
        }
    }

    public static final class ContainedInSpatialStructure extends IfcRelationship<IfcProduct> {

        private final IfcSpatialStructureElement relatingStructure;

        public ContainedInSpatialStructure(String globalId, IfcResources.OwnerHistory ownerHistory,
                                           IfcSpatialStructureElement relatingStructure) {
            super(globalId, ownerHistory);
            this.relatingStructure = relatingStructure;
        }

        public IfcSpatialStructureElement getRelatingStructure() {
            return relatingStructure;
        }

        @Override
        public String stepType() {
            return "IFCRELCONTAINEDINSPATIALSTRUCTURE";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(getGlobalId(), getOwnerHistory(), getName(), getDescription(), relatedAsArgument(),
                    relatingStructure);
        }
    }

    public static final class AssociatesMaterial extends IfcRelationship<IfcProduct> {

        private final IfcEntity relatingMaterial;

        public AssociatesMaterial(String globalId, IfcResources.OwnerHistory ownerHistory, IfcEntity relatingMaterial) {
            super(globalId, ownerHistory);
            this.relatingMaterial = relatingMaterial;
        }

        public IfcEntity getRelatingMaterial() {
            return relatingMaterial;
        }

        @Override
        public String stepType() {
            return "IFCRELASSOCIATESMATERIAL";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(getGlobalId(), getOwnerHistory(), getName(), getDescription(), relatedAsArgument(),
                    relatingMaterial);
        }
    }

    /**
     * 空间边界：非所有权的关联，一面墙可以界定多个空间，反之亦然。
     */
    public static final class SpaceBoundary extends IfcRoot {

        private final IfcSpace relatingSpace;
        private final IfcProduct relatedBuildingElement;
        private final PhysicalOrVirtual physicalOrVirtualBoundary;
        private final InternalOrExternal internalOrExternalBoundary;

        public SpaceBoundary(String globalId, IfcResources.OwnerHistory ownerHistory, IfcSpace relatingSpace,
                             IfcProduct relatedBuildingElement) {
            super(globalId, ownerHistory, null, null);
            this.relatingSpace = relatingSpace;
            this.relatedBuildingElement = relatedBuildingElement;
            this.physicalOrVirtualBoundary = PhysicalOrVirtual.PHYSICAL;
            this.internalOrExternalBoundary = InternalOrExternal.NOTDEFINED;
        }

        public IfcSpace getRelatingSpace() {
            return relatingSpace;
        }

        public IfcProduct getRelatedBuildingElement() {
            return relatedBuildingElement;
        }

        @Override
        public String stepType() {
            return "IFCRELSPACEBOUNDARY";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(getGlobalId(), getOwnerHistory(), getName(), getDescription(), relatingSpace,
                    relatedBuildingElement, null, physicalOrVirtualBoundary, internalOrExternalBoundary);
        }
    }
}
