package org.ifcserver.ifc.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 非几何资源实体：单位、参与者（人员/组织/应用）、归属历史、材料。
 */
public final class IfcResources {

    private IfcResources() {
    }

    public enum UnitType {
        LENGTHUNIT,
        AREAUNIT,
        VOLUMEUNIT,
        PLANEANGLEUNIT,
        TIMEUNIT
    }

    public enum SiPrefix {
        MILLI
    }

    public enum SiUnitName {
        METRE,
        SQUARE_METRE,
        CUBIC_METRE,
        RADIAN,
        SECOND
    }

    public enum ChangeAction {
        NOCHANGE,
        MODIFIED,
        ADDED,
        DELETED,
        NOTDEFINED
    }

    public enum LayerSetDirection {
        AXIS1,
        AXIS2,
        AXIS3
    }

    public enum DirectionSense {
        POSITIVE,
        NEGATIVE
    }

    public record SiUnit(UnitType unitType, SiPrefix prefix, SiUnitName name) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCSIUNIT";
        }

        @Override
        public List<Object> stepArguments() {
            // Dimensions 在 IfcSIUnit 中是派生属性
            return Arrays.asList(StepValues.DERIVED, unitType, prefix, name);
        }
    }

    public record UnitAssignment(List<SiUnit> units) implements IfcEntity {
        public UnitAssignment {
            units = List.copyOf(units);
        }

        @Override
        public String stepType() {
            return "IFCUNITASSIGNMENT";
        }

        @Override
        public List<Object> stepArguments() {
            return List.of(new ArrayList<Object>(units));
        }
    }

    public record Person(String identification, String familyName, String givenName) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCPERSON";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(identification, familyName, givenName, null, null, null, null, null);
        }
    }

    public record Organization(String identification, String name) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCORGANIZATION";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(identification, name, null, null, null);
        }
    }

    public record PersonAndOrganization(Person person, Organization organization) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCPERSONANDORGANIZATION";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(person, organization, null);
        }
    }

    public record Application(Organization applicationDeveloper, String version, String applicationFullName,
                              String applicationIdentifier) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCAPPLICATION";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(applicationDeveloper, version, applicationFullName, applicationIdentifier);
        }
    }

    /**
     * 归属历史；{@code creationDate} 为 Unix 秒（IfcTimeStamp）。
     */
    public record OwnerHistory(PersonAndOrganization owningUser, Application owningApplication, ChangeAction changeAction,
                               long creationDate) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCOWNERHISTORY";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(owningUser, owningApplication, null, changeAction, null, null, null, creationDate);
        }
    }

    public record Material(String name, String description, String category) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCMATERIAL";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(name, description, category);
        }
    }

    public record MaterialLayer(Material material, double layerThickness, String name) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCMATERIALLAYER";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(material, layerThickness, null, name, null, null, null);
        }
    }

    public record MaterialLayerSet(List<MaterialLayer> materialLayers, String layerSetName) implements IfcEntity {
        public MaterialLayerSet {
            materialLayers = List.copyOf(materialLayers);
        }

        @Override
        public String stepType() {
            return "IFCMATERIALLAYERSET";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(new ArrayList<Object>(materialLayers), layerSetName, null);
        }
    }

    public record MaterialLayerSetUsage(
            MaterialLayerSet forLayerSet,
            LayerSetDirection layerSetDirection,
            DirectionSense directionSense,
            double offsetFromReferenceLine
    ) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCMATERIALLAYERSETUSAGE";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(forLayerSet, layerSetDirection, directionSense, offsetFromReferenceLine, null);
        }
    }
}
