package org.ifcserver.ifc.step;

import org.ifcserver.ifc.build.IfcHierarchyBuilder;
import org.ifcserver.ifc.build.IfcModelFactory;
import org.ifcserver.ifc.build.WallMaterialSpec;
import org.ifcserver.ifc.model.ElementCompositionType;
import org.ifcserver.ifc.model.IfcBuilding;
import org.ifcserver.ifc.model.IfcBuildingStorey;
import org.ifcserver.ifc.model.IfcModel;
import org.ifcserver.ifc.model.IfcWallStandardCase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IfcStepReaderTest {

    @Test
    void read_parsesHeaderAndTypedArguments() {
        String step = """
                ISO-10303-21;
                HEADER;
                FILE_DESCRIPTION(('ViewDefinition [CoordinationView]'),'2;1');
                FILE_NAME('\\X2\\623F5C4B\\X0\\.ifc','2024-01-01T00:00:00',('a'),('o'),'p','s','');
                FILE_SCHEMA(('IFC4'));
                ENDSEC;
                DATA;
                #1=IFCCARTESIANPOINT((0.,1.5,-2.E-05));
                #2=IFCSIUNIT(*,.LENGTHUNIT.,.MILLI.,.METRE.);
                #3=IFCPROPERTYSINGLEVALUE('Note','It''s (tricky); really',IFCLABEL('x'),$);
                #4 = IFCAXIS2PLACEMENT3D(#1,$,$);
                ENDSEC;
                END-ISO-10303-21;
                """;

        IfcStepReader.StepFile file = IfcStepReader.read(step);

        assertThat(file.warnings()).isEmpty();
        assertThat(file.header().fileName()).isEqualTo("房屋.ifc");
        assertThat(file.header().implementationLevel()).isEqualTo("2;1");
        assertThat(file.header().schemas()).containsExactly("IFC4");
        assertThat(file.instances()).containsOnlyKeys(1, 2, 3, 4);

        IfcStepReader.StepList coords = (IfcStepReader.StepList) file.instances().get(1).args().get(0);
        assertThat(coords.items()).extracting(v -> ((IfcStepReader.StepNumber) v).value())
                .containsExactly(0.0, 1.5, -2.0E-5);

        List<IfcStepReader.StepValue> unit = file.instances().get(2).args();
        assertThat(unit.get(0)).isInstanceOf(IfcStepReader.StepDerived.class);
        assertThat(unit.get(1)).isEqualTo(new IfcStepReader.StepEnum("LENGTHUNIT"));

        IfcStepReader.StepInstance property = file.instances().get(3);
        assertThat(property.stringAt(1)).isEqualTo("It's (tricky); really");
        assertThat(property.args().get(2)).isInstanceOf(IfcStepReader.StepTyped.class);

        assertThat(file.instances().get(4).typeUpper()).isEqualTo("IFCAXIS2PLACEMENT3D");
        assertThat(file.instances().get(4).refAt(0)).isEqualTo(1);
    }

    @Test
    void read_reportsDuplicateLabelsAndMissingSections() {
        String step = """
                ISO-10303-21;
                DATA;
                #1=IFCDIRECTION((1.,0.,0.));
                #1=IFCDIRECTION((0.,1.,0.));
                ENDSEC;
                """;

        IfcStepReader.StepFile file = IfcStepReader.read(step);

        assertThat(file.header()).isNull();
        assertThat(file.warnings()).anyMatch(w -> w.contains("HEADER"));
        assertThat(file.duplicateLabels()).containsExactly(1);
        assertThat(file.instances()).hasSize(1);
    }

    @Test
    void read_blankInputGivesWarning() {
        IfcStepReader.StepFile file = IfcStepReader.read("  ");

        assertThat(file.instances()).isEmpty();
        assertThat(file.warnings()).isNotEmpty();
    }

    @Test
    void readInfo_summarisesWrittenModel() {
        IfcModel model = IfcModelFactory.createAndInitModel(IfcModelFactory.createDefaultCredentials(), "Villa");
        IfcHierarchyBuilder builder = new IfcHierarchyBuilder(WallMaterialSpec.defaults());
        IfcBuilding building = builder.createBuilding(model, "Main building");
        IfcBuildingStorey ground = builder.createStorey(model, "Ground", 0, building);
        builder.createStorey(model, "First", 3000, building);
        IfcWallStandardCase a = builder.createWall(model, 5, 0, 1, 0, 0, 10, 0.5, 2, ground);
        IfcWallStandardCase b = builder.createWall(model, 10, 2.5, 0, 1, 0, 5, 0.5, 2, ground);
        builder.createSpace(model, ground, List.of(a, b), "Room", null, null, ElementCompositionType.ELEMENT);

        IfcFileSummary summary = IfcStepReader.readInfo(IfcStepWriter.write(model), 5);

        assertThat(summary.warnings()).isEmpty();
        assertThat(summary.fileName()).isEqualTo("Villa.ifc");
        assertThat(summary.schemas()).containsExactly("IFC4");
        assertThat(summary.entityCount()).isEqualTo(model.size());
        assertThat(summary.projectName()).isEqualTo("Villa");
        assertThat(summary.buildingNames()).containsExactly("Main building");
        assertThat(summary.storeyNames()).containsExactly("Ground", "First");
        assertThat(summary.wallCount()).isEqualTo(2);
        assertThat(summary.spaceCount()).isEqualTo(1);
        assertThat(summary.topEntityTypes()).hasSize(5);
        assertThat(summary.topEntityTypes().get(0).type()).isEqualTo("IFCCARTESIANPOINT");
    }
}
