package org.ifcserver.ifc.step;

import org.ifcserver.ifc.build.IfcHierarchyBuilder;
import org.ifcserver.ifc.build.IfcModelFactory;
import org.ifcserver.ifc.build.WallMaterialSpec;
import org.ifcserver.ifc.model.IfcBuildingStorey;
import org.ifcserver.ifc.model.IfcGeometry;
import org.ifcserver.ifc.model.IfcModel;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IfcStepWriterTest {

    @Test
    void formatReal_alwaysHasDecimalPoint() {
        assertThat(IfcStepWriter.formatReal(0)).isEqualTo("0.");
        assertThat(IfcStepWriter.formatReal(10)).isEqualTo("10.");
        assertThat(IfcStepWriter.formatReal(-3)).isEqualTo("-3.");
        assertThat(IfcStepWriter.formatReal(2.5)).isEqualTo("2.5");
        assertThat(IfcStepWriter.formatReal(1e-5)).isEqualTo("1.E-05");
        assertThat(IfcStepWriter.formatReal(1.2345678E7)).isEqualTo("1.2345678E07");
        assertThat(IfcStepWriter.formatReal(Double.NaN)).isEqualTo("$");
        assertThat(IfcStepWriter.formatReal(Double.POSITIVE_INFINITY)).isEqualTo("$");
    }

    @Test
    void write_producesHeaderAndLabelledDataSection() {
        IfcModel model = IfcModelFactory.createAndInitModel(IfcModelFactory.createDefaultCredentials(), "TestProject");
        IfcHierarchyBuilder builder = new IfcHierarchyBuilder(WallMaterialSpec.defaults());
        IfcBuildingStorey storey = builder.createStorey(model, "Ground", 0, builder.createBuilding(model, "Main"));
        builder.createWall(model, 5, 0, 1, 0, 0, 10, 0.5, 2, storey);

        String text = IfcStepWriter.write(model, Instant.parse("2024-01-02T03:04:05.678Z"));

        assertThat(text).startsWith("ISO-10303-21;\nHEADER;\n");
        assertThat(text).contains("FILE_DESCRIPTION(('ViewDefinition [CoordinationView]'),'2;1');");
        assertThat(text).contains("FILE_NAME('TestProject.ifc','2024-01-02T03:04:05',('x team'),('y'),'mcp-server-ifc 1.0','mcp-server-ifc','');");
        assertThat(text).contains("FILE_SCHEMA(('IFC4'));");
        assertThat(text).contains("#1=IFCPERSON($,'team','x',$,$,$,$,$);");
        assertThat(text).contains("=IFCSIUNIT(*,.LENGTHUNIT.,.MILLI.,.METRE.);");
        assertThat(text).contains("=IFCRECTANGLEPROFILEDEF(.AREA.,$,");
        assertThat(text).contains("'A standard wall'");
        assertThat(text).endsWith("ENDSEC;\nEND-ISO-10303-21;\n");

        long dataLines = text.lines().filter(line -> line.startsWith("#")).count();
        assertThat(dataLines).isEqualTo(model.size());
        assertThat(text).contains("#" + model.size() + "=");
    }

    @Test
    void write_unregisteredReferenceFails() {
        IfcModel model = IfcModelFactory.createEmptyModel(IfcModelFactory.createDefaultCredentials(), "TestProject");
        IfcGeometry.CartesianPoint loose = IfcGeometry.CartesianPoint.of(0, 0, 0);
        model.runInTransaction("dangling", m -> m.newInstance(new IfcGeometry.Axis2Placement3D(loose, null, null)));

        assertThatThrownBy(() -> IfcStepWriter.write(model))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("IFCCARTESIANPOINT");
    }
}
