package org.ifcserver.ifc;

import org.ifcserver.geometry.Polyline;
import org.ifcserver.geometry.PolylineVertex;
import org.ifcserver.geometry.PolylineWallExtractor;
import org.ifcserver.geometry.WallDimensions;
import org.ifcserver.ifc.build.IfcHierarchyBuilder;
import org.ifcserver.ifc.build.IfcModelFactory;
import org.ifcserver.ifc.build.WallMaterialSpec;
import org.ifcserver.ifc.model.IfcBuilding;
import org.ifcserver.ifc.model.IfcBuildingStorey;
import org.ifcserver.ifc.model.IfcGeometry;
import org.ifcserver.ifc.model.IfcModel;
import org.ifcserver.ifc.model.IfcWallStandardCase;
import org.ifcserver.ifc.model.InvalidModelStateException;
import org.ifcserver.ifc.validation.IfcModelPersister;
import org.ifcserver.ifc.validation.SavePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PolylineWallServiceTest {

    @TempDir
    Path tempDir;

    private IfcHierarchyBuilder builder;
    private PolylineWallService service;
    private IfcModel model;
    private IfcBuildingStorey storey;

    @BeforeEach
    void setUp() {
        builder = new IfcHierarchyBuilder(WallMaterialSpec.defaults());
        service = new PolylineWallService(new PolylineWallExtractor(WallDimensions.DEFAULT), builder,
                new IfcModelPersister(tempDir, SavePolicy.VALIDATE_THEN_SAVE));
        model = IfcModelFactory.createAndInitModel(IfcModelFactory.createDefaultCredentials(), "TestProject");
        storey = builder.createStorey(model, "Ground", 0, builder.createBuilding(model, "Main"));
    }

    @Test
    void createWalls_twoSegmentsOnOnlyStoreyAndSaved() {
        Polyline polyline = new Polyline(List.of(
                PolylineVertex.of(0, 0),
                PolylineVertex.of(10, 0),
                PolylineVertex.of(10, 5)
        ), false);

        PolylineImportReport report = service.createWalls(model, polyline, null, true);

        assertThat(report.wallsCreated()).isEqualTo(2);
        assertThat(report.segmentsSkipped()).isEqualTo(1);
        assertThat(report.failures()).isEmpty();
        assertThat(report.storeyGlobalId()).isEqualTo(storey.getGlobalId());

        List<IfcWallStandardCase> walls = model.wallsOf(storey);
        assertThat(walls).hasSize(2);
        assertWall(walls.get(0), 5, 0, 1, 0, 10);
        assertWall(walls.get(1), 10, 2.5, 0, 1, 5);

        assertThat(report.saveOutcome()).isNotNull();
        assertThat(report.saveOutcome().saved()).isTrue();
        assertThat(Files.exists(tempDir.resolve("TestProject.ifc"))).isTrue();
    }

    private static void assertWall(IfcWallStandardCase wall, double x, double y, double dx, double dy, double length) {
        IfcGeometry.Axis2Placement3D axes = wall.getObjectPlacement().relativePlacement();
        assertThat(axes.location().x()).isCloseTo(x, within(1e-9));
        assertThat(axes.location().y()).isCloseTo(y, within(1e-9));
        assertThat(axes.location().z()).isEqualTo(0.0);
        assertThat(axes.refDirection().directionRatios().get(0)).isCloseTo(dx, within(1e-9));
        assertThat(axes.refDirection().directionRatios().get(1)).isCloseTo(dy, within(1e-9));
        IfcGeometry.ExtrudedAreaSolid solid =
                (IfcGeometry.ExtrudedAreaSolid) wall.getRepresentation().representations().get(0).items().get(0);
        assertThat(solid.sweptArea().xDim()).isCloseTo(length, within(1e-9));
        assertThat(solid.sweptArea().yDim()).isEqualTo(0.5);
        assertThat(solid.depth()).isEqualTo(2.0);
    }

    @Test
    void createWalls_onlyArcsAndDegenerateSegmentsLeaveModelUnchanged() {
        int before = model.size();
        Polyline polyline = new Polyline(List.of(
                PolylineVertex.of(0, 0, 0.5),
                PolylineVertex.of(4, 0),
                PolylineVertex.of(4, 0)
        ), false);

        PolylineImportReport report = service.createWalls(model, polyline, storey, false);

        assertThat(report.wallsCreated()).isZero();
        assertThat(report.arcsSkipped()).isEqualTo(1);
        assertThat(report.segmentsSkipped()).isEqualTo(2);
        assertThat(report.saveOutcome()).isNull();
        assertThat(model.size()).isEqualTo(before);
        assertThat(report.diagnostics()).anyMatch(line -> line.contains("Arc"));
    }

    @Test
    void createWalls_explicitStoreyIsUsed() {
        IfcBuildingStorey upper = builder.createStorey(model, "Upper", 3000,
                (IfcBuilding) model.decomposes(storey).orElseThrow());
        Polyline polyline = new Polyline(List.of(PolylineVertex.of(0, 0), PolylineVertex.of(1, 0)), false);

        service.createWalls(model, polyline, upper, false);

        assertThat(model.wallsOf(upper)).hasSize(1);
        assertThat(model.wallsOf(storey)).isEmpty();
    }

    @Test
    void createWalls_withoutStoreyFails() {
        IfcModel bare = IfcModelFactory.createAndInitModel(IfcModelFactory.createDefaultCredentials(), "Bare");
        Polyline polyline = new Polyline(List.of(PolylineVertex.of(0, 0), PolylineVertex.of(1, 0)), false);

        assertThatThrownBy(() -> service.createWalls(bare, polyline, null, false))
                .isInstanceOf(InvalidModelStateException.class);
    }

    @Test
    void createWalls_failingSegmentKeepsEarlierWalls() {
        Polyline polyline = new Polyline(List.of(
                PolylineVertex.of(0, 0),
                PolylineVertex.of(10, 0),
                PolylineVertex.of(10, 5)
        ), false);

        // 第二个线段建墙失败
        IfcHierarchyBuilder flaky = new IfcHierarchyBuilder(WallMaterialSpec.defaults()) {
            private int calls;

            @Override
            public IfcWallStandardCase createWall(IfcModel m, double posX, double posY, double dirX, double dirY,
                                                  double dirZ, double length, double width, double height,
                                                  IfcBuildingStorey s) {
                if (++calls == 2) {
                    throw new InvalidModelStateException("simulated failure");
                }
                return super.createWall(m, posX, posY, dirX, dirY, dirZ, length, width, height, s);
            }
        };
        PolylineWallService flakyService = new PolylineWallService(new PolylineWallExtractor(WallDimensions.DEFAULT),
                flaky, new IfcModelPersister(tempDir, SavePolicy.VALIDATE_THEN_SAVE));

        PolylineImportReport report = flakyService.createWalls(model, polyline, storey, false);

        assertThat(report.wallsCreated()).isEqualTo(1);
        assertThat(report.failures()).hasSize(1);
        assertThat(report.failures().get(0)).contains("Segment 1").contains("simulated failure");
        assertThat(model.wallsOf(storey)).hasSize(1);
        assertThat(model.currentTransaction()).isEmpty();
    }
}
