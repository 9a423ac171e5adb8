package org.ifcserver.ifc.build;

import org.ifcserver.ifc.model.ElementCompositionType;
import org.ifcserver.ifc.model.IfcBuilding;
import org.ifcserver.ifc.model.IfcBuildingStorey;
import org.ifcserver.ifc.model.IfcGeometry;
import org.ifcserver.ifc.model.IfcModel;
import org.ifcserver.ifc.model.IfcProduct;
import org.ifcserver.ifc.model.IfcRelations;
import org.ifcserver.ifc.model.IfcResources;
import org.ifcserver.ifc.model.IfcSpace;
import org.ifcserver.ifc.model.IfcWallStandardCase;
import org.ifcserver.ifc.model.InvalidModelStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IfcHierarchyBuilderTest {

    private IfcHierarchyBuilder builder;
    private IfcModel model;

    @BeforeEach
    void setUp() {
        builder = new IfcHierarchyBuilder(WallMaterialSpec.defaults());
        model = IfcModelFactory.createAndInitModel(IfcModelFactory.createDefaultCredentials(), "TestProject");
    }

    @Test
    void createBuilding_aggregatesToProjectWithOriginPlacement() {
        IfcBuilding building = builder.createBuilding(model, "Main");

        assertThat(building.getName()).isEqualTo("Main");
        assertThat(building.getCompositionType()).isEqualTo(ElementCompositionType.ELEMENT);
        assertThat(model.decomposes(building)).containsSame(model.project().orElseThrow());
        IfcGeometry.CartesianPoint location = building.getObjectPlacement().relativePlacement().location();
        assertThat(location.coordinates()).containsExactly(0.0, 0.0, 0.0);
    }

    @Test
    void createBuilding_withoutProjectFailsWithInvalidState() {
        IfcModel empty = IfcModelFactory.createEmptyModel(IfcModelFactory.createDefaultCredentials(), "Empty");

        assertThatThrownBy(() -> builder.createBuilding(empty, "Main"))
                .isInstanceOf(InvalidModelStateException.class);
        assertThat(empty.size()).isZero();
        assertThat(empty.currentTransaction()).isEmpty();
    }

    @Test
    void createStorey_reusesBuildingAggregation() {
        IfcBuilding building = builder.createBuilding(model, "Main");
        IfcBuildingStorey ground = builder.createStorey(model, "Ground", 0, building);
        IfcBuildingStorey first = builder.createStorey(model, "First", 3000, building);

        IfcRelations.Aggregates rel = model.decomposedBy(building).orElseThrow();
        assertThat(rel.getRelated()).containsExactly(ground, first);
        assertThat(first.getElevation()).isEqualTo(3000);
    }

    @Test
    void createStorey_missingBuildingFails() {
        assertThatThrownBy(() -> builder.createStorey(model, "Ground", 0, null))
                .isInstanceOf(InvalidModelStateException.class);
    }

    @Test
    void createWall_buildsProfileExtrusionPlacementAndMaterial() {
        IfcBuildingStorey storey = builder.createStorey(model, "Ground", 0, builder.createBuilding(model, "Main"));

        IfcWallStandardCase wall = builder.createWall(model, 5, 0, 1, 0, 0.7, 10, 0.5, 2, storey);

        assertThat(wall.getName()).isEqualTo(IfcHierarchyBuilder.WALL_NAME);
        IfcGeometry.Axis2Placement3D axes = wall.getObjectPlacement().relativePlacement();
        assertThat(axes.location().coordinates()).containsExactly(5.0, 0.0, 0.0);
        assertThat(axes.refDirection().directionRatios()).containsExactly(1.0, 0.0, 0.0);
        assertThat(axes.axis().directionRatios()).containsExactly(0.0, 0.0, 1.0);

        IfcGeometry.ShapeRepresentation shape = wall.getRepresentation().representations().get(0);
        assertThat(shape.representationIdentifier()).isEqualTo("Body");
        assertThat(shape.representationType()).isEqualTo("SweptSolid");
        assertThat(shape.contextOfItems()).isSameAs(model.geometricContext().orElseThrow());
        IfcGeometry.ExtrudedAreaSolid solid = (IfcGeometry.ExtrudedAreaSolid) shape.items().get(0);
        assertThat(solid.depth()).isEqualTo(2.0);
        assertThat(solid.extrudedDirection().directionRatios()).containsExactly(0.0, 0.0, 1.0);
        assertThat(solid.sweptArea().xDim()).isEqualTo(10.0);
        assertThat(solid.sweptArea().yDim()).isEqualTo(0.5);
        // 轮廓插入点固定在原点，与墙体放置无关
        assertThat(solid.sweptArea().position().location().coordinates()).containsExactly(0.0, 0.0);

        List<IfcRelations.AssociatesMaterial> materials = model.materialAssociationsOf(wall);
        assertThat(materials).hasSize(1);
        IfcResources.MaterialLayerSetUsage usage = (IfcResources.MaterialLayerSetUsage) materials.get(0).getRelatingMaterial();
        assertThat(usage.layerSetDirection()).isEqualTo(IfcResources.LayerSetDirection.AXIS2);
        assertThat(usage.directionSense()).isEqualTo(IfcResources.DirectionSense.NEGATIVE);
        assertThat(usage.offsetFromReferenceLine()).isEqualTo(150.0);
        assertThat(usage.forLayerSet().materialLayers().get(0).layerThickness()).isEqualTo(10.0);
        assertThat(usage.forLayerSet().materialLayers().get(0).material()).isNotNull();

        assertThat(model.containerOf(wall)).containsSame(storey);
        assertThat(model.wallsOf(storey)).containsExactly(wall);
    }

    @Test
    void createWall_degenerateSizeIsAccepted() {
        IfcBuildingStorey storey = builder.createStorey(model, "Ground", 0, builder.createBuilding(model, "Main"));

        IfcWallStandardCase wall = builder.createWall(model, 0, 0, 1, 0, 0, 0, 0.5, 0, storey);

        assertThat(model.contains(wall)).isTrue();
    }

    @Test
    void createWall_foreignStoreyFailsAndLeavesModelUnchanged() {
        IfcModel other = IfcModelFactory.createAndInitModel(IfcModelFactory.createDefaultCredentials(), "Other");
        IfcBuildingStorey foreign = builder.createStorey(other, "Ground", 0, builder.createBuilding(other, "B"));
        int before = model.size();

        assertThatThrownBy(() -> builder.createWall(model, 0, 0, 1, 0, 0, 1, 0.5, 2, foreign))
                .isInstanceOf(InvalidModelStateException.class);
        assertThat(model.size()).isEqualTo(before);
    }

    @Test
    void createSpace_createsOneBoundaryPerWallAndIteratesOnce() {
        IfcBuildingStorey storey = builder.createStorey(model, "Ground", 0, builder.createBuilding(model, "Main"));
        IfcWallStandardCase a = builder.createWall(model, 5, 0, 1, 0, 0, 10, 0.5, 2, storey);
        IfcWallStandardCase b = builder.createWall(model, 10, 2.5, 0, 1, 0, 5, 0.5, 2, storey);

        AtomicInteger iterations = new AtomicInteger();
        Iterable<IfcProduct> once = () -> {
            if (iterations.incrementAndGet() > 1) {
                throw new IllegalStateException("walls iterated more than once");
            }
            return List.<IfcProduct>of(a, b).iterator();
        };

        IfcSpace space = builder.createSpace(model, storey, once, "Room", "desc", "Living room",
                ElementCompositionType.ELEMENT);

        assertThat(iterations.get()).isEqualTo(1);
        List<IfcRelations.SpaceBoundary> boundaries = model.boundariesOf(space);
        assertThat(boundaries).extracting(IfcRelations.SpaceBoundary::getRelatedBuildingElement).containsExactly(a, b);
        assertThat(model.decomposes(space)).containsSame(storey);
        assertThat(space.getLongName()).isEqualTo("Living room");
    }

    @Test
    void createSpace_emptyWallsYieldsZeroBoundaries() {
        IfcBuildingStorey storey = builder.createStorey(model, "Ground", 0, builder.createBuilding(model, "Main"));

        IfcSpace space = builder.createSpace(model, storey, List.of(), "Empty", null, null, ElementCompositionType.ELEMENT);

        assertThat(model.boundariesOf(space)).isEmpty();
        assertThat(model.contains(space)).isTrue();
    }

    @Test
    void createSpace_unknownWallRollsBackWholeSpace() {
        IfcBuildingStorey storey = builder.createStorey(model, "Ground", 0, builder.createBuilding(model, "Main"));
        IfcModel other = IfcModelFactory.createAndInitModel(IfcModelFactory.createDefaultCredentials(), "Other");
        IfcWallStandardCase foreign = builder.createWall(other, 0, 0, 1, 0, 0, 1, 0.5, 2,
                builder.createStorey(other, "S", 0, builder.createBuilding(other, "B")));
        int before = model.size();

        assertThatThrownBy(() -> builder.createSpace(model, storey, List.of(foreign), "Room", null, null,
                ElementCompositionType.ELEMENT)).isInstanceOf(InvalidModelStateException.class);

        assertThat(model.size()).isEqualTo(before);
        assertThat(model.instancesOf(IfcSpace.class)).isEmpty();
    }

    @Test
    void customMaterialSpec_isApplied() {
        IfcHierarchyBuilder custom = new IfcHierarchyBuilder(new WallMaterialSpec("Brick", 240, 0,
                IfcResources.LayerSetDirection.AXIS2, IfcResources.DirectionSense.POSITIVE));
        IfcBuildingStorey storey = custom.createStorey(model, "Ground", 0, custom.createBuilding(model, "Main"));

        IfcWallStandardCase wall = custom.createWall(model, 0, 0, 1, 0, 0, 4, 0.24, 3, storey);

        IfcResources.MaterialLayerSetUsage usage =
                (IfcResources.MaterialLayerSetUsage) model.materialAssociationsOf(wall).get(0).getRelatingMaterial();
        assertThat(usage.forLayerSet().materialLayers().get(0).material().name()).isEqualTo("Brick");
        assertThat(usage.forLayerSet().materialLayers().get(0).layerThickness()).isCloseTo(240.0, within(1e-9));
        assertThat(usage.directionSense()).isEqualTo(IfcResources.DirectionSense.POSITIVE);
    }
}
