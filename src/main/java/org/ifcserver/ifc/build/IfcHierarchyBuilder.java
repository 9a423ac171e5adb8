package org.ifcserver.ifc.build;

import org.ifcserver.ifc.model.ElementCompositionType;
import org.ifcserver.ifc.model.IfcBuilding;
import org.ifcserver.ifc.model.IfcBuildingStorey;
import org.ifcserver.ifc.model.IfcEntity;
import org.ifcserver.ifc.model.IfcGeometry;
import org.ifcserver.ifc.model.IfcGuid;
import org.ifcserver.ifc.model.IfcModel;
import org.ifcserver.ifc.model.IfcProduct;
import org.ifcserver.ifc.model.IfcProject;
import org.ifcserver.ifc.model.IfcRelations;
import org.ifcserver.ifc.model.IfcResources;
import org.ifcserver.ifc.model.IfcRoot;
import org.ifcserver.ifc.model.IfcSpace;
import org.ifcserver.ifc.model.IfcWallStandardCase;
import org.ifcserver.ifc.model.InvalidModelStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * 空间层级构建器：在已有模型上创建建筑、楼层、墙、空间，并挂接到空间分解树上。
 * <p>
 * 每个操作各自在一个事务中完成，要么全部可见，要么全部回滚；操作之间没有跨事务的补偿。
 * <p>
 * 前置条件不满足（缺少项目、父对象为空或不属于该模型）时抛出 {@link InvalidModelStateException}。
 */
public class IfcHierarchyBuilder {

    public static final String WALL_NAME = "A standard wall";

    private static final Logger log = LoggerFactory.getLogger(IfcHierarchyBuilder.class);

    private final WallMaterialSpec materialSpec;

    public IfcHierarchyBuilder(WallMaterialSpec materialSpec) {
        this.materialSpec = Objects.requireNonNull(materialSpec, "materialSpec");
    }

    public WallMaterialSpec getMaterialSpec() {
        return materialSpec;
    }

    public IfcBuilding createBuilding(IfcModel model, String name) {
        return model.runInTransaction("Create Building", m -> {
            IfcProject project = m.project()
                    .orElseThrow(() -> new InvalidModelStateException("模型中没有 IfcProject，无法创建建筑：" + name));
            IfcResources.OwnerHistory ownerHistory = m.ownerHistory().orElse(null);

            IfcGeometry.CartesianPoint origin = m.newInstance(IfcGeometry.CartesianPoint.of(0, 0, 0));
            IfcGeometry.Axis2Placement3D placement = m.newInstance(new IfcGeometry.Axis2Placement3D(origin, null, null));
            IfcGeometry.LocalPlacement localPlacement = m.newInstance(new IfcGeometry.LocalPlacement(null, placement));

            IfcBuilding building = m.newInstance(new IfcBuilding(IfcGuid.newGuid(), ownerHistory, name, localPlacement,
                    ElementCompositionType.ELEMENT));
            aggregate(m, project, building);
            log.info("Created building '{}' ({})", name, building.getGlobalId());
            return building;
        });
    }

    public IfcBuildingStorey createStorey(IfcModel model, String name, double elevation, IfcBuilding building) {
        requireMember(model, building, "建筑");
        return model.runInTransaction("Create Building Storey", m -> {
            IfcBuildingStorey storey = m.newInstance(new IfcBuildingStorey(IfcGuid.newGuid(),
                    m.ownerHistory().orElse(null), name, elevation));
            aggregate(m, building, storey);
            log.info("Created storey '{}' at elevation {} ({})", name, elevation, storey.getGlobalId());
            return storey;
        });
    }

    /**
     * 创建一面标准墙并放入楼层。
     * <p>
     * 几何构造：
     * <ol>
     *   <li>{@code length x width} 的矩形轮廓，轮廓自身插入点固定在 (0,0)；</li>
     *   <li>沿 +Z 拉伸 {@code height}；</li>
     *   <li>放置点 (posX, posY, 0)，参考方向 (dirX, dirY, 0)，Z 轴 (0,0,1)；{@code dirZ} 不进入参考方向；</li>
     *   <li>默认材料分层用法（见 {@link WallMaterialSpec}）。</li>
     * </ol>
     * 尺寸为 0 的墙不会被拒绝，会在校验阶段报告。
     */
    public IfcWallStandardCase createWall(IfcModel model, double posX, double posY, double dirX, double dirY, double dirZ,
                                          double length, double width, double height, IfcBuildingStorey storey) {
        requireMember(model, storey, "楼层");
        return model.runInTransaction("Create Wall", m -> {
            IfcResources.OwnerHistory ownerHistory = m.ownerHistory().orElse(null);
            IfcGeometry.GeometricRepresentationContext context = m.geometricContext()
                    .orElseThrow(() -> new InvalidModelStateException("模型缺少几何表达上下文，无法创建墙体"));

            // 轮廓（墙体底面）
            IfcGeometry.CartesianPoint insertPoint = m.newInstance(IfcGeometry.CartesianPoint.of(0, 0));
            IfcGeometry.Axis2Placement2D profilePosition = m.newInstance(new IfcGeometry.Axis2Placement2D(insertPoint, null));
            IfcGeometry.RectangleProfileDef profile = m.newInstance(new IfcGeometry.RectangleProfileDef(
                    IfcGeometry.ProfileType.AREA, null, profilePosition, length, width));

            // 拉伸体
            IfcGeometry.CartesianPoint origin = m.newInstance(IfcGeometry.CartesianPoint.of(0, 0, 0));
            IfcGeometry.Axis2Placement3D solidPosition = m.newInstance(new IfcGeometry.Axis2Placement3D(origin, null, null));
            IfcGeometry.Direction extrusion = m.newInstance(IfcGeometry.Direction.of(0, 0, 1));
            IfcGeometry.ExtrudedAreaSolid body = m.newInstance(new IfcGeometry.ExtrudedAreaSolid(
                    profile, solidPosition, extrusion, height));

            IfcGeometry.ShapeRepresentation shape = m.newInstance(new IfcGeometry.ShapeRepresentation(
                    context, "Body", "SweptSolid", List.<IfcEntity>of(body)));
            IfcGeometry.ProductDefinitionShape productShape = m.newInstance(
                    new IfcGeometry.ProductDefinitionShape(null, null, List.of(shape)));

            // 放置
            IfcGeometry.CartesianPoint location = m.newInstance(IfcGeometry.CartesianPoint.of(posX, posY, 0));
            IfcGeometry.Direction axis = m.newInstance(IfcGeometry.Direction.of(0, 0, 1));
            IfcGeometry.Direction refDirection = m.newInstance(IfcGeometry.Direction.of(dirX, dirY, 0));
            IfcGeometry.Axis2Placement3D wallAxes = m.newInstance(new IfcGeometry.Axis2Placement3D(location, axis, refDirection));
            IfcGeometry.LocalPlacement placement = m.newInstance(new IfcGeometry.LocalPlacement(null, wallAxes));

            IfcWallStandardCase wall = m.newInstance(new IfcWallStandardCase(IfcGuid.newGuid(), ownerHistory, WALL_NAME,
                    placement, productShape));

            // 标准墙必须携带材料分层用法
            IfcResources.Material material = m.newInstance(new IfcResources.Material(materialSpec.materialName(), null, null));
            IfcResources.MaterialLayer layer = m.newInstance(new IfcResources.MaterialLayer(
                    material, materialSpec.layerThickness(), null));
            IfcResources.MaterialLayerSet layerSet = m.newInstance(new IfcResources.MaterialLayerSet(List.of(layer), null));
            IfcResources.MaterialLayerSetUsage usage = m.newInstance(new IfcResources.MaterialLayerSetUsage(
                    layerSet, materialSpec.direction(), materialSpec.sense(), materialSpec.offset()));
            IfcRelations.AssociatesMaterial association = m.newInstance(new IfcRelations.AssociatesMaterial(
                    IfcGuid.newGuid(), ownerHistory, usage));
            association.attach(m, wall);

            contain(m, storey, wall);
            log.debug("Created wall {} at ({}, {}) dir ({}, {}, {}) size {}x{}x{}",
                    wall.getGlobalId(), posX, posY, dirX, dirY, dirZ, length, width, height);
            return wall;
        });
    }

    /**
     * 创建空间，并为 {@code walls} 中的每面墙建立一个空间边界关系。
     * <p>
     * {@code walls} 只做一次正向遍历；空序列得到没有边界的空间。
     */
    public IfcSpace createSpace(IfcModel model, IfcBuildingStorey storey, Iterable<? extends IfcProduct> walls,
                                String name, String description, String longName,
                                ElementCompositionType compositionType) {
        requireMember(model, storey, "楼层");
        Objects.requireNonNull(walls, "walls");
        return model.runInTransaction("Create Space: " + name, m -> {
            IfcResources.OwnerHistory ownerHistory = m.ownerHistory().orElse(null);
            IfcSpace space = m.newInstance(new IfcSpace(IfcGuid.newGuid(), ownerHistory, name, description, longName,
                    compositionType));

            int boundaries = 0;
            Iterator<? extends IfcProduct> it = walls.iterator();
            while (it.hasNext()) {
                IfcProduct wall = it.next();
                if (!m.contains(wall)) {
                    throw new InvalidModelStateException("墙体不属于当前模型：" + wall);
                }
                m.newInstance(new IfcRelations.SpaceBoundary(IfcGuid.newGuid(), ownerHistory, space, wall));
                boundaries++;
            }

            aggregate(m, storey, space);
            log.info("Created space '{}' with {} boundaries ({})", name, boundaries, space.getGlobalId());
            return space;
        });
    }

    private static void aggregate(IfcModel model, IfcRoot parent, IfcRoot child) {
        IfcRelations.Aggregates rel = model.decomposedBy(parent).orElseGet(() -> model.newInstance(
                new IfcRelations.Aggregates(IfcGuid.newGuid(), model.ownerHistory().orElse(null), parent)));
        rel.attach(model, child);
    }

    private static void contain(IfcModel model, IfcBuildingStorey storey, IfcProduct element) {
        IfcRelations.ContainedInSpatialStructure rel = model.containedInStructure(storey).orElseGet(() -> model.newInstance(
                new IfcRelations.ContainedInSpatialStructure(IfcGuid.newGuid(), model.ownerHistory().orElse(null), storey)));
        rel.attach(model, element);
    }

    private static void requireMember(IfcModel model, IfcRoot entity, String what) {
        Objects.requireNonNull(model, "model");
        if (entity == null) {
            throw new InvalidModelStateException("缺少" + what + "，无法继续创建");
        }
        if (!model.contains(entity)) {
            throw new InvalidModelStateException(what + "不属于当前模型：" + entity);
        }
    }
}
