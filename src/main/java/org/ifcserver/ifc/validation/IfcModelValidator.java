package org.ifcserver.ifc.validation;

import org.ifcserver.ifc.model.IfcBuilding;
import org.ifcserver.ifc.model.IfcBuildingStorey;
import org.ifcserver.ifc.model.IfcEntity;
import org.ifcserver.ifc.model.IfcGeometry;
import org.ifcserver.ifc.model.IfcGuid;
import org.ifcserver.ifc.model.IfcModel;
import org.ifcserver.ifc.model.IfcProject;
import org.ifcserver.ifc.model.IfcRelations;
import org.ifcserver.ifc.model.IfcRelationship;
import org.ifcserver.ifc.model.IfcResources;
import org.ifcserver.ifc.model.IfcRoot;
import org.ifcserver.ifc.model.IfcSpace;
import org.ifcserver.ifc.model.IfcWallStandardCase;
import org.ifcserver.ifc.model.StepValues;
import org.ifcserver.ifc.step.IfcStepReader;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 模型结构校验。
 * <p>
 * 两个入口：
 * <ul>
 *   <li>{@link #validate(IfcModel)}：校验内存模型（引用、项目、GlobalId、墙体几何与材料、层级挂接）。</li>
 *   <li>{@link #validateSerialized(String)}：回读写出的 STEP 文本，校验序列化后的文件（模式、标签、悬空引用）。</li>
 * </ul>
 * 校验不修改模型；违规全部收集后一次返回，不会在第一条违规处中断。
 */
public final class IfcModelValidator {

    /**
     * 第一个参数为 GlobalId 的 STEP 类型（本项目会写出的 IfcRoot 子类型）。
     */
    private static final Set<String> ROOTED_TYPES = Set.of(
            "IFCPROJECT",
            "IFCBUILDING",
            "IFCBUILDINGSTOREY",
            "IFCSPACE",
            "IFCWALLSTANDARDCASE",
            "IFCRELAGGREGATES",
            "IFCRELCONTAINEDINSPATIALSTRUCTURE",
            "IFCRELASSOCIATESMATERIAL",
            "IFCRELSPACEBOUNDARY"
    );

    private IfcModelValidator() {
    }

    // ------------------------------------------------------------------
    // 内存模型
    // ------------------------------------------------------------------

    public static ValidationReport validate(IfcModel model) {
        return model.read(m -> {
            List<ValidationViolation> out = new ArrayList<>();
            checkReferencesAndNumbers(m, out);
            Optional<IfcGeometry.GeometricRepresentationContext> sharedContext = checkProject(m, out);
            checkGlobalIds(m, out);
            checkGeometry(m, sharedContext.orElse(null), out);
            checkWalls(m, out);
            checkAttachment(m, out);
            checkRelations(m, out);
            return new ValidationReport(out);
        });
    }

    private static void checkReferencesAndNumbers(IfcModel m, List<ValidationViolation> out) {
        for (IfcEntity entity : m.instances()) {
            walkArguments(m, entity, entity.stepArguments(), out);
        }
    }

    private static void walkArguments(IfcModel m, IfcEntity owner, List<?> args, List<ValidationViolation> out) {
        for (Object arg : args) {
            walkValue(m, owner, arg, out);
        }
    }

    private static void walkValue(IfcModel m, IfcEntity owner, Object value, List<ValidationViolation> out) {
        if (value instanceof IfcEntity ref) {
            if (!m.contains(ref)) {
                out.add(violation(m, owner, ValidationRule.UNREGISTERED_REFERENCE,
                        "引用了未注册的实体 " + ref.stepType()));
            }
        } else if (value instanceof Double d && !Double.isFinite(d)) {
            out.add(violation(m, owner, ValidationRule.NON_FINITE_NUMBER, "参数包含非有限数值 " + d));
        } else if (value instanceof List<?> list) {
            walkArguments(m, owner, list, out);
        } else if (value instanceof StepValues.Typed typed) {
            walkValue(m, owner, typed.value(), out);
        }
    }

    private static Optional<IfcGeometry.GeometricRepresentationContext> checkProject(IfcModel m,
                                                                                     List<ValidationViolation> out) {
        List<IfcProject> projects = m.instancesOf(IfcProject.class);
        if (projects.size() != 1) {
            out.add(new ValidationViolation(0, "IFCPROJECT", ValidationRule.PROJECT_COUNT,
                    "模型必须恰好包含 1 个 IfcProject，实际为 " + projects.size()));
        }
        if (projects.isEmpty()) {
            return Optional.empty();
        }
        IfcProject project = projects.get(0);
        IfcResources.UnitAssignment units = project.getUnitsInContext();
        if (units == null || units.units().isEmpty()) {
            out.add(violation(m, project, ValidationRule.PROJECT_UNITS, "项目缺少单位定义"));
        }
        List<IfcGeometry.GeometricRepresentationContext> contexts = project.getRepresentationContexts();
        if (contexts.size() != 1) {
            out.add(violation(m, project, ValidationRule.PROJECT_CONTEXT,
                    "项目必须恰好有 1 个几何表达上下文，实际为 " + contexts.size()));
        }
        return contexts.isEmpty() ? Optional.empty() : Optional.of(contexts.get(0));
    }

    private static void checkGlobalIds(IfcModel m, List<ValidationViolation> out) {
        Map<String, IfcRoot> seen = new HashMap<>();
        for (IfcRoot root : m.instancesOf(IfcRoot.class)) {
            String guid = root.getGlobalId();
            if (!IfcGuid.isValid(guid)) {
                out.add(violation(m, root, ValidationRule.INVALID_GLOBAL_ID, "GlobalId 格式无效：" + guid));
                continue;
            }
            IfcRoot previous = seen.putIfAbsent(guid, root);
            if (previous != null) {
                out.add(violation(m, root, ValidationRule.DUPLICATE_GLOBAL_ID,
                        "GlobalId 与 #" + m.labelOf(previous) + " 重复：" + guid));
            }
        }
    }

    private static void checkGeometry(IfcModel m, IfcGeometry.GeometricRepresentationContext sharedContext,
                                      List<ValidationViolation> out) {
        for (IfcGeometry.ShapeRepresentation shape : m.instancesOf(IfcGeometry.ShapeRepresentation.class)) {
            if (sharedContext == null || shape.contextOfItems() != sharedContext) {
                out.add(violation(m, shape, ValidationRule.FOREIGN_CONTEXT, "形状表达未使用项目的几何表达上下文"));
            }
        }
        for (IfcGeometry.RectangleProfileDef profile : m.instancesOf(IfcGeometry.RectangleProfileDef.class)) {
            if (!(profile.xDim() > 0) || !(profile.yDim() > 0)) {
                out.add(violation(m, profile, ValidationRule.NON_POSITIVE_DIMENSION,
                        "矩形轮廓尺寸必须为正：" + profile.xDim() + " x " + profile.yDim()));
            }
        }
        for (IfcGeometry.ExtrudedAreaSolid solid : m.instancesOf(IfcGeometry.ExtrudedAreaSolid.class)) {
            if (!(solid.depth() > 0)) {
                out.add(violation(m, solid, ValidationRule.NON_POSITIVE_DIMENSION,
                        "拉伸深度必须为正：" + solid.depth()));
            }
        }
        for (IfcGeometry.Direction direction : m.instancesOf(IfcGeometry.Direction.class)) {
            if (direction.isZero()) {
                out.add(violation(m, direction, ValidationRule.ZERO_DIRECTION,
                        "方向向量为零：" + direction.directionRatios()));
            }
        }
    }

    private static void checkWalls(IfcModel m, List<ValidationViolation> out) {
        for (IfcWallStandardCase wall : m.instancesOf(IfcWallStandardCase.class)) {
            if (wall.getObjectPlacement() == null) {
                out.add(violation(m, wall, ValidationRule.WALL_PLACEMENT, "墙体缺少放置"));
            }
            if (wall.getRepresentation() == null || wall.getRepresentation().representations().isEmpty()) {
                out.add(violation(m, wall, ValidationRule.WALL_REPRESENTATION, "墙体缺少形状表达"));
            }
            boolean hasUsage = false;
            for (IfcRelations.AssociatesMaterial rel : m.materialAssociationsOf(wall)) {
                if (rel.getRelatingMaterial() instanceof IfcResources.MaterialLayerSetUsage) {
                    hasUsage = true;
                    break;
                }
            }
            if (!hasUsage) {
                out.add(violation(m, wall, ValidationRule.WALL_MATERIAL, "标准墙缺少材料分层用法"));
            }
        }
    }

    private static void checkAttachment(IfcModel m, List<ValidationViolation> out) {
        for (IfcBuilding building : m.instancesOf(IfcBuilding.class)) {
            if (!(m.decomposes(building).orElse(null) instanceof IfcProject)) {
                out.add(violation(m, building, ValidationRule.DETACHED_ELEMENT, "建筑未聚合到项目"));
            }
        }
        for (IfcBuildingStorey storey : m.instancesOf(IfcBuildingStorey.class)) {
            if (!(m.decomposes(storey).orElse(null) instanceof IfcBuilding)) {
                out.add(violation(m, storey, ValidationRule.DETACHED_ELEMENT, "楼层未聚合到建筑"));
            }
        }
        for (IfcSpace space : m.instancesOf(IfcSpace.class)) {
            if (!(m.decomposes(space).orElse(null) instanceof IfcBuildingStorey)) {
                out.add(violation(m, space, ValidationRule.DETACHED_ELEMENT, "空间未聚合到楼层"));
            }
        }
        for (IfcWallStandardCase wall : m.instancesOf(IfcWallStandardCase.class)) {
            if (m.containerOf(wall).isEmpty()) {
                out.add(violation(m, wall, ValidationRule.DETACHED_ELEMENT, "墙体未包含在任何楼层中"));
            }
        }
    }

    private static void checkRelations(IfcModel m, List<ValidationViolation> out) {
        for (IfcRelationship<?> rel : m.instancesOf(IfcRelationship.class)) {
            if (rel.getRelated().isEmpty()) {
                out.add(violation(m, rel, ValidationRule.EMPTY_RELATION, "关系没有任何被关联对象"));
            }
        }
    }

    private static ValidationViolation violation(IfcModel m, IfcEntity entity, ValidationRule rule, String message) {
        return new ValidationViolation(m.labelOf(entity), entity.stepType(), rule, message);
    }

    // ------------------------------------------------------------------
    // 序列化文本
    // ------------------------------------------------------------------

    public static ValidationReport validateSerialized(String stepText) {
        IfcStepReader.StepFile file = IfcStepReader.read(stepText);
        List<ValidationViolation> out = new ArrayList<>();

        for (String warning : file.warnings()) {
            out.add(new ValidationViolation(0, "STEP", ValidationRule.UNPARSEABLE_STATEMENT, warning));
        }

        IfcStepReader.StepHeader header = file.header();
        boolean ifc4 = false;
        if (header != null) {
            for (String schema : header.schemas()) {
                if (IfcModel.SCHEMA.equals(schema == null ? null : schema.trim().toUpperCase(Locale.ROOT))) {
                    ifc4 = true;
                    break;
                }
            }
        }
        if (!ifc4) {
            out.add(new ValidationViolation(0, "FILE_SCHEMA", ValidationRule.HEADER_SCHEMA,
                    "FILE_SCHEMA 必须为 " + IfcModel.SCHEMA
                            + (header == null ? "" : "，实际为 " + header.schemas())));
        }

        for (Integer label : file.duplicateLabels()) {
            out.add(new ValidationViolation(label, "STEP", ValidationRule.DUPLICATE_LABEL, "实例标签重复定义"));
        }

        for (IfcStepReader.StepInstance instance : file.instances().values()) {
            walkSerialized(file, instance, instance.args(), out);
        }

        List<IfcStepReader.StepInstance> projects = file.instancesOfType("IFCPROJECT");
        if (projects.size() != 1) {
            out.add(new ValidationViolation(0, "IFCPROJECT", ValidationRule.PROJECT_COUNT,
                    "文件必须恰好包含 1 个 IFCPROJECT，实际为 " + projects.size()));
        }

        Map<String, Integer> seen = new HashMap<>();
        for (IfcStepReader.StepInstance instance : file.instances().values()) {
            if (!ROOTED_TYPES.contains(instance.typeUpper())) {
                continue;
            }
            String guid = instance.stringAt(0);
            if (!IfcGuid.isValid(guid)) {
                out.add(new ValidationViolation(instance.id(), instance.typeUpper(), ValidationRule.INVALID_GLOBAL_ID,
                        "GlobalId 格式无效：" + guid));
                continue;
            }
            Integer previous = seen.putIfAbsent(guid, instance.id());
            if (previous != null) {
                out.add(new ValidationViolation(instance.id(), instance.typeUpper(), ValidationRule.DUPLICATE_GLOBAL_ID,
                        "GlobalId 与 #" + previous + " 重复：" + guid));
            }
        }
        return new ValidationReport(out);
    }

    private static void walkSerialized(IfcStepReader.StepFile file, IfcStepReader.StepInstance owner,
                                       List<IfcStepReader.StepValue> values, List<ValidationViolation> out) {
        for (IfcStepReader.StepValue value : values) {
            if (value instanceof IfcStepReader.StepRef ref) {
                if (!file.instances().containsKey(ref.id())) {
                    out.add(new ValidationViolation(owner.id(), owner.typeUpper(), ValidationRule.DANGLING_REFERENCE,
                            "引用了不存在的实例 #" + ref.id()));
                }
            } else if (value instanceof IfcStepReader.StepList list) {
                walkSerialized(file, owner, list.items(), out);
            } else if (value instanceof IfcStepReader.StepTyped typed) {
                walkSerialized(file, owner, typed.args(), out);
            }
        }
    }
}
