package org.ifcserver.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.ifcserver.geometry.Polyline;
import org.ifcserver.geometry.PolylineVertex;
import org.ifcserver.geometry.SegmentOutcome;
import org.ifcserver.ifc.IfcModelHolder;
import org.ifcserver.ifc.IfcServerProperties;
import org.ifcserver.ifc.PolylineImportReport;
import org.ifcserver.ifc.PolylineWallService;
import org.ifcserver.ifc.build.IfcHierarchyBuilder;
import org.ifcserver.ifc.dto.BuildingInfo;
import org.ifcserver.ifc.dto.EntityCreatedResult;
import org.ifcserver.ifc.dto.ModelFileInfoResult;
import org.ifcserver.ifc.dto.ModelStatusResult;
import org.ifcserver.ifc.dto.PolylineWallsResult;
import org.ifcserver.ifc.dto.ResetResult;
import org.ifcserver.ifc.dto.SaveResult;
import org.ifcserver.ifc.dto.SegmentResult;
import org.ifcserver.ifc.dto.StoreyInfo;
import org.ifcserver.ifc.dto.ValidationResult;
import org.ifcserver.ifc.dto.ViolationEntry;
import org.ifcserver.ifc.model.ElementCompositionType;
import org.ifcserver.ifc.model.IfcBuilding;
import org.ifcserver.ifc.model.IfcBuildingStorey;
import org.ifcserver.ifc.model.IfcModel;
import org.ifcserver.ifc.model.IfcProduct;
import org.ifcserver.ifc.model.IfcProject;
import org.ifcserver.ifc.model.IfcRoot;
import org.ifcserver.ifc.model.IfcSpace;
import org.ifcserver.ifc.model.IfcWallStandardCase;
import org.ifcserver.ifc.step.IfcStepReader;
import org.ifcserver.ifc.validation.IfcModelPersister;
import org.ifcserver.ifc.validation.IfcModelValidator;
import org.ifcserver.ifc.validation.SaveOutcome;
import org.ifcserver.ifc.validation.ValidationReport;
import org.ifcserver.ifc.validation.ValidationViolation;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * IFC 建模 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>查看当前模型（{@code ifc_model_status}）。</li>
 *   <li>建立空间层级：{@code ifc_create_building} / {@code ifc_create_storey} / {@code ifc_create_wall} /
 *       {@code ifc_create_space}。</li>
 *   <li>由多段线批量建墙（{@code ifc_create_walls_from_polyline}），逐段返回诊断。</li>
 *   <li>校验与保存（{@code ifc_validate_model} / {@code ifc_validate_and_save}），重置模型（{@code ifc_reset_model}）。</li>
 *   <li>读取已保存的 IFC 文件摘要（{@code ifc_read_model_file}）。</li>
 * </ul>
 * <p>
 * 并发：工具方法在本对象上串行执行。多段线建墙会连续开启多个事务，串行化保证其间不会插入其他工具的修改。
 */
@Component
public class IfcMcpTools {

    /**
     * 解析 JSON 形式的工具参数（顶点数组、GlobalId 数组）。
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final IfcServerProperties properties;
    private final IfcModelHolder modelHolder;
    private final IfcHierarchyBuilder builder;
    private final PolylineWallService polylineWallService;
    private final IfcModelPersister persister;

    public IfcMcpTools(IfcServerProperties properties, IfcModelHolder modelHolder, IfcHierarchyBuilder builder,
                       PolylineWallService polylineWallService, IfcModelPersister persister) {
        this.properties = properties;
        this.modelHolder = modelHolder;
        this.builder = builder;
        this.polylineWallService = polylineWallService;
        this.persister = persister;
    }

    @Tool(
            name = "ifc_model_status",
            description = "查看当前 IFC 模型：项目名、实例数、建筑/楼层层级（含每层墙体/空间数量）、保存目标与策略。"
    )
    public synchronized ModelStatusResult modelStatus() {
        IfcModel model = modelHolder.getOrCreate();
        return model.read(m -> {
            List<BuildingInfo> buildings = new ArrayList<>();
            for (IfcBuilding building : m.instancesOf(IfcBuilding.class)) {
                List<StoreyInfo> storeys = new ArrayList<>();
                for (IfcBuildingStorey storey : childrenOf(m, building, IfcBuildingStorey.class)) {
                    storeys.add(new StoreyInfo(storey.getGlobalId(), storey.getName(), storey.getElevation(),
                            m.wallsOf(storey).size(), childrenOf(m, storey, IfcSpace.class).size()));
                }
                buildings.add(new BuildingInfo(building.getGlobalId(), building.getName(), storeys));
            }
            return new ModelStatusResult(
                    m.getProjectName(),
                    m.project().map(IfcProject::getGlobalId).orElse(null),
                    m.getSchema(),
                    m.size(),
                    m.currentTransaction().map(t -> t.getName()).orElse(null),
                    buildings,
                    normalizeDisplayPath(persister.targetFile(m).toString()),
                    persister.getPolicy().name()
            );
        });
    }

    @Tool(
            name = "ifc_create_building",
            description = "在当前项目下创建建筑（IfcBuilding，原点放置），并聚合到项目。"
    )
    public synchronized EntityCreatedResult createBuilding(
            @ToolParam(description = "建筑名称") String name
    ) {
        IfcModel model = modelHolder.getOrCreate();
        IfcBuilding building = builder.createBuilding(model, requireName(name, "name"));
        return created(model, building, model.project().map(IfcProject::getGlobalId).orElse(null));
    }

    @Tool(
            name = "ifc_create_storey",
            description = "在建筑下创建楼层（IfcBuildingStorey）。buildingGlobalId 为空时使用第一个建筑。"
    )
    public synchronized EntityCreatedResult createStorey(
            @ToolParam(description = "楼层名称") String name,
            @ToolParam(required = false, description = "标高（默认 0）") Double elevation,
            @ToolParam(required = false, description = "所属建筑的 GlobalId（为空则使用第一个建筑）") String buildingGlobalId
    ) {
        IfcModel model = modelHolder.getOrCreate();
        IfcBuilding building = resolve(model, buildingGlobalId, IfcBuilding.class, "建筑");
        IfcBuildingStorey storey = builder.createStorey(model, requireName(name, "name"),
                elevation == null ? 0 : requireFinite(elevation, "elevation"), building);
        return created(model, storey, building.getGlobalId());
    }

    @Tool(
            name = "ifc_create_wall",
            description = "创建一面标准墙（IfcWallStandardCase）：放置在 (posX,posY,0)，参考方向 (dirX,dirY,0)，"
                    + "矩形截面 length x width 沿 +Z 拉伸 height。storeyGlobalId 为空时使用第一个楼层。"
    )
    public synchronized EntityCreatedResult createWall(
            @ToolParam(description = "放置点 X") double posX,
            @ToolParam(description = "放置点 Y") double posY,
            @ToolParam(description = "参考方向 X") double dirX,
            @ToolParam(description = "参考方向 Y") double dirY,
            @ToolParam(description = "墙长") double length,
            @ToolParam(required = false, description = "墙宽（默认 app.ifc.wall-width）") Double width,
            @ToolParam(required = false, description = "墙高（默认 app.ifc.wall-height）") Double height,
            @ToolParam(required = false, description = "所在楼层的 GlobalId（为空则使用第一个楼层）") String storeyGlobalId
    ) {
        IfcModel model = modelHolder.getOrCreate();
        IfcBuildingStorey storey = resolve(model, storeyGlobalId, IfcBuildingStorey.class, "楼层");
        IfcWallStandardCase wall = builder.createWall(model,
                requireFinite(posX, "posX"), requireFinite(posY, "posY"),
                requireFinite(dirX, "dirX"), requireFinite(dirY, "dirY"), 0,
                requireFinite(length, "length"),
                width == null ? properties.getWallWidth() : requireFinite(width, "width"),
                height == null ? properties.getWallHeight() : requireFinite(height, "height"),
                storey);
        return created(model, wall, storey.getGlobalId());
    }

    @Tool(
            name = "ifc_create_walls_from_polyline",
            description = "由二维多段线逐段建墙：直线段各建一面墙（中点放置、沿线段方向、长度为线段长度），"
                    + "圆弧段与零长度线段只返回诊断。vertices 为 JSON 数组，元素为 {\"x\":0,\"y\":0,\"bulge\":0} 或 [x,y]。"
    )
    public synchronized PolylineWallsResult createWallsFromPolyline(
            @ToolParam(description = "顶点 JSON 数组，例如 [{\"x\":0,\"y\":0},{\"x\":10,\"y\":0,\"bulge\":0.5}] 或 [[0,0],[10,0]]") String vertices,
            @ToolParam(required = false, description = "是否闭合（默认 false）") Boolean closed,
            @ToolParam(required = false, description = "所在楼层的 GlobalId（为空则使用第一个楼层）") String storeyGlobalId,
            @ToolParam(required = false, description = "处理完成后是否校验并保存（默认 true）") Boolean save
    ) {
        Polyline polyline = new Polyline(parseVertices(vertices), Boolean.TRUE.equals(closed));
        IfcModel model = modelHolder.getOrCreate();
        IfcBuildingStorey storey = isBlank(storeyGlobalId) ? null
                : resolve(model, storeyGlobalId, IfcBuildingStorey.class, "楼层");

        PolylineImportReport report = polylineWallService.createWalls(model, polyline, storey, save == null || save);

        List<SegmentResult> segments = new ArrayList<>();
        for (SegmentOutcome outcome : report.outcomes()) {
            segments.add(toSegmentResult(outcome));
        }
        return new PolylineWallsResult(
                report.storeyGlobalId(),
                report.outcomes().size(),
                report.wallsCreated(),
                (int) report.arcsSkipped(),
                (int) report.segmentsSkipped(),
                report.wallGlobalIds(),
                segments,
                report.failures(),
                report.saveOutcome() == null ? null : toSaveResult(report.saveOutcome())
        );
    }

    @Tool(
            name = "ifc_create_space",
            description = "在楼层下创建空间（IfcSpace），并为给定的每面墙建立空间边界（IfcRelSpaceBoundary）。"
                    + "wallGlobalIds 为空时使用该楼层包含的全部墙体。"
    )
    public synchronized EntityCreatedResult createSpace(
            @ToolParam(description = "空间名称") String name,
            @ToolParam(required = false, description = "描述") String description,
            @ToolParam(required = false, description = "长名称") String longName,
            @ToolParam(required = false, description = "组成类型：ELEMENT / COMPLEX / PARTIAL（默认 ELEMENT）") String compositionType,
            @ToolParam(required = false, description = "所在楼层的 GlobalId（为空则使用第一个楼层）") String storeyGlobalId,
            @ToolParam(required = false, description = "边界墙体 GlobalId 的 JSON 数组，例如 [\"2O2Fr$t4X7Zf8NOew3FLOH\"]") String wallGlobalIds
    ) {
        IfcModel model = modelHolder.getOrCreate();
        IfcBuildingStorey storey = resolve(model, storeyGlobalId, IfcBuildingStorey.class, "楼层");
        List<IfcProduct> walls = new ArrayList<>();
        if (isBlank(wallGlobalIds)) {
            walls.addAll(model.wallsOf(storey));
        } else {
            for (String guid : parseStringArray(wallGlobalIds, "wallGlobalIds")) {
                walls.add(resolve(model, guid, IfcWallStandardCase.class, "墙体"));
            }
        }
        IfcSpace space = builder.createSpace(model, storey, walls, requireName(name, "name"), description, longName,
                ElementCompositionType.parse(compositionType));
        return created(model, space, storey.getGlobalId());
    }

    @Tool(
            name = "ifc_validate_model",
            description = "校验当前模型（引用完整性、项目/单位/上下文、GlobalId、墙体几何与材料、层级挂接），返回违规明细。"
    )
    public synchronized ValidationResult validateModel() {
        return toValidationResult(IfcModelValidator.validate(modelHolder.getOrCreate()));
    }

    @Tool(
            name = "ifc_validate_and_save",
            description = "校验并保存当前模型到 <output-directory>/<projectName>.ifc；"
                    + "默认策略 VALIDATE_THEN_SAVE 下校验失败不写文件。"
    )
    public synchronized SaveResult validateAndSave() {
        return toSaveResult(persister.validateAndSave(modelHolder.getOrCreate()));
    }

    @Tool(
            name = "ifc_reset_model",
            description = "丢弃当前模型并重新创建（项目初始化 + 可选的默认建筑/楼层）。未保存的修改会丢失。"
    )
    public synchronized ResetResult resetModel() {
        int previousInstances = modelHolder.reset().map(IfcModel::size).orElse(-1);
        IfcModel fresh = modelHolder.getOrCreate();
        return new ResetResult(previousInstances >= 0, Math.max(previousInstances, 0), fresh.getProjectName(), fresh.size());
    }

    @Tool(
            name = "ifc_read_model_file",
            description = "读取 IFC 文件并返回摘要（HEADER、实体类型计数、项目/建筑/楼层名称）。"
                    + "path 为空时读取当前模型的保存目标；相对路径基于 app.ifc.output-directory。"
    )
    public synchronized ModelFileInfoResult readModelFile(
            @ToolParam(required = false, description = "IFC 文件路径（仅支持 .ifc，且必须位于输出目录内）") String path
    ) {
        Path file = isBlank(path)
                ? persister.targetFile(modelHolder.getOrCreate())
                : persister.getOutputDirectory().resolve(path.trim()).toAbsolutePath().normalize();
        if (!file.startsWith(persister.getOutputDirectory())) {
            throw new IllegalArgumentException("路径不在输出目录范围内：" + path.trim());
        }
        if (!file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".ifc")) {
            throw new IllegalArgumentException("不是 IFC 文件（仅支持 .ifc）：" + normalizeDisplayPath(file.toString()));
        }
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("文件不存在：" + normalizeDisplayPath(file.toString()));
        }
        try {
            byte[] bytes = Files.readAllBytes(file);
            String text = new String(bytes, StandardCharsets.UTF_8);
            return new ModelFileInfoResult(normalizeDisplayPath(file.toString()), bytes.length,
                    IfcStepReader.readInfo(text, properties.getReadTopEntityTypes()));
        } catch (IOException e) {
            throw new IllegalStateException("读取 IFC 文件失败：" + normalizeDisplayPath(file.toString()), e);
        }
    }

    // ------------------------------------------------------------------
    // 参数解析
    // ------------------------------------------------------------------

    static List<PolylineVertex> parseVertices(String json) {
        if (isBlank(json)) {
            throw new IllegalArgumentException("参数错误：vertices 不能为空");
        }
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException("vertices 不是合法的 JSON：" + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("vertices 格式错误：必须是 JSON 数组");
        }
        List<PolylineVertex> out = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            if (node.isArray()) {
                if (node.size() < 2) {
                    throw new IllegalArgumentException("vertices[" + index + "] 至少需要 [x, y]");
                }
                out.add(new PolylineVertex(number(node.get(0), index, "x"), number(node.get(1), index, "y"),
                        node.size() > 2 ? number(node.get(2), index, "bulge") : 0, 0, 0));
            } else if (node.isObject()) {
                out.add(new PolylineVertex(
                        number(node.get("x"), index, "x"),
                        number(node.get("y"), index, "y"),
                        optionalNumber(node.get("bulge"), index, "bulge"),
                        optionalNumber(node.get("startWidth"), index, "startWidth"),
                        optionalNumber(node.get("endWidth"), index, "endWidth")));
            } else {
                throw new IllegalArgumentException("vertices[" + index + "] 必须是对象或数组");
            }
            index++;
        }
        return out;
    }

    static List<String> parseStringArray(String json, String field) {
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException(field + " 不是合法的 JSON：" + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException(field + " 格式错误：必须是 JSON 字符串数组");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode node : root) {
            if (!node.isTextual() || node.asText().isBlank()) {
                throw new IllegalArgumentException(field + " 格式错误：元素必须是非空字符串");
            }
            out.add(node.asText().trim());
        }
        return out;
    }

    private static double number(JsonNode node, int index, String field) {
        if (node == null || !node.isNumber()) {
            throw new IllegalArgumentException("vertices[" + index + "]." + field + " 必须是数字");
        }
        return node.asDouble();
    }

    private static double optionalNumber(JsonNode node, int index, String field) {
        if (node == null || node.isNull()) {
            return 0;
        }
        return number(node, index, field);
    }

    private static String requireName(String value, String field) {
        if (isBlank(value)) {
            throw new IllegalArgumentException("参数错误：" + field + " 不能为空");
        }
        return value.trim();
    }

    private static double requireFinite(double value, String field) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("参数错误：" + field + " 必须是有限数值");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ------------------------------------------------------------------
    // 模型查询与结果转换
    // ------------------------------------------------------------------

    /**
     * 按 GlobalId 查找指定类型的实体；GlobalId 为空时返回该类型的第一个实体。
     */
    private static <T extends IfcRoot> T resolve(IfcModel model, String globalId, Class<T> type, String what) {
        if (isBlank(globalId)) {
            return model.firstOf(type)
                    .orElseThrow(() -> new IllegalArgumentException("模型中没有" + what + "，请先创建或指定 GlobalId"));
        }
        IfcRoot found = model.findByGlobalId(globalId)
                .orElseThrow(() -> new IllegalArgumentException("找不到 GlobalId 对应的实体：" + globalId.trim()));
        if (!type.isInstance(found)) {
            throw new IllegalArgumentException("GlobalId " + globalId.trim() + " 不是" + what + "：" + found.stepType());
        }
        return type.cast(found);
    }

    private static <T extends IfcRoot> List<T> childrenOf(IfcModel model, IfcRoot parent, Class<T> type) {
        List<T> out = new ArrayList<>();
        model.decomposedBy(parent).ifPresent(rel -> {
            for (IfcRoot child : rel.getRelated()) {
                if (type.isInstance(child)) {
                    out.add(type.cast(child));
                }
            }
        });
        return out;
    }

    private static EntityCreatedResult created(IfcModel model, IfcRoot entity, String parentGlobalId) {
        return new EntityCreatedResult(entity.getGlobalId(), entity.stepType(), entity.getName(), model.labelOf(entity),
                parentGlobalId, model.size());
    }

    private static SegmentResult toSegmentResult(SegmentOutcome outcome) {
        if (outcome instanceof SegmentOutcome.WallRequest wall) {
            return new SegmentResult(wall.index(), "WALL", null, wall.diagnostics());
        }
        if (outcome instanceof SegmentOutcome.UnsupportedArc arc) {
            return new SegmentResult(arc.index(), "UNSUPPORTED_ARC", "arc segments are not converted to walls",
                    arc.diagnostics());
        }
        SegmentOutcome.SkippedSegment skipped = (SegmentOutcome.SkippedSegment) outcome;
        return new SegmentResult(skipped.index(), "SKIPPED", skipped.reason(), skipped.diagnostics());
    }

    static ValidationResult toValidationResult(ValidationReport report) {
        List<ViolationEntry> entries = new ArrayList<>(report.count());
        for (ValidationViolation v : report.getViolations()) {
            entries.add(new ViolationEntry(v.label(), v.entityType(), v.rule().name(), v.message()));
        }
        return new ValidationResult(report.isValid(), report.count(), entries);
    }

    static SaveResult toSaveResult(SaveOutcome outcome) {
        return new SaveResult(
                outcome.saved(),
                normalizeDisplayPath(outcome.file().toString()),
                outcome.reportFile() == null ? null : normalizeDisplayPath(outcome.reportFile().toString()),
                outcome.bytes(),
                outcome.policy().name(),
                toValidationResult(outcome.report())
        );
    }

    private static String normalizeDisplayPath(String path) {
        if (path == null) {
            return null;
        }
        return path.replace('\\', '/');
    }
}
