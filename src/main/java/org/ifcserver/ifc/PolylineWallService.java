package org.ifcserver.ifc;

import org.ifcserver.geometry.Polyline;
import org.ifcserver.geometry.PolylineWallExtractor;
import org.ifcserver.geometry.SegmentOutcome;
import org.ifcserver.ifc.build.IfcHierarchyBuilder;
import org.ifcserver.ifc.model.IfcBuildingStorey;
import org.ifcserver.ifc.model.IfcModel;
import org.ifcserver.ifc.model.IfcWallStandardCase;
import org.ifcserver.ifc.model.InvalidModelStateException;
import org.ifcserver.ifc.validation.IfcModelPersister;
import org.ifcserver.ifc.validation.SaveOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 多段线建墙：提取线段 → 每个直线段在各自的事务中建一面墙 → 可选地校验并保存。
 * <p>
 * 某个线段建墙失败只回滚该线段的事务，之前已建的墙保留，失败记入报告。
 */
public class PolylineWallService {

    private static final Logger log = LoggerFactory.getLogger(PolylineWallService.class);

    private final PolylineWallExtractor extractor;
    private final IfcHierarchyBuilder builder;
    private final IfcModelPersister persister;

    public PolylineWallService(PolylineWallExtractor extractor, IfcHierarchyBuilder builder, IfcModelPersister persister) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.persister = Objects.requireNonNull(persister, "persister");
    }

    /**
     * @param storey 目标楼层；为 null 时使用模型中的第一个楼层
     * @param save   处理完成后是否调用 {@link IfcModelPersister#validateAndSave(IfcModel)}
     */
    public PolylineImportReport createWalls(IfcModel model, Polyline polyline, IfcBuildingStorey storey, boolean save) {
        IfcBuildingStorey target = storey != null
                ? storey
                : model.firstOf(IfcBuildingStorey.class)
                .orElseThrow(() -> new InvalidModelStateException("模型中没有楼层，无法由多段线创建墙体"));

        List<SegmentOutcome> outcomes = extractor.extract(polyline);
        List<String> wallIds = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();

        for (SegmentOutcome outcome : outcomes) {
            diagnostics.addAll(outcome.diagnostics());
            if (!(outcome instanceof SegmentOutcome.WallRequest request)) {
                continue;
            }
            try {
                IfcWallStandardCase wall = builder.createWall(model, request.posX(), request.posY(),
                        request.dirX(), request.dirY(), 0, request.length(), request.width(), request.height(), target);
                wallIds.add(wall.getGlobalId());
                diagnostics.add("Wall created: " + wall.getGlobalId());
            } catch (RuntimeException e) {
                log.warn("Failed to create wall for segment {}: {}", request.index(), e.getMessage(), e);
                String failure = "Segment " + request.index() + " : wall creation failed: " + e.getMessage();
                failures.add(failure);
                diagnostics.add(failure);
            }
        }

        log.info("Polyline processed: {} segment(s), {} wall(s) created, {} failure(s)",
                outcomes.size(), wallIds.size(), failures.size());

        SaveOutcome saveOutcome = save ? persister.validateAndSave(model) : null;
        return new PolylineImportReport(target.getGlobalId(), outcomes, wallIds, failures, diagnostics, saveOutcome);
    }
}
