package org.ifcserver.ifc.validation;

import org.ifcserver.ifc.model.IfcModel;
import org.ifcserver.ifc.step.IfcStepWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * 校验并保存模型到 {@code <outputDirectory>/<projectName>.ifc}。
 * <p>
 * 流程：
 * <ol>
 *   <li>校验内存模型；</li>
 *   <li>写出 STEP 文本并回读校验序列化结果；</li>
 *   <li>按 {@link SavePolicy} 决定是否落盘（先写同目录临时文件，再 move 替换目标文件）。</li>
 * </ol>
 */
public class IfcModelPersister {

    public static final String REPORT_SUFFIX = ".validation.txt";

    private static final Logger log = LoggerFactory.getLogger(IfcModelPersister.class);

    private final Path outputDirectory;
    private final SavePolicy policy;

    public IfcModelPersister(Path outputDirectory, SavePolicy policy) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory").toAbsolutePath().normalize();
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public SavePolicy getPolicy() {
        return policy;
    }

    public Path targetFile(IfcModel model) {
        return outputDirectory.resolve(model.getFileName());
    }

    public SaveOutcome validateAndSave(IfcModel model) {
        Path target = targetFile(model);
        ValidationReport modelReport = IfcModelValidator.validate(model);
        String stepText = IfcStepWriter.write(model);
        ValidationReport report = ValidationReport.merge(modelReport, IfcModelValidator.validateSerialized(stepText));

        if (policy == SavePolicy.VALIDATE_THEN_SAVE && !report.isValid()) {
            log.warn("Model '{}' has {} validation error(s), not saved to {}",
                    model.getProjectName(), report.count(), target);
            for (String line : report.toLines()) {
                log.warn("  {}", line);
            }
            return new SaveOutcome(false, target, null, 0L, policy, report);
        }

        byte[] bytes = stepText.getBytes(StandardCharsets.UTF_8);
        Path reportFile = null;
        try {
            Files.createDirectories(outputDirectory);
            writeAtomically(target, bytes);
            if (policy == SavePolicy.SAVE_WITH_REPORT) {
                reportFile = target.resolveSibling(target.getFileName() + REPORT_SUFFIX);
                writeAtomically(reportFile, report.toText().getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("保存 IFC 文件失败：" + target, e);
        }

        if (report.isValid()) {
            log.info("Saved model '{}' to {} ({} bytes)", model.getProjectName(), target, bytes.length);
        } else {
            log.warn("Saved model '{}' to {} with {} validation error(s), see {}",
                    model.getProjectName(), target, report.count(), reportFile);
        }
        return new SaveOutcome(true, target, reportFile, bytes.length, policy, report);
    }

    private static void writeAtomically(Path target, byte[] bytes) throws IOException {
        // 临时文件放在目标同目录，保证 move 不跨文件系统
        Path parent = target.getParent();
        if (parent == null) {
            throw new IllegalArgumentException("目标路径无效：" + target);
        }
        Path tmp = Files.createTempFile(parent, "ifc-write-", ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.debug("Failed to delete temp file {}", tmp, e);
            }
        }
    }
}
