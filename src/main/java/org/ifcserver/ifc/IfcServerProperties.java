package org.ifcserver.ifc;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.ifcserver.ifc.model.IfcResources;
import org.ifcserver.ifc.validation.SavePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * IFC 建模 MCP Server 的业务配置（{@code app.ifc.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #projectName} 决定模型名与输出文件名 {@code <projectName>.ifc}。</li>
 *   <li>{@link #createDefaultHierarchy} 为 true 时，首次创建模型会同时建立默认建筑与楼层，
 *       多段线建墙可以直接落到第一个楼层上。</li>
 *   <li>{@link #savePolicy} 控制校验失败时是否仍然写出文件。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.ifc")
public class IfcServerProperties {

    /**
     * 项目名（IfcProject.Name），同时作为输出文件名。
     */
    @NotBlank
    private String projectName = "TestProject";

    /**
     * {@code .ifc} 文件输出目录。
     */
    @NotBlank
    private String outputDirectory = ".";

    /**
     * 首次创建模型时是否同时建立默认建筑与楼层。
     */
    private boolean createDefaultHierarchy = true;

    @NotBlank
    private String defaultBuildingName = "Default Building";

    @NotBlank
    private String defaultStoreyName = "Default Building Storey";

    private double defaultStoreyElevation = 0;

    /**
     * 多段线建墙使用的墙体宽度。
     */
    @DecimalMin(value = "0", inclusive = false)
    private double wallWidth = 0.5;

    /**
     * 多段线建墙使用的墙体高度。
     */
    @DecimalMin(value = "0", inclusive = false)
    private double wallHeight = 2;

    @NotBlank
    private String materialName = "Default wall material";

    @DecimalMin(value = "0", inclusive = false)
    private double materialLayerThickness = 10;

    private double materialOffset = 150;

    @NotNull
    private IfcResources.LayerSetDirection materialLayerDirection = IfcResources.LayerSetDirection.AXIS2;

    @NotNull
    private IfcResources.DirectionSense materialDirectionSense = IfcResources.DirectionSense.NEGATIVE;

    /**
     * 保存策略（默认：校验通过才写文件）。
     */
    @NotNull
    private SavePolicy savePolicy = SavePolicy.VALIDATE_THEN_SAVE;

    /**
     * {@code ifc_read_model_file} 返回的实体类型计数上限。
     */
    private int readTopEntityTypes = 30;

    /**
     * 写入 IfcOwnerHistory 与文件头的编辑者信息。
     */
    @Valid
    @NotNull
    private Credentials credentials = new Credentials();

    public String getProjectName() {
        return projectName;
    }

    public void setProjectName(String projectName) {
        this.projectName = projectName;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public boolean isCreateDefaultHierarchy() {
        return createDefaultHierarchy;
    }

    public void setCreateDefaultHierarchy(boolean createDefaultHierarchy) {
        this.createDefaultHierarchy = createDefaultHierarchy;
    }

    public String getDefaultBuildingName() {
        return defaultBuildingName;
    }

    public void setDefaultBuildingName(String defaultBuildingName) {
        this.defaultBuildingName = defaultBuildingName;
    }

    public String getDefaultStoreyName() {
        return defaultStoreyName;
    }

    public void setDefaultStoreyName(String defaultStoreyName) {
        this.defaultStoreyName = defaultStoreyName;
    }

    public double getDefaultStoreyElevation() {
        return defaultStoreyElevation;
    }

    public void setDefaultStoreyElevation(double defaultStoreyElevation) {
        this.defaultStoreyElevation = defaultStoreyElevation;
    }

    public double getWallWidth() {
        return wallWidth;
    }

    public void setWallWidth(double wallWidth) {
        this.wallWidth = wallWidth;
    }

    public double getWallHeight() {
        return wallHeight;
    }

    public void setWallHeight(double wallHeight) {
        this.wallHeight = wallHeight;
    }

    public String getMaterialName() {
        return materialName;
    }

    public void setMaterialName(String materialName) {
        this.materialName = materialName;
    }

    public double getMaterialLayerThickness() {
        return materialLayerThickness;
    }

    public void setMaterialLayerThickness(double materialLayerThickness) {
        this.materialLayerThickness = materialLayerThickness;
    }

    public double getMaterialOffset() {
        return materialOffset;
    }

    public void setMaterialOffset(double materialOffset) {
        this.materialOffset = materialOffset;
    }

    public IfcResources.LayerSetDirection getMaterialLayerDirection() {
        return materialLayerDirection;
    }

    public void setMaterialLayerDirection(IfcResources.LayerSetDirection materialLayerDirection) {
        this.materialLayerDirection = materialLayerDirection;
    }

    public IfcResources.DirectionSense getMaterialDirectionSense() {
        return materialDirectionSense;
    }

    public void setMaterialDirectionSense(IfcResources.DirectionSense materialDirectionSense) {
        this.materialDirectionSense = materialDirectionSense;
    }

    public SavePolicy getSavePolicy() {
        return savePolicy;
    }

    public void setSavePolicy(SavePolicy savePolicy) {
        this.savePolicy = savePolicy;
    }

    public int getReadTopEntityTypes() {
        return readTopEntityTypes;
    }

    public void setReadTopEntityTypes(int readTopEntityTypes) {
        this.readTopEntityTypes = readTopEntityTypes;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public void setCredentials(Credentials credentials) {
        this.credentials = credentials;
    }

    /**
     * 编辑者凭据（{@code app.ifc.credentials.*}）。
     */
    public static class Credentials {

        @NotBlank
        private String developersName = "ifc-server developer";

        @NotBlank
        private String applicationName = "mcp-server-ifc";

        @NotBlank
        private String applicationId = "mcp-server-ifc";

        @NotBlank
        private String applicationVersion = "1.0";

        private String editorsFamilyName = "team";

        private String editorsGivenName = "x";

        private String editorsOrganisationName = "y";

        public String getDevelopersName() {
            return developersName;
        }

        public void setDevelopersName(String developersName) {
            this.developersName = developersName;
        }

        public String getApplicationName() {
            return applicationName;
        }

        public void setApplicationName(String applicationName) {
            this.applicationName = applicationName;
        }

        public String getApplicationId() {
            return applicationId;
        }

        public void setApplicationId(String applicationId) {
            this.applicationId = applicationId;
        }

        public String getApplicationVersion() {
            return applicationVersion;
        }

        public void setApplicationVersion(String applicationVersion) {
            this.applicationVersion = applicationVersion;
        }

        public String getEditorsFamilyName() {
            return editorsFamilyName;
        }

        public void setEditorsFamilyName(String editorsFamilyName) {
            this.editorsFamilyName = editorsFamilyName;
        }

        public String getEditorsGivenName() {
            return editorsGivenName;
        }

        public void setEditorsGivenName(String editorsGivenName) {
            this.editorsGivenName = editorsGivenName;
        }

        public String getEditorsOrganisationName() {
            return editorsOrganisationName;
        }

        public void setEditorsOrganisationName(String editorsOrganisationName) {
            this.editorsOrganisationName = editorsOrganisationName;
        }
    }
}
