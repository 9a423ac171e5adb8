package org.ifcserver.ifc.build;

import org.ifcserver.ifc.model.EditorCredentials;
import org.ifcserver.ifc.model.IfcGeometry;
import org.ifcserver.ifc.model.IfcGuid;
import org.ifcserver.ifc.model.IfcModel;
import org.ifcserver.ifc.model.IfcModelHeader;
import org.ifcserver.ifc.model.IfcProject;
import org.ifcserver.ifc.model.IfcResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * 模型创建与初始化：归属信息、单位、几何上下文、项目。
 */
public final class IfcModelFactory {

    /**
     * 头部 FILE_DESCRIPTION 中必须出现的视图定义，否则部分查看器会报头部错误。
     */
    public static final String VIEW_DEFINITION = "ViewDefinition [CoordinationView]";

    private static final Logger log = LoggerFactory.getLogger(IfcModelFactory.class);

    private IfcModelFactory() {
    }

    public static EditorCredentials createCredentials(String developersName, String applicationName, String applicationId,
                                                      String applicationVersion, String editorsFamilyName,
                                                      String editorsGivenName, String editorsOrganisationName) {
        return new EditorCredentials(developersName, applicationName, applicationId, applicationVersion,
                editorsFamilyName, editorsGivenName, editorsOrganisationName);
    }

    public static EditorCredentials createDefaultCredentials() {
        return createCredentials("ifc-server developer", "mcp-server-ifc", "mcp-server-ifc", "1.0",
                "team", "x", "y");
    }

    /**
     * 创建只有头部、没有任何实例的模型（尚未初始化项目）。
     */
    public static IfcModel createEmptyModel(EditorCredentials credentials, String projectName) {
        return new IfcModel(projectName, credentials, headerFor(credentials));
    }

    /**
     * 创建模型并在“Initialise Model”事务中建立项目（SI 单位：毫米/米，唯一的几何表达上下文）。
     */
    public static IfcModel createAndInitModel(EditorCredentials credentials, String projectName) {
        IfcModel model = createEmptyModel(credentials, projectName);
        model.runInTransaction("Initialise Model", m -> {
            IfcResources.OwnerHistory ownerHistory = createOwnerHistory(m, credentials);

            IfcResources.UnitAssignment units = m.newInstance(new IfcResources.UnitAssignment(List.of(
                    m.newInstance(new IfcResources.SiUnit(IfcResources.UnitType.LENGTHUNIT,
                            IfcResources.SiPrefix.MILLI, IfcResources.SiUnitName.METRE)),
                    m.newInstance(new IfcResources.SiUnit(IfcResources.UnitType.AREAUNIT,
                            null, IfcResources.SiUnitName.SQUARE_METRE)),
                    m.newInstance(new IfcResources.SiUnit(IfcResources.UnitType.VOLUMEUNIT,
                            null, IfcResources.SiUnitName.CUBIC_METRE)),
                    m.newInstance(new IfcResources.SiUnit(IfcResources.UnitType.PLANEANGLEUNIT,
                            null, IfcResources.SiUnitName.RADIAN)),
                    m.newInstance(new IfcResources.SiUnit(IfcResources.UnitType.TIMEUNIT,
                            null, IfcResources.SiUnitName.SECOND))
            )));

            IfcGeometry.CartesianPoint origin = m.newInstance(IfcGeometry.CartesianPoint.of(0, 0, 0));
            IfcGeometry.Axis2Placement3D wcs = m.newInstance(new IfcGeometry.Axis2Placement3D(origin, null, null));
            IfcGeometry.Direction trueNorth = m.newInstance(IfcGeometry.Direction.of(0, 1));
            IfcGeometry.GeometricRepresentationContext context = m.newInstance(
                    new IfcGeometry.GeometricRepresentationContext(null, "Model", 3, 1e-5, wcs, trueNorth));

            return m.newInstance(new IfcProject(IfcGuid.newGuid(), ownerHistory, projectName, List.of(context), units));
        });
        log.info("Initialised IFC model for project '{}'", projectName);
        return model;
    }

    private static IfcResources.OwnerHistory createOwnerHistory(IfcModel m, EditorCredentials credentials) {
        IfcResources.Person person = m.newInstance(new IfcResources.Person(null,
                credentials.editorsFamilyName(), credentials.editorsGivenName()));
        IfcResources.Organization editorsOrganization = m.newInstance(new IfcResources.Organization(null,
                credentials.editorsOrganisationName()));
        IfcResources.PersonAndOrganization user = m.newInstance(
                new IfcResources.PersonAndOrganization(person, editorsOrganization));
        IfcResources.Organization developer = m.newInstance(new IfcResources.Organization(null,
                credentials.developersName()));
        IfcResources.Application application = m.newInstance(new IfcResources.Application(developer,
                credentials.applicationVersion(), credentials.applicationName(), credentials.applicationId()));
        return m.newInstance(new IfcResources.OwnerHistory(user, application, IfcResources.ChangeAction.ADDED,
                Instant.now().getEpochSecond()));
    }

    private static IfcModelHeader headerFor(EditorCredentials credentials) {
        String author = joinNonBlank(credentials.editorsGivenName(), credentials.editorsFamilyName());
        return new IfcModelHeader(
                List.of(VIEW_DEFINITION),
                "2;1",
                author.isEmpty() ? List.of() : List.of(author),
                credentials.editorsOrganisationName() == null ? List.of() : List.of(credentials.editorsOrganisationName()),
                joinNonBlank(credentials.applicationName(), credentials.applicationVersion()),
                credentials.applicationId(),
                "",
                IfcModel.SCHEMA
        );
    }

    private static String joinNonBlank(String a, String b) {
        StringBuilder sb = new StringBuilder();
        if (a != null && !a.isBlank()) {
            sb.append(a.trim());
        }
        if (b != null && !b.isBlank()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(b.trim());
        }
        return sb.toString();
    }
}
