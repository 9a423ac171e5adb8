package org.ifcserver.ifc;

import org.ifcserver.geometry.PolylineWallExtractor;
import org.ifcserver.geometry.WallDimensions;
import org.ifcserver.ifc.build.IfcHierarchyBuilder;
import org.ifcserver.ifc.build.IfcModelFactory;
import org.ifcserver.ifc.build.WallMaterialSpec;
import org.ifcserver.ifc.model.EditorCredentials;
import org.ifcserver.ifc.model.IfcBuilding;
import org.ifcserver.ifc.model.IfcModel;
import org.ifcserver.ifc.validation.IfcModelPersister;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * IFC 建模服务的 Bean 装配：把 {@link IfcServerProperties} 注入到构建器、持久化与模型持有者中。
 */
@Configuration(proxyBeanMethods = false)
public class IfcServerConfiguration {

    @Bean
    public IfcHierarchyBuilder ifcHierarchyBuilder(IfcServerProperties properties) {
        return new IfcHierarchyBuilder(new WallMaterialSpec(
                properties.getMaterialName(),
                properties.getMaterialLayerThickness(),
                properties.getMaterialOffset(),
                properties.getMaterialLayerDirection(),
                properties.getMaterialDirectionSense()
        ));
    }

    @Bean
    public IfcModelPersister ifcModelPersister(IfcServerProperties properties) {
        return new IfcModelPersister(Path.of(properties.getOutputDirectory()), properties.getSavePolicy());
    }

    @Bean
    public PolylineWallExtractor polylineWallExtractor(IfcServerProperties properties) {
        return new PolylineWallExtractor(new WallDimensions(properties.getWallWidth(), properties.getWallHeight()));
    }

    @Bean
    public PolylineWallService polylineWallService(PolylineWallExtractor extractor, IfcHierarchyBuilder builder,
                                                   IfcModelPersister persister) {
        return new PolylineWallService(extractor, builder, persister);
    }

    @Bean
    public IfcModelHolder ifcModelHolder(IfcServerProperties properties, IfcHierarchyBuilder builder) {
        return new IfcModelHolder(() -> createModel(properties, builder));
    }

    static EditorCredentials credentialsOf(IfcServerProperties properties) {
        IfcServerProperties.Credentials c = properties.getCredentials();
        return IfcModelFactory.createCredentials(c.getDevelopersName(), c.getApplicationName(), c.getApplicationId(),
                c.getApplicationVersion(), c.getEditorsFamilyName(), c.getEditorsGivenName(),
                c.getEditorsOrganisationName());
    }

    static IfcModel createModel(IfcServerProperties properties, IfcHierarchyBuilder builder) {
        IfcModel model = IfcModelFactory.createAndInitModel(credentialsOf(properties), properties.getProjectName());
        if (properties.isCreateDefaultHierarchy()) {
            IfcBuilding building = builder.createBuilding(model, properties.getDefaultBuildingName());
            builder.createStorey(model, properties.getDefaultStoreyName(), properties.getDefaultStoreyElevation(), building);
        }
        return model;
    }
}
