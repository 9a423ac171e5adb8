package org.ifcserver.ifc.step;

import java.util.List;

/**
 * IFC 文件摘要：HEADER 段信息 + DATA 段中空间层级的名称线索。
 *
 * @param fileDescriptions    {@code FILE_DESCRIPTION} 的 description 列表
 * @param implementationLevel {@code FILE_DESCRIPTION} 的实现级别
 * @param fileName            {@code FILE_NAME} 的 name
 * @param timeStamp           {@code FILE_NAME} 的 time_stamp
 * @param authors             {@code FILE_NAME} 的 author 列表
 * @param organizations       {@code FILE_NAME} 的 organization 列表
 * @param preprocessorVersion {@code FILE_NAME} 的 preprocessor_version
 * @param originatingSystem   {@code FILE_NAME} 的 originating_system
 * @param schemas             {@code FILE_SCHEMA} 列表（本项目写出的是 IFC4）
 * @param entityCount         DATA 段实例数
 * @param topEntityTypes      实例类型计数（按数量降序）
 * @param projectName         IFCPROJECT 的 Name
 * @param buildingNames       IFCBUILDING 的 Name
 * @param storeyNames         IFCBUILDINGSTOREY 的 Name
 * @param wallCount           IFCWALLSTANDARDCASE 数量
 * @param spaceCount          IFCSPACE 数量
 * @param warnings            非致命告警
 */
public record IfcFileSummary(
        List<String> fileDescriptions,
        String implementationLevel,
        String fileName,
        String timeStamp,
        List<String> authors,
        List<String> organizations,
        String preprocessorVersion,
        String originatingSystem,
        List<String> schemas,
        int entityCount,
        List<TypeCount> topEntityTypes,
        String projectName,
        List<String> buildingNames,
        List<String> storeyNames,
        int wallCount,
        int spaceCount,
        List<String> warnings
) {

    /**
     * @param type  实体类型名（大写，如 IFCWALLSTANDARDCASE）
     * @param count 出现次数
     */
    public record TypeCount(String type, int count) {
    }
}
