package org.ifcserver.ifc.model;

import java.util.List;

/**
 * STEP 文件头部信息（FILE_DESCRIPTION / FILE_NAME / FILE_SCHEMA）。
 * <p>
 * 时间戳不在这里保存，由写出时生成。
 */
public record IfcModelHeader(
        List<String> fileDescriptions,
        String implementationLevel,
        List<String> authors,
        List<String> organizations,
        String preprocessorVersion,
        String originatingSystem,
        String authorization,
        String schema
) {
    public IfcModelHeader {
        fileDescriptions = List.copyOf(fileDescriptions);
        authors = List.copyOf(authors);
        organizations = List.copyOf(organizations);
    }
}
