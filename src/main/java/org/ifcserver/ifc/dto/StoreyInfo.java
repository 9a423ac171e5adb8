package org.ifcserver.ifc.dto;

/**
 * 楼层概要。
 *
 * @param globalId   楼层 GlobalId
 * @param name       楼层名
 * @param elevation  标高
 * @param wallCount  包含在该楼层中的墙体数量
 * @param spaceCount 聚合到该楼层的空间数量
 */
public record StoreyInfo(
        String globalId,
        String name,
        double elevation,
        int wallCount,
        int spaceCount
) {
}
