package org.ifcserver.ifc.dto;

import java.util.List;

/**
 * 建筑概要（含下属楼层）。
 */
public record BuildingInfo(
        String globalId,
        String name,
        List<StoreyInfo> storeys
) {
}
