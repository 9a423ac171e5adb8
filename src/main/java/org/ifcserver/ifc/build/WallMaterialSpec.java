package org.ifcserver.ifc.build;

import org.ifcserver.ifc.model.IfcResources;

/**
 * 新建墙体时使用的默认材料分层参数。
 *
 * @param materialName   材料名称
 * @param layerThickness 材料层厚度
 * @param offset         相对墙体参考线的偏移
 * @param direction      分层方向
 * @param sense          分层方向的正负
 */
public record WallMaterialSpec(
        String materialName,
        double layerThickness,
        double offset,
        IfcResources.LayerSetDirection direction,
        IfcResources.DirectionSense sense
) {
    public static WallMaterialSpec defaults() {
        return new WallMaterialSpec(
                "Default wall material",
                10,
                150,
                IfcResources.LayerSetDirection.AXIS2,
                IfcResources.DirectionSense.NEGATIVE
        );
    }
}
