package org.ifcserver.geometry;

/**
 * 由线段生成墙体时使用的截面宽度与高度。
 */
public record WallDimensions(double width, double height) {

    public static final WallDimensions DEFAULT = new WallDimensions(0.5, 2);

    public WallDimensions {
        if (!Double.isFinite(width) || !Double.isFinite(height)) {
            throw new IllegalArgumentException("墙体宽度/高度必须为有限数值：" + width + " x " + height);
        }
    }
}
