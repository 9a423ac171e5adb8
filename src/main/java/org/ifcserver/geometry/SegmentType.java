package org.ifcserver.geometry;

/**
 * 多段线中以某个顶点为起点的线段类型。
 */
public enum SegmentType {
    /**
     * 直线段。
     */
    LINE,
    /**
     * 圆弧段（起点凸度非 0）。
     */
    ARC,
    /**
     * 起点与终点重合的零长度线段。
     */
    COINCIDENT,
    /**
     * 没有后继顶点（开放多段线的最后一个顶点，或只有一个顶点）。
     */
    POINT
}
