package org.ifcserver.ifc.validation;

/**
 * 校验规则编号。报告中的每条违规都归属一条规则，便于调用方按规则筛选。
 */
public enum ValidationRule {
    UNREGISTERED_REFERENCE,
    NON_FINITE_NUMBER,
    PROJECT_COUNT,
    PROJECT_UNITS,
    PROJECT_CONTEXT,
    INVALID_GLOBAL_ID,
    DUPLICATE_GLOBAL_ID,
    FOREIGN_CONTEXT,
    WALL_PLACEMENT,
    WALL_REPRESENTATION,
    WALL_MATERIAL,
    NON_POSITIVE_DIMENSION,
    ZERO_DIRECTION,
    DETACHED_ELEMENT,
    EMPTY_RELATION,
    HEADER_SCHEMA,
    DUPLICATE_LABEL,
    DANGLING_REFERENCE,
    UNPARSEABLE_STATEMENT
}
