package org.ifcserver.ifc.dto;

public record ViolationEntry(
        int label,
        String entityType,
        String rule,
        String message
) {
}
