package org.ifcserver.ifc.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * 校验报告。违规数为 0 即视为有效。
 */
public final class ValidationReport {

    private final List<ValidationViolation> violations;

    public ValidationReport(List<ValidationViolation> violations) {
        this.violations = List.copyOf(violations);
    }

    public static ValidationReport merge(ValidationReport first, ValidationReport second) {
        List<ValidationViolation> all = new ArrayList<>(first.violations);
        all.addAll(second.violations);
        return new ValidationReport(all);
    }

    public List<ValidationViolation> getViolations() {
        return violations;
    }

    public int count() {
        return violations.size();
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public boolean hasViolation(ValidationRule rule) {
        for (ValidationViolation v : violations) {
            if (v.rule() == rule) {
                return true;
            }
        }
        return false;
    }

    public List<String> toLines() {
        List<String> lines = new ArrayList<>(violations.size());
        for (ValidationViolation v : violations) {
            lines.add(v.toLine());
        }
        return lines;
    }

    /**
     * 报告文件内容：首行为汇总，其后每行一条违规。
     */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append(isValid() ? "Model is valid." : "Model has " + count() + " validation error(s).").append('\n');
        for (String line : toLines()) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
