package io.prompty.core.model;

import java.util.Comparator;
import java.util.List;

/**
 * Outcome of validating template source without executing it. Issues are ordered by position;
 * issues without a position come first.
 */
public final class ValidationResult {

    private static final Comparator<ValidationIssue> BY_POSITION =
            Comparator.comparingInt((ValidationIssue i) -> i.position().offset());

    private final List<ValidationIssue> issues;

    public ValidationResult(List<ValidationIssue> issues) {
        this.issues = issues.stream().sorted(BY_POSITION).toList();
    }

    public List<ValidationIssue> issues() {
        return issues;
    }

    /** {@code true} when no issue has {@link Severity#ERROR} severity. */
    public boolean isValid() {
        return errors().isEmpty();
    }

    public List<ValidationIssue> errors() {
        return bySeverity(Severity.ERROR);
    }

    public List<ValidationIssue> warnings() {
        return bySeverity(Severity.WARNING);
    }

    public List<ValidationIssue> infos() {
        return bySeverity(Severity.INFO);
    }

    private List<ValidationIssue> bySeverity(Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).toList();
    }

    @Override
    public String toString() {
        return "ValidationResult" + issues;
    }
}
