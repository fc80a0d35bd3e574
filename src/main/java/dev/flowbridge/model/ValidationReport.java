package dev.flowbridge.model;

import java.util.List;

/**
 * Verdict of the validator for one document.
 */
public record ValidationReport(ValidationStatus status, List<ValidationIssue> issues) {

    public ValidationReport {
        issues = List.copyOf(issues);
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> !i.isError()).toList();
    }

    public boolean accepted() {
        return status == ValidationStatus.VALIDATED;
    }
}
