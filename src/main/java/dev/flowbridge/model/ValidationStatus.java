package dev.flowbridge.model;

import java.util.List;

/**
 * Lifecycle of a generated document: every document starts as a draft and is concluded
 * exactly once, to validated (warnings at most) or rejected (at least one error).
 */
public enum ValidationStatus {
    DRAFT,
    VALIDATED,
    REJECTED;

    public ValidationStatus conclude(List<ValidationIssue> issues) {
        if (this != DRAFT) {
            throw new IllegalStateException("Document already concluded as " + this);
        }
        return issues.stream().anyMatch(ValidationIssue::isError) ? REJECTED : VALIDATED;
    }
}
