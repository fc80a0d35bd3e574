package dev.flowbridge.model;

/**
 * A structural problem in a generated process. Errors block deployment; warnings do not.
 */
public record ValidationIssue(Kind kind, Severity severity, String nodeId, String message) {

    public enum Kind {
        MISSING_START,
        MULTIPLE_START,
        MISSING_TERMINAL,
        ORPHAN_NODE,
        BROKEN_EDGE,
        INCOMPLETE_CONFIGURATION,
        UNRESOLVED_PLACEHOLDER
    }

    public enum Severity { ERROR, WARNING }

    public static ValidationIssue error(Kind kind, String nodeId, String message) {
        return new ValidationIssue(kind, Severity.ERROR, nodeId, message);
    }

    public static ValidationIssue warning(Kind kind, String nodeId, String message) {
        return new ValidationIssue(kind, Severity.WARNING, nodeId, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
