package dev.flowbridge.engine;

import dev.flowbridge.model.*;
import dev.flowbridge.model.ValidationIssue.Kind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural checks on a generated process before it may be published.
 * Every rule runs; issues are collected, never thrown.
 */
public final class ProcessValidator {

    private ProcessValidator() {}

    /**
     * Validate a process document. The report is {@code VALIDATED} when no
     * issue is an error, {@code REJECTED} otherwise.
     */
    public static ValidationReport validate(ProcessDocument process) {
        var issues = new ArrayList<ValidationIssue>();
        Set<String> ids = process.nodes().stream().map(TargetNode::id).collect(Collectors.toSet());

        // Rule 1: exactly one start shape
        List<TargetNode> starts = process.nodesOfKind(ShapeKind.START);
        if (starts.isEmpty()) {
            issues.add(ValidationIssue.error(Kind.MISSING_START, null, "Process has no start shape"));
        } else if (starts.size() > 1) {
            for (TargetNode extra : starts.subList(1, starts.size())) {
                issues.add(ValidationIssue.error(Kind.MULTIPLE_START, extra.id(),
                    "Process has %d start shapes".formatted(starts.size())));
            }
        }

        // Rule 2: at least one terminal shape
        if (process.nodes().stream().noneMatch(n -> n.kind().isTerminal())) {
            issues.add(ValidationIssue.error(Kind.MISSING_TERMINAL, null, "Process has no stop or exception shape"));
        }

        // Rule 3: connections reference existing shapes
        for (TargetEdge edge : process.edges()) {
            for (String end : List.of(edge.fromId(), edge.toId())) {
                if (!ids.contains(end)) {
                    issues.add(ValidationIssue.error(Kind.BROKEN_EDGE, edge.fromId(),
                        "Connection %s -> %s refers to unknown shape '%s'"
                            .formatted(edge.fromId(), edge.toId(), end)));
                }
            }
        }

        for (TargetNode node : process.nodes()) {
            // Rule 4: every shape is reachable and leads somewhere
            if (node.kind() != ShapeKind.START && process.incoming(node.id()).isEmpty()) {
                issues.add(ValidationIssue.error(Kind.ORPHAN_NODE, node.id(),
                    "Shape '%s' (%s) has no incoming connection".formatted(node.id(), node.label())));
            }
            if (!node.kind().isTerminal() && process.outgoing(node.id()).isEmpty()) {
                issues.add(ValidationIssue.error(Kind.ORPHAN_NODE, node.id(),
                    "Shape '%s' (%s) has no outgoing connection".formatted(node.id(), node.label())));
            }

            // Rule 5: required configuration present
            for (String key : node.kind().requiredConfiguration()) {
                if (isBlank(node.configuration().get(key))) {
                    issues.add(ValidationIssue.error(Kind.INCOMPLETE_CONFIGURATION, node.id(),
                        "Shape '%s' (%s) is missing '%s'".formatted(node.id(), node.kind(), key)));
                }
            }

            // Rule 6: placeholders deploy but need an implementation
            if (node.kind() == ShapeKind.PLACEHOLDER) {
                issues.add(ValidationIssue.warning(Kind.UNRESOLVED_PLACEHOLDER, node.id(),
                    "Shape '%s' is a placeholder for service '%s'"
                        .formatted(node.id(), node.configuration().get("service"))));
            }
        }

        ValidationStatus status = ValidationStatus.DRAFT.conclude(issues);
        return new ValidationReport(status, issues);
    }

    private static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String s) {
            return s.isBlank();
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        return false;
    }
}
