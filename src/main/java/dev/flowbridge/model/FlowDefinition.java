package dev.flowbridge.model;

import java.util.List;

/**
 * A parsed flow service: its name, declared inputs, and top-level steps.
 */
public record FlowDefinition(
    String name,
    List<FieldDecl> signature,
    List<Step> steps
) {
    public static final String ROOT_PATH = "FLOW";

    public FlowDefinition {
        signature = List.copyOf(signature);
        steps = List.copyOf(steps);
    }
}
