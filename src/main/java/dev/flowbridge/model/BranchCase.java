package dev.flowbridge.model;

import java.util.List;

/**
 * One labelled path of a BRANCH step.
 */
public record BranchCase(String label, boolean isDefault, List<Step> steps) {
    public static final String DEFAULT_LABEL = "$default";

    public BranchCase {
        steps = List.copyOf(steps);
    }
}
