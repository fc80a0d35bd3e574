package dev.flowbridge.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A recognized idiom covering a contiguous run of sibling steps.
 *
 * @param patternId  id of the matching template
 * @param stepPaths  paths of the top-level steps in the run, in order
 * @param captures   steps bound to the template's capture names
 * @param values     values extracted while matching, keyed {@code capture.key}
 * @param confidence confidence of the template's shapes
 */
public record PatternTag(
    String patternId,
    List<String> stepPaths,
    Map<String, Step> captures,
    Map<String, String> values,
    int confidence
) {
    public PatternTag {
        stepPaths = List.copyOf(stepPaths);
        captures = Collections.unmodifiableMap(new LinkedHashMap<>(captures));
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String firstStepPath() {
        return stepPaths.get(0);
    }

    public int length() {
        return stepPaths.size();
    }
}
