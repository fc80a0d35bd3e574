package dev.flowbridge.engine;

import dev.flowbridge.model.ConversionWarning.DanglingReference;
import dev.flowbridge.model.FlowDefinition;
import dev.flowbridge.model.PipelineState;
import dev.flowbridge.model.StepStates;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A flow with the pipeline state before and after every step, keyed by step path.
 */
public record AnnotatedFlow(
    FlowDefinition flow,
    Map<String, StepStates> states,
    List<DanglingReference> warnings,
    PipelineState finalState
) {
    public AnnotatedFlow {
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
        warnings = List.copyOf(warnings);
    }

    public StepStates statesOf(String stepPath) {
        StepStates s = states.get(stepPath);
        if (s == null) {
            throw new IllegalArgumentException("No pipeline state recorded for " + stepPath);
        }
        return s;
    }

    public List<DanglingReference> warningsAt(String stepPath) {
        return warnings.stream().filter(w -> w.stepPath().equals(stepPath)).toList();
    }

    /** True when this step or anything nested under it reads a variable it cannot see. */
    public boolean hasDanglingUnder(String stepPath) {
        return warnings.stream().anyMatch(w ->
            w.stepPath().equals(stepPath) || w.stepPath().startsWith(stepPath + "/"));
    }
}
