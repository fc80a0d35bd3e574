package dev.flowbridge.catalog;

import dev.flowbridge.model.ShapeKind;
import dev.flowbridge.model.Verb;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A multi-step idiom and the pre-wired shape chain that replaces it.
 */
public record PatternTemplate(
    String id,
    String description,
    int confidence,
    List<ElementMatcher> sequence,
    List<ShapeSpec> shapes,
    List<String> notes
) {
    public PatternTemplate {
        sequence = List.copyOf(sequence);
        shapes = List.copyOf(shapes);
        notes = List.copyOf(notes);
    }

    /**
     * Matches one step. For LOOP matchers, {@code body} must match the loop's whole body.
     */
    public record ElementMatcher(Verb verb, Set<Requirement> requires, String capture, List<ElementMatcher> body) {
        public ElementMatcher {
            requires = Set.copyOf(requires);
            body = List.copyOf(body);
        }
    }

    /** One shape of the replacement chain; strings may contain {@code ${capture.key}} placeholders. */
    public record ShapeSpec(ShapeKind kind, String label, Map<String, String> configuration) {
        public ShapeSpec {
            configuration = Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
        }
    }

    /** Closed vocabulary of structural and pipeline-state preconditions. */
    public enum Requirement {
        /** INVOKE whose service resolves to a connector template. */
        RESOLVED_CONNECTOR,
        /** Post-state holds a list variable that the pre-state did not. */
        INTRODUCES_LIST,
        /** Post-state holds at least one variable that the pre-state did not. */
        INTRODUCES_VARIABLE,
        /** LOOP over the list introduced by the previous element. */
        ITERATES_INTRODUCED_LIST,
        /** LOOP whose body never reads {@code $iteration}. */
        NO_INDEX_STATE,
        /** LOOP that collects no results into an OUTPUT array. */
        NO_OUTPUT_ARRAY,
        /** Step reads the element variable of the enclosing loop. */
        CONSUMES_ELEMENT,
        /** Step reads a variable introduced by the previous element. */
        CONSUMES_INTRODUCED,
        /** MAP with at least one assignment, made of copies and literal sets (drops tolerated). */
        SIMPLE_ASSIGNMENTS
    }
}
