package dev.flowbridge.model;

import java.util.List;

/**
 * One assignment inside a MAP step or an invocation binding.
 * Exactly one of four forms: copy, set, drop, or transformer call.
 */
public sealed interface MapOperation {

    /** Path written by this operation (the dropped path for a drop). */
    String target();

    /** Copy the value at one path to another. */
    record Copy(String from, String to, FieldType type) implements MapOperation {
        @Override
        public String target() { return to; }
    }

    /** Set a literal value; {@code %name%} tokens make it an expression. */
    record Set(String field, String value, FieldType type) implements MapOperation {
        @Override
        public String target() { return field; }
    }

    /** Remove a variable from the pipeline. */
    record Drop(String field) implements MapOperation {
        @Override
        public String target() { return field; }
    }

    /** Call a transformer service and write its result to a path. */
    record Transform(String service, List<String> arguments, String to, FieldType type) implements MapOperation {
        public Transform {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String target() { return to; }
    }
}
