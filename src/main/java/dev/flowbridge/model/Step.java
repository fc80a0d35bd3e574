package dev.flowbridge.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One node of a flow definition. Each verb has its own record; composite
 * verbs own their child steps and leaf verbs have none.
 *
 * <p>{@code path} locates the step inside its flow, e.g.
 * {@code FLOW/BRANCH[2]/CASE[gold]/INVOKE[0]}. It is used as the step's
 * identity by every later stage.
 */
public sealed interface Step {

    Verb verb();

    String path();

    String name(); // nullable

    /** Ordered child steps; empty for leaf verbs. */
    default List<Step> children() {
        return List.of();
    }

    /** Variables promoted to the enclosing scope when a composite step exits. */
    default List<String> promote() {
        return List.of();
    }

    /** Assignments and cleanup. */
    record MapStep(String path, String name, List<MapOperation> operations) implements Step {
        public MapStep {
            operations = List.copyOf(operations);
        }

        @Override
        public Verb verb() { return Verb.MAP; }
    }

    /** Conditional dispatch on a discriminant (or on label expressions when {@code switchOn} is empty). */
    record BranchStep(String path, String name, String switchOn, List<BranchCase> cases,
                      List<String> promote) implements Step {
        public BranchStep {
            cases = List.copyOf(cases);
            promote = List.copyOf(promote);
        }

        @Override
        public Verb verb() { return Verb.BRANCH; }

        @Override
        public List<Step> children() {
            var all = new ArrayList<Step>();
            cases.forEach(c -> all.addAll(c.steps()));
            return List.copyOf(all);
        }
    }

    /** Iterate over a list variable. */
    record LoopStep(String path, String name, String inputArray, String outputArray,
                    List<Step> steps, List<String> promote) implements Step {
        public LoopStep {
            steps = List.copyOf(steps);
            promote = List.copyOf(promote);
        }

        @Override
        public Verb verb() { return Verb.LOOP; }

        @Override
        public List<Step> children() { return steps; }

        /** True when the loop collects its results into an OUTPUT array. */
        public boolean collectsOutput() {
            return outputArray != null && !outputArray.isBlank();
        }
    }

    /** Re-run the body while it keeps succeeding or failing. {@code count} is -1 when unbounded. */
    record RepeatStep(String path, String name, int count, RepeatOn repeatOn,
                      List<Step> steps, List<String> promote) implements Step {
        public RepeatStep {
            steps = List.copyOf(steps);
            promote = List.copyOf(promote);
        }

        @Override
        public Verb verb() { return Verb.REPEAT; }

        @Override
        public List<Step> children() { return steps; }
    }

    /** Grouping with an exit condition. */
    record SequenceStep(String path, String name, ExitOn exitOn,
                        List<Step> steps, List<String> promote) implements Step {
        public SequenceStep {
            steps = List.copyOf(steps);
            promote = List.copyOf(promote);
        }

        @Override
        public Verb verb() { return Verb.SEQUENCE; }

        @Override
        public List<Step> children() { return steps; }
    }

    /** Protected block; a CATCH sibling may follow it. */
    record TryStep(String path, String name, List<Step> steps, List<String> promote) implements Step {
        public TryStep {
            steps = List.copyOf(steps);
            promote = List.copyOf(promote);
        }

        @Override
        public Verb verb() { return Verb.TRY; }

        @Override
        public List<Step> children() { return steps; }
    }

    /** Handler for the TRY immediately before it. */
    record CatchStep(String path, String name, String exceptionFilter,
                     List<Step> steps, List<String> promote) implements Step {
        public CatchStep {
            steps = List.copyOf(steps);
            promote = List.copyOf(promote);
        }

        @Override
        public Verb verb() { return Verb.CATCH; }

        @Override
        public List<Step> children() { return steps; }
    }

    /** Call another service, with input and output bindings. */
    record InvokeStep(String path, String name, String service,
                      List<MapOperation> inputs, List<MapOperation> outputs) implements Step {
        public InvokeStep {
            inputs = List.copyOf(inputs);
            outputs = List.copyOf(outputs);
        }

        @Override
        public Verb verb() { return Verb.INVOKE; }
    }

    /** Leave the flow, the enclosing loop, or a labelled parent. */
    record ExitStep(String path, String name, String from, Signal signal, String message) implements Step {
        public static final String FROM_FLOW = "$flow";
        public static final String FROM_PARENT = "$parent";
        public static final String FROM_LOOP = "$loop";

        @Override
        public Verb verb() { return Verb.EXIT; }

        public boolean exitsFlow() {
            return from == null || from.isBlank() || FROM_FLOW.equals(from);
        }
    }

    enum RepeatOn { SUCCESS, FAILURE }

    enum ExitOn { SUCCESS, FAILURE, DONE }

    enum Signal { SUCCESS, FAILURE }
}
