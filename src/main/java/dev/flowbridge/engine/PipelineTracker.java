package dev.flowbridge.engine;

import dev.flowbridge.catalog.CatalogEntry;
import dev.flowbridge.catalog.ServiceCatalog;
import dev.flowbridge.model.*;
import dev.flowbridge.model.ConversionWarning.DanglingReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Replays a flow against the source language's implicit pipeline and records
 * what every step can see.
 *
 * <p>Composite steps open a scope on entry and restore the enclosing state on
 * exit; only variables named in {@code PROMOTE} (and a loop's output array)
 * survive. Reads of variables that are not visible become
 * {@link DanglingReference} warnings; tracking never fails.
 */
public final class PipelineTracker {

    private static final Logger log = LoggerFactory.getLogger(PipelineTracker.class);

    public static final String ITERATION_VARIABLE = "$iteration";

    private final ServiceCatalog catalog;

    public PipelineTracker(ServiceCatalog catalog) {
        this.catalog = catalog;
    }

    public AnnotatedFlow track(FlowDefinition flow) {
        Walk walk = new Walk();
        PipelineState initial = PipelineState.of(flow.signature());
        PipelineState last = walk.steps(flow.steps(), initial);
        log.debug("Tracked {} steps of {}: {} dangling references, {} variables at exit",
            walk.states.size(), flow.name(), walk.warnings.size(), last.size());
        return new AnnotatedFlow(flow, walk.states, walk.warnings, last);
    }

    /** State of a single traversal. */
    private final class Walk {

        final Map<String, StepStates> states = new LinkedHashMap<>();
        final List<DanglingReference> warnings = new ArrayList<>();
        final Deque<PipelineState> scopes = new ArrayDeque<>();

        PipelineState steps(List<Step> steps, PipelineState state) {
            PipelineState current = state;
            for (Step step : steps) {
                PipelineState after = step(step, current);
                states.put(step.path(), new StepStates(current, after));
                current = after;
            }
            return current;
        }

        PipelineState step(Step step, PipelineState before) {
            if (step instanceof Step.MapStep map) {
                return operations(step.path(), map.operations(), before);
            }
            if (step instanceof Step.InvokeStep invoke) {
                return invoke(invoke, before);
            }
            if (step instanceof Step.ExitStep exit) {
                check(step.path(), References.tokens(exit.message()), before);
                return before;
            }
            if (step instanceof Step.BranchStep branch) {
                return branch(branch, before);
            }
            if (step instanceof Step.LoopStep loop) {
                return loop(loop, before);
            }
            // SEQUENCE, TRY, CATCH, REPEAT
            scopes.push(before);
            PipelineState exit = steps(step.children(), before);
            return leave(step.promote(), exit);
        }

        /** Close the innermost scope: the enclosing state plus whatever was promoted out of it. */
        PipelineState leave(List<String> promote, PipelineState exit) {
            PipelineState parent = scopes.pop();
            return parent.withAll(promoted(promote, exit));
        }

        PipelineState operations(String path, List<MapOperation> operations, PipelineState before) {
            PipelineState state = before;
            for (MapOperation op : operations) {
                check(path, References.of(op), state);
                state = apply(op, state);
            }
            return state;
        }

        PipelineState apply(MapOperation op, PipelineState state) {
            if (op instanceof MapOperation.Drop drop) {
                return isRoot(drop.field()) ? state.without(References.root(drop.field())) : state;
            }
            FieldType type;
            if (op instanceof MapOperation.Copy copy) {
                type = copy.type() != null ? copy.type()
                    : isRoot(copy.from()) ? state.typeOf(References.root(copy.from())).orElse(FieldType.UNKNOWN)
                    : FieldType.UNKNOWN;
            } else if (op instanceof MapOperation.Set set) {
                type = set.type() != null ? set.type() : FieldType.STRING;
            } else {
                MapOperation.Transform transform = (MapOperation.Transform) op;
                type = transform.type() != null ? transform.type() : transformerType(transform.service());
            }
            return assign(op.target(), type, state);
        }

        PipelineState assign(String target, FieldType type, PipelineState state) {
            String root = References.root(target);
            if (isRoot(target)) {
                return state.with(root, type);
            }
            // writing a nested field creates its parent document when missing
            return state.contains(root) ? state : state.with(root, FieldType.DOCUMENT);
        }

        FieldType transformerType(String service) {
            if (catalog.lookup(service) instanceof CatalogEntry.Known known
                    && known.template().outputs().size() == 1) {
                return known.template().outputs().get(0).type();
            }
            return FieldType.UNKNOWN;
        }

        PipelineState invoke(Step.InvokeStep invoke, PipelineState before) {
            for (MapOperation op : invoke.inputs()) {
                check(invoke.path(), References.of(op), before);
            }
            PipelineState state = before;
            CatalogEntry entry = catalog.lookup(invoke.service());
            if (entry instanceof CatalogEntry.Known known) {
                for (FieldDecl output : known.template().outputs()) {
                    state = state.with(output.name(), output.type());
                }
            } else {
                // an uncatalogued service may produce anything its output bindings read
                for (MapOperation op : invoke.outputs()) {
                    if (op instanceof MapOperation.Copy copy && !state.contains(References.root(copy.from()))) {
                        state = state.with(References.root(copy.from()), FieldType.UNKNOWN);
                    }
                }
            }
            return operations(invoke.path(), invoke.outputs(), state);
        }

        PipelineState branch(Step.BranchStep branch, PipelineState before) {
            check(branch.path(), References.of(branch), before);
            var merged = new LinkedHashMap<String, FieldType>();
            for (BranchCase branchCase : branch.cases()) {
                scopes.push(before);
                PipelineState exit = steps(branchCase.steps(), before);
                scopes.pop();
                promoted(branch.promote(), exit).forEach((name, type) ->
                    merged.merge(name, type, (a, b) -> a == b ? a : FieldType.UNKNOWN));
            }
            return before.withAll(merged);
        }

        PipelineState loop(Step.LoopStep loop, PipelineState before) {
            check(loop.path(), References.of(loop), before);
            PipelineState entry = before;
            if (isRoot(loop.inputArray())) {
                String input = References.root(loop.inputArray());
                FieldType element = before.typeOf(input).map(FieldType::elementType).orElse(FieldType.UNKNOWN);
                entry = entry.with(input, element);
            }
            entry = entry.with(ITERATION_VARIABLE, FieldType.STRING);

            scopes.push(before);
            PipelineState exit = steps(loop.steps(), entry);
            PipelineState after = leave(loop.promote(), exit);
            if (loop.collectsOutput()) {
                String output = References.root(loop.outputArray());
                FieldType listType = exit.typeOf(output)
                    .map(FieldType::listType)
                    .orElse(FieldType.OBJECT_LIST);
                after = after.with(output, listType);
            }
            return after;
        }

        Map<String, FieldType> promoted(List<String> names, PipelineState exit) {
            var result = new LinkedHashMap<String, FieldType>();
            for (String name : names) {
                exit.typeOf(name).ifPresent(type -> result.put(name, type));
            }
            return result;
        }

        void check(String path, Collection<String> roots, PipelineState state) {
            for (String root : new LinkedHashSet<>(roots)) {
                if (!state.contains(root)) {
                    var warning = new DanglingReference(path, root);
                    if (!warnings.contains(warning)) {
                        warnings.add(warning);
                    }
                }
            }
        }

        boolean isRoot(String path) {
            return path.trim().replaceFirst("^/", "").indexOf('/') < 0;
        }
    }
}
