package dev.flowbridge.engine;

import dev.flowbridge.catalog.CatalogEntry;
import dev.flowbridge.catalog.PatternCatalog;
import dev.flowbridge.catalog.PatternTemplate;
import dev.flowbridge.catalog.ServiceCatalog;
import dev.flowbridge.catalog.ServiceTemplate;
import dev.flowbridge.engine.ShapePlan.Dependency;
import dev.flowbridge.engine.ShapePlan.OpenEnd;
import dev.flowbridge.engine.ShapePlan.PlannedNode;
import dev.flowbridge.model.*;
import dev.flowbridge.model.ConversionWarning.DanglingReference;
import dev.flowbridge.model.ConversionWarning.UnresolvedInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns each step of a tagged flow into target shapes and the connections between them.
 *
 * <p>Wiring works on open ends: every conversion receives the ends that must
 * lead into whatever it emits next and returns the ends left dangling after
 * it. A terminal shape returns none; a step that emits nothing passes its
 * input ends straight through.
 */
public final class ShapeConverter {

    private static final Logger log = LoggerFactory.getLogger(ShapeConverter.class);

    /** A loop dropped in favour of implicit iteration. */
    static final int IMPLICIT_ITERATION_CONFIDENCE = 95;

    static final String DEFAULT_ROUTE = "default";

    /** Route of the default path when a real case is already labelled {@link #DEFAULT_ROUTE}. */
    static final String RESERVED_DEFAULT_ROUTE = BranchCase.DEFAULT_LABEL;

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");
    private static final Pattern CAPTURE_PLACEHOLDER = Pattern.compile("\\$\\{([^}.]+)\\.[^}]+}");
    private static final Pattern BINDINGS_PLACEHOLDER =
        Pattern.compile("\\$\\{([^}.]+)\\.(mappings|inputs|outputs)}");

    private final ServiceCatalog services;
    private final PatternCatalog patterns;
    private final ConversionSettings settings;

    public ShapeConverter(ServiceCatalog services, PatternCatalog patterns, ConversionSettings settings) {
        this.services = services;
        this.patterns = patterns;
        this.settings = settings;
    }

    public ShapePlan convert(TaggedFlow tagged) {
        Build build = new Build(tagged);
        List<OpenEnd> ends = build.steps(
            tagged.annotated().flow().steps(), List.of(new OpenEnd(ShapePlan.START, null)), 0);

        var warnings = new ArrayList<ConversionWarning>(tagged.annotated().warnings());
        warnings.addAll(build.unresolved);
        log.debug("Planned {} shapes for {} ({} open ends, {} review notes)",
            build.nodes.size(), tagged.annotated().flow().name(), ends.size(), build.notes.size());
        return new ShapePlan(build.nodes, build.dependencies, ends, build.notes, warnings, build.stepConfidence);
    }

    /** Copies and literal sets only, with at least one of them; drops are tolerated. */
    public static boolean isSimple(Step.MapStep map) {
        boolean assigns = false;
        for (MapOperation op : map.operations()) {
            if (op instanceof MapOperation.Transform) {
                return false;
            }
            if (op instanceof MapOperation.Set set && References.hasTokens(set.value())) {
                return false;
            }
            if (!(op instanceof MapOperation.Drop)) {
                assigns = true;
            }
        }
        return assigns;
    }

    /** Display label: the step's own name, else something derived from what it does. */
    public static String label(Step step) {
        if (step.name() != null && !step.name().isBlank()) {
            return step.name();
        }
        if (step instanceof Step.InvokeStep invoke) {
            return invoke.service();
        }
        if (step instanceof Step.LoopStep loop) {
            return "Loop over " + loop.inputArray();
        }
        if (step instanceof Step.BranchStep branch && branch.switchOn() != null && !branch.switchOn().isBlank()) {
            return "Branch on " + branch.switchOn();
        }
        String verb = step.verb().name();
        return verb.charAt(0) + verb.substring(1).toLowerCase(Locale.ROOT);
    }

    /** Assignment list for a map shape: {@code from/to} for copies, {@code value/to} for sets. */
    static List<Map<String, String>> mappings(List<MapOperation> operations) {
        var mappings = new ArrayList<Map<String, String>>();
        for (MapOperation op : operations) {
            var entry = new LinkedHashMap<String, String>();
            if (op instanceof MapOperation.Copy copy) {
                entry.put("from", copy.from());
            } else if (op instanceof MapOperation.Set set) {
                entry.put("value", set.value());
            } else if (op instanceof MapOperation.Transform transform) {
                entry.put("function", transform.service());
                entry.put("arguments", String.join(",", transform.arguments()));
            } else {
                continue;
            }
            entry.put("to", op.target());
            mappings.add(entry);
        }
        return mappings;
    }

    /**
     * A composite step being converted. {@code exits} collects the paths of
     * EXIT steps that leave it; {@code firstNode} indexes its first body shape.
     */
    private record Scope(Step step, int firstNode, List<OpenEnd> exits) {}

    /** Mutable state of one conversion. */
    private final class Build {

        final TaggedFlow tagged;
        final AnnotatedFlow annotated;
        final List<PlannedNode> nodes = new ArrayList<>();
        final List<Dependency> dependencies = new ArrayList<>();
        final List<ReviewNote> notes = new ArrayList<>();
        final List<UnresolvedInvocation> unresolved = new ArrayList<>();
        final Map<String, Integer> stepConfidence = new LinkedHashMap<>();
        final Deque<Scope> scopes = new ArrayDeque<>();
        int row = 1;
        int nextColumn = 1;
        int keys = 0;

        Build(TaggedFlow tagged) {
            this.tagged = tagged;
            this.annotated = tagged.annotated();
        }

        List<OpenEnd> steps(List<Step> steps, List<OpenEnd> ends, int column) {
            List<OpenEnd> current = ends;
            for (int i = 0; i < steps.size(); i++) {
                Step step = steps.get(i);
                if (current.isEmpty()) {
                    note(step.path(), "%d step(s) after an exit are unreachable and were not converted"
                        .formatted(steps.size() - i));
                    break;
                }
                Optional<PatternTag> tag = tagged.tagStartingAt(step.path());
                if (tag.isPresent()) {
                    current = pattern(tag.get(), current, column);
                    i += tag.get().length() - 1;
                } else if (step instanceof Step.TryStep tryStep) {
                    Step.CatchStep handler = i + 1 < steps.size() && steps.get(i + 1) instanceof Step.CatchStep c
                        ? c : null;
                    current = tryCatch(tryStep, handler, current, column);
                    if (handler != null) {
                        i++;
                    }
                } else {
                    current = step(step, current, column);
                }
            }
            return current;
        }

        List<OpenEnd> step(Step step, List<OpenEnd> ends, int column) {
            if (step instanceof Step.MapStep map) {
                return map(map, ends, column);
            } else if (step instanceof Step.BranchStep branch) {
                return branch(branch, ends, column);
            } else if (step instanceof Step.LoopStep loop) {
                return loop(loop, ends, column);
            } else if (step instanceof Step.RepeatStep repeat) {
                return repeat(repeat, ends, column);
            } else if (step instanceof Step.SequenceStep sequence) {
                return sequence(sequence, ends, column);
            } else if (step instanceof Step.InvokeStep invoke) {
                return invoke(invoke, ends, column);
            } else if (step instanceof Step.ExitStep exit) {
                return exit(exit, ends, column);
            } else if (step instanceof Step.TryStep tryStep) {
                return tryCatch(tryStep, null, ends, column);
            }
            // a CATCH is consumed together with its TRY
            note(step.path(), "CATCH without a preceding TRY ignored");
            return ends;
        }

        // --- per verb ---

        List<OpenEnd> map(Step.MapStep map, List<OpenEnd> ends, int column) {
            boolean onlyDrops = map.operations().stream().allMatch(op -> op instanceof MapOperation.Drop);
            if (onlyDrops) {
                note(map.path(), "MAP only removes pipeline variables; the target has no equivalent, step omitted");
                stepConfidence.put(map.path(), penalized(100, map.path()));
                unattached(map.path());
                return ends;
            }
            String key;
            if (isSimple(map)) {
                key = emit(ShapeKind.MAP, label(map), Map.of("mappings", mappings(map.operations())),
                    penalized(settings.mappingConfidence(), map.path()), map.path(), ends, column);
            } else {
                var config = new LinkedHashMap<String, Object>();
                config.put("language", "groovy");
                config.put("script", ScriptGenerator.forMap(map));
                key = emit(ShapeKind.DATA_PROCESS, label(map), config,
                    penalized(settings.scriptConfidence(), map.path()), map.path(), ends, column);
                note(map.path(), "MAP uses expressions or transformer services; review the generated script");
            }
            return continueFrom(key);
        }

        List<OpenEnd> branch(Step.BranchStep branch, List<OpenEnd> ends, int column) {
            boolean bySwitch = branch.switchOn() != null && !branch.switchOn().isBlank();
            boolean hasDefault = branch.cases().stream().anyMatch(BranchCase::isDefault);
            String defaultRoute = branch.cases().stream()
                .anyMatch(c -> !c.isDefault() && DEFAULT_ROUTE.equals(c.label()))
                ? RESERVED_DEFAULT_ROUTE : DEFAULT_ROUTE;

            var routes = new ArrayList<String>();
            branch.cases().forEach(c -> routes.add(route(c, defaultRoute)));
            if (!hasDefault) {
                routes.add(defaultRoute);
            }
            var config = new LinkedHashMap<String, Object>();
            config.put("mode", bySwitch ? "switch" : "expression");
            if (bySwitch) {
                config.put("switch", branch.switchOn());
            }
            config.put("routes", routes);

            int base = bySwitch ? settings.mappingConfidence() : settings.expressionConfidence();
            String key = emit(ShapeKind.DECISION, label(branch), config,
                penalized(base, branch.path()), branch.path(), ends, column);
            if (!bySwitch) {
                note(branch.path(), "Case labels are evaluated as expressions; check each route condition");
            }

            Scope scope = enter(branch);
            var out = new ArrayList<OpenEnd>();
            boolean first = true;
            for (BranchCase branchCase : branch.cases()) {
                int caseColumn = first ? column : nextColumn++;
                first = false;
                out.addAll(steps(branchCase.steps(),
                    List.of(new OpenEnd(key, route(branchCase, defaultRoute))), caseColumn));
            }
            if (!hasDefault) {
                out.add(new OpenEnd(key, defaultRoute));
            }
            return leave(scope, out);
        }

        List<OpenEnd> loop(Step.LoopStep loop, List<OpenEnd> ends, int column) {
            boolean readsIteration = References.deep(loop).contains(PipelineTracker.ITERATION_VARIABLE);
            if (readsIteration || loop.collectsOutput()) {
                var config = new LinkedHashMap<String, Object>();
                config.put("input", loop.inputArray());
                config.put("mode", "each");
                if (loop.collectsOutput()) {
                    config.put("output", loop.outputArray());
                }
                String key = emit(ShapeKind.FOR_EACH, label(loop), config,
                    penalized(settings.approximationConfidence(), loop.path()), loop.path(), ends, column);
                note(loop.path(), readsIteration
                    ? "Loop body reads %s; kept an explicit flow-control loop"
                        .formatted(PipelineTracker.ITERATION_VARIABLE)
                    : "Loop collects results into '%s'; kept an explicit flow-control loop"
                        .formatted(loop.outputArray()));
                Scope scope = enter(loop);
                return leave(scope, steps(loop.steps(), List.of(new OpenEnd(key, "each")), column));
            }
            stepConfidence.put(loop.path(), penalized(IMPLICIT_ITERATION_CONFIDENCE, loop.path()));
            note(loop.path(), "Loop over '%s' removed; documents are processed one at a time implicitly"
                .formatted(loop.inputArray()));
            Scope scope = enter(loop);
            List<OpenEnd> out = leave(scope, steps(loop.steps(), ends, column));
            if (!attach(scope.firstNode(), loop.path())) {
                unattached(loop.path());
            }
            return out;
        }

        List<OpenEnd> repeat(Step.RepeatStep repeat, List<OpenEnd> ends, int column) {
            if (repeat.repeatOn() == Step.RepeatOn.FAILURE) {
                int max = settings.maxRetryCount();
                int retries = repeat.count() < 0 ? max : Math.min(repeat.count(), max);
                if (repeat.count() < 0 || repeat.count() > max) {
                    note(repeat.path(), "Retry count %s capped at %d"
                        .formatted(repeat.count() < 0 ? "unbounded" : Integer.toString(repeat.count()), max));
                }
                var config = new LinkedHashMap<String, Object>();
                config.put("retryCount", retries);
                config.put("mode", "retry");
                int confidence = penalized(settings.mappingConfidence(), repeat.path());
                String key = emit(ShapeKind.TRY_CATCH, label(repeat), config, confidence, repeat.path(), ends, column);
                Scope scope = enter(repeat);
                var out = new ArrayList<>(steps(repeat.steps(), List.of(new OpenEnd(key, "try")), column));
                failure(key, "Retries exhausted in " + label(repeat), confidence, repeat.path());
                return leave(scope, out);
            }
            var config = new LinkedHashMap<String, Object>();
            config.put("input", "$repeat");
            config.put("mode", "repeat-until-failure");
            if (repeat.count() >= 0) {
                config.put("count", repeat.count());
            }
            String key = emit(ShapeKind.FOR_EACH, label(repeat), config,
                penalized(settings.approximationConfidence(), repeat.path()), repeat.path(), ends, column);
            note(repeat.path(), "REPEAT on SUCCESS approximated with a flow-control loop");
            Scope scope = enter(repeat);
            return leave(scope, steps(repeat.steps(), List.of(new OpenEnd(key, "each")), column));
        }

        List<OpenEnd> sequence(Step.SequenceStep sequence, List<OpenEnd> ends, int column) {
            if (sequence.steps().isEmpty()) {
                note(sequence.path(), "Empty SEQUENCE omitted");
                stepConfidence.put(sequence.path(), 100);
                return ends;
            }
            var config = new LinkedHashMap<String, Object>();
            config.put("retryCount", 0);
            config.put("exitOn", sequence.exitOn().name());
            int confidence = penalized(settings.mappingConfidence(), sequence.path());
            String key = emit(ShapeKind.TRY_CATCH, label(sequence), config, confidence, sequence.path(), ends, column);
            Scope scope = enter(sequence);
            var out = new ArrayList<>(steps(sequence.steps(), List.of(new OpenEnd(key, "try")), column));
            switch (sequence.exitOn()) {
                case FAILURE -> failure(key, "Failure in " + label(sequence), confidence, sequence.path());
                case DONE -> out.add(new OpenEnd(key, "catch"));
                case SUCCESS -> {
                    out.add(new OpenEnd(key, "catch"));
                    note(sequence.path(), "EXIT-ON SUCCESS approximated: all steps run and failures continue downstream");
                }
            }
            return leave(scope, out);
        }

        List<OpenEnd> tryCatch(Step.TryStep tryStep, Step.CatchStep handler, List<OpenEnd> ends, int column) {
            var config = new LinkedHashMap<String, Object>();
            config.put("retryCount", 0);
            if (handler != null && handler.exceptionFilter() != null) {
                config.put("catch", handler.exceptionFilter());
            }
            int confidence = penalized(settings.mappingConfidence(), tryStep.path());
            String key = emit(ShapeKind.TRY_CATCH, label(tryStep), config, confidence, tryStep.path(), ends, column);
            Scope tryScope = enter(tryStep);
            var out = new ArrayList<>(leave(tryScope,
                steps(tryStep.steps(), List.of(new OpenEnd(key, "try")), column)));
            if (handler != null) {
                stepConfidence.put(handler.path(), confidence);
                if (handler.exceptionFilter() != null) {
                    note(handler.path(), "Catch filter '%s' is not enforced; every error takes the catch path"
                        .formatted(handler.exceptionFilter()));
                }
                Scope catchScope = enter(handler);
                out.addAll(leave(catchScope,
                    steps(handler.steps(), List.of(new OpenEnd(key, "catch")), nextColumn++)));
            } else {
                failure(key, "Unhandled failure in " + label(tryStep), confidence, tryStep.path());
            }
            return out;
        }

        List<OpenEnd> invoke(Step.InvokeStep invoke, List<OpenEnd> ends, int column) {
            CatalogEntry entry = services.lookup(invoke.service());
            if (entry instanceof CatalogEntry.Known known) {
                ServiceTemplate template = known.template();
                var config = new LinkedHashMap<String, Object>(template.configuration());
                config.put("service", invoke.service());
                var inputs = mappings(invoke.inputs());
                if (!inputs.isEmpty()) {
                    config.put("inputs", inputs);
                }
                var outputs = mappings(invoke.outputs());
                if (!outputs.isEmpty()) {
                    config.put("outputs", outputs);
                }
                int base = template.shape() == ShapeKind.DATA_PROCESS
                    ? Math.min(template.confidence(), settings.scriptConfidence())
                    : template.confidence();
                String key = emit(template.shape(), label(invoke), config,
                    penalized(base, invoke.path()), invoke.path(), ends, column);
                if (template.note() != null) {
                    note(invoke.path(), template.note());
                }
                return template.shape().isTerminal() ? List.of() : continueFrom(key);
            }

            var warning = new UnresolvedInvocation(invoke.path(), invoke.service());
            unresolved.add(warning);
            var nodeWarnings = new ArrayList<ConversionWarning>(annotated.warningsAt(invoke.path()));
            nodeWarnings.add(warning);
            String key = emitNode(ShapeKind.PLACEHOLDER, label(invoke), Map.of("service", invoke.service()),
                0, invoke.path(), nodeWarnings, ends, column);
            stepConfidence.put(invoke.path(), 0);
            note(invoke.path(), "Service '%s' has no catalog entry; implement the placeholder by hand"
                .formatted(invoke.service()));
            return continueFrom(key);
        }

        List<OpenEnd> exit(Step.ExitStep exit, List<OpenEnd> ends, int column) {
            boolean failure = exit.signal() == Step.Signal.FAILURE;
            Scope target = exit.exitsFlow() ? null : target(exit.from());
            if (target != null && !failure) {
                return leaveScope(exit, target, ends);
            }
            int base = exit.exitsFlow() ? settings.mappingConfidence() : settings.approximationConfidence();
            if (target != null) {
                note(exit.path(), "EXIT from '%s' with FAILURE approximated: the error ends the path"
                    .formatted(exit.from()));
            } else if (!exit.exitsFlow()) {
                note(exit.path(), "EXIT target '%s' is not an enclosing step; treated as an exit from the flow"
                    .formatted(exit.from()));
            }
            if (failure) {
                String message = exit.message() != null && !exit.message().isBlank()
                    ? exit.message() : "Exited with failure";
                emit(ShapeKind.EXCEPTION, label(exit), Map.of("message", message),
                    penalized(base, exit.path()), exit.path(), ends, column);
            } else {
                emit(ShapeKind.STOP, label(exit), Map.of("continue", false),
                    penalized(exit.exitsFlow() ? 100 : base, exit.path()), exit.path(), ends, column);
            }
            return List.of();
        }

        /** A successful EXIT from an enclosing step: its paths resume after that step. */
        List<OpenEnd> leaveScope(Step.ExitStep exit, Scope target, List<OpenEnd> ends) {
            boolean breaksLoop = target.step() instanceof Step.LoopStep || target.step() instanceof Step.RepeatStep;
            int base = breaksLoop ? settings.approximationConfidence() : settings.mappingConfidence();
            stepConfidence.put(exit.path(), clamp(penalized(base, exit.path())));
            if (breaksLoop) {
                note(exit.path(), "EXIT from '%s' approximated: later steps of this iteration are skipped, "
                    .formatted(exit.from()) + "remaining iterations still run");
                cap(target.firstNode(), settings.approximationConfidence());
            }
            unattached(exit.path());
            target.exits().addAll(ends);
            return List.of();
        }

        List<OpenEnd> pattern(PatternTag tag, List<OpenEnd> ends, int column) {
            PatternTemplate template = patterns.find(tag.patternId())
                .orElseThrow(() -> new IllegalStateException("Tag refers to unknown pattern " + tag.patternId()));
            List<OpenEnd> current = ends;
            for (PatternTemplate.ShapeSpec spec : template.shapes()) {
                var config = new LinkedHashMap<String, Object>();
                spec.configuration().forEach((k, v) -> {
                    Object value = expand(v, tag);
                    if (!(value instanceof List<?> list && list.isEmpty())) {
                        config.put(k, value);
                    }
                });
                String key = emit(spec.kind(), substitute(spec.label(), tag.values()), config,
                    tag.confidence(), sourceStep(spec, tag), current, column);
                current = spec.kind().isTerminal() ? List.of() : continueFrom(key);
            }
            for (String text : template.notes()) {
                note(tag.firstStepPath(), substitute(text, tag.values()));
            }
            for (String path : tag.stepPaths()) {
                for (String covered : annotated.states().keySet()) {
                    if (covered.equals(path) || covered.startsWith(path + "/")) {
                        stepConfidence.put(covered, tag.confidence());
                    }
                }
            }
            return current;
        }

        // --- helpers ---

        /** {@code ${x.mappings}}, {@code ${x.inputs}} and {@code ${x.outputs}} expand to assignment lists. */
        Object expand(String value, PatternTag tag) {
            Matcher m = BINDINGS_PLACEHOLDER.matcher(value);
            if (m.matches()) {
                Step captured = tag.captures().get(m.group(1));
                String bindings = m.group(2);
                if (captured instanceof Step.MapStep map && bindings.equals("mappings")) {
                    return mappings(map.operations());
                }
                if (captured instanceof Step.InvokeStep invoke && bindings.equals("inputs")) {
                    return mappings(invoke.inputs());
                }
                if (captured instanceof Step.InvokeStep invoke && bindings.equals("outputs")) {
                    return mappings(invoke.outputs());
                }
            }
            return substitute(value, tag.values());
        }

        /** Path of the first capture named in the shape's configuration or, failing that, its label. */
        String sourceStep(PatternTemplate.ShapeSpec spec, PatternTag tag) {
            var texts = new ArrayList<>(spec.configuration().values());
            texts.add(spec.label());
            for (String text : texts) {
                Matcher m = CAPTURE_PLACEHOLDER.matcher(text);
                while (m.find()) {
                    Step captured = tag.captures().get(m.group(1));
                    if (captured != null) {
                        return captured.path();
                    }
                }
            }
            return tag.firstStepPath();
        }

        String substitute(String text, Map<String, String> values) {
            return PLACEHOLDER.matcher(text)
                .replaceAll(r -> Matcher.quoteReplacement(values.getOrDefault(r.group(1), "")));
        }

        void failure(String tryKey, String message, int confidence, String stepPath) {
            emitNode(ShapeKind.EXCEPTION, message, Map.of("message", message), confidence, stepPath,
                List.of(), List.of(new OpenEnd(tryKey, "catch")), nextColumn++);
        }

        String route(BranchCase branchCase, String defaultRoute) {
            return branchCase.isDefault() ? defaultRoute : branchCase.label();
        }

        // --- scopes left by EXIT ---

        Scope enter(Step step) {
            Scope scope = new Scope(step, nodes.size(), new ArrayList<>());
            scopes.push(scope);
            return scope;
        }

        List<OpenEnd> leave(Scope scope, List<OpenEnd> out) {
            scopes.pop();
            if (scope.exits().isEmpty()) {
                return out;
            }
            var all = new ArrayList<>(out);
            all.addAll(scope.exits());
            return all;
        }

        /** Innermost enclosing step an EXIT names; null when none matches. */
        Scope target(String from) {
            for (Scope scope : scopes) {
                Step step = scope.step();
                boolean matches = switch (from) {
                    case Step.ExitStep.FROM_PARENT -> true;
                    case Step.ExitStep.FROM_LOOP ->
                        step instanceof Step.LoopStep || step instanceof Step.RepeatStep;
                    default -> from.equals(step.name());
                };
                if (matches) {
                    return scope;
                }
            }
            return null;
        }

        // --- warnings of steps that emit no shape ---

        /** Move the step's dangling references onto the node at {@code index}; false when there is none. */
        boolean attach(int index, String stepPath) {
            List<DanglingReference> warnings = annotated.warningsAt(stepPath);
            if (warnings.isEmpty()) {
                return true;
            }
            if (index >= nodes.size()) {
                return false;
            }
            PlannedNode node = nodes.get(index);
            var merged = new ArrayList<>(node.warnings());
            merged.addAll(warnings);
            nodes.set(index, new PlannedNode(node.key(), node.kind(), node.label(), node.configuration(),
                clamp(node.confidence() - settings.danglingPenalty() * warnings.size()), node.stepPath(),
                node.row(), node.column(), merged));
            return true;
        }

        void unattached(String stepPath) {
            List<DanglingReference> warnings = annotated.warningsAt(stepPath);
            if (!warnings.isEmpty()) {
                note(stepPath, "No shape was emitted for this step, which reads %s not in the pipeline"
                    .formatted(warnings.stream().map(DanglingReference::variable).toList()));
            }
        }

        /** Hold the first node at or after {@code index} (else the one before it) to {@code ceiling}. */
        void cap(int index, int ceiling) {
            int at = index < nodes.size() ? index : index - 1;
            if (at < 0) {
                return;
            }
            PlannedNode node = nodes.get(at);
            if (node.confidence() > ceiling) {
                nodes.set(at, new PlannedNode(node.key(), node.kind(), node.label(), node.configuration(),
                    ceiling, node.stepPath(), node.row(), node.column(), node.warnings()));
            }
        }

        int penalized(int base, String stepPath) {
            return base - settings.danglingPenalty() * annotated.warningsAt(stepPath).size();
        }

        String emit(ShapeKind kind, String label, Map<String, Object> configuration, int confidence,
                    String stepPath, List<OpenEnd> ends, int column) {
            String key = emitNode(kind, label, configuration, confidence, stepPath,
                new ArrayList<>(annotated.warningsAt(stepPath)), ends, column);
            stepConfidence.putIfAbsent(stepPath, clamp(confidence));
            return key;
        }

        String emitNode(ShapeKind kind, String label, Map<String, Object> configuration, int confidence,
                        String stepPath, List<ConversionWarning> warnings, List<OpenEnd> ends, int column) {
            String key = "n" + (++keys);
            nodes.add(new PlannedNode(key, kind, label, configuration, clamp(confidence), stepPath,
                row++, column, warnings));
            for (OpenEnd end : ends) {
                dependencies.add(new Dependency(end.nodeKey(), key, end.label()));
            }
            return key;
        }

        List<OpenEnd> continueFrom(String key) {
            return List.of(new OpenEnd(key, null));
        }

        void note(String stepPath, String message) {
            notes.add(new ReviewNote(stepPath, message));
        }

        int clamp(int confidence) {
            return Math.max(0, Math.min(100, confidence));
        }
    }
}
