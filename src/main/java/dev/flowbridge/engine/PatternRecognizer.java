package dev.flowbridge.engine;

import dev.flowbridge.catalog.CatalogEntry;
import dev.flowbridge.catalog.PatternCatalog;
import dev.flowbridge.catalog.PatternTemplate;
import dev.flowbridge.catalog.PatternTemplate.ElementMatcher;
import dev.flowbridge.catalog.PatternTemplate.Requirement;
import dev.flowbridge.catalog.ServiceCatalog;
import dev.flowbridge.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Finds known multi-step idioms in an annotated flow.
 *
 * <p>Within each list of sibling steps, matching runs left to right. At each
 * position the longest matching template wins, ties going to the template
 * declared first; the matched run is skipped. When nothing matches, the step
 * is descended into. The result depends only on the flow and the catalogs.
 */
public final class PatternRecognizer {

    private static final Logger log = LoggerFactory.getLogger(PatternRecognizer.class);

    private final List<PatternTemplate> patterns;
    private final ServiceCatalog services;

    public PatternRecognizer(PatternCatalog patterns, ServiceCatalog services, ConversionSettings settings) {
        var admitted = new ArrayList<PatternTemplate>();
        for (PatternTemplate pattern : patterns.patterns()) {
            if (pattern.confidence() >= settings.patternMinimumConfidence()) {
                admitted.add(pattern);
            } else {
                log.info("Pattern {} ignored: confidence {} is below the minimum {}",
                    pattern.id(), pattern.confidence(), settings.patternMinimumConfidence());
            }
        }
        this.patterns = List.copyOf(admitted);
        this.services = services;
    }

    public TaggedFlow recognize(AnnotatedFlow annotated) {
        var tags = new ArrayList<PatternTag>();
        scan(annotated, annotated.flow().steps(), tags);
        for (PatternTag tag : tags) {
            log.debug("Pattern {} matched at {} ({} steps)", tag.patternId(), tag.firstStepPath(), tag.length());
        }
        return new TaggedFlow(annotated, tags);
    }

    private void scan(AnnotatedFlow annotated, List<Step> steps, List<PatternTag> tags) {
        int i = 0;
        while (i < steps.size()) {
            PatternTag best = null;
            for (PatternTemplate pattern : patterns) {
                PatternTag candidate = match(annotated, pattern, steps, i);
                if (candidate != null && (best == null || candidate.length() > best.length())) {
                    best = candidate;
                }
            }
            if (best != null) {
                tags.add(best);
                i += best.length();
                continue;
            }
            Step step = steps.get(i);
            if (step instanceof Step.BranchStep branch) {
                for (BranchCase branchCase : branch.cases()) {
                    scan(annotated, branchCase.steps(), tags);
                }
            } else {
                scan(annotated, step.children(), tags);
            }
            i++;
        }
    }

    private PatternTag match(AnnotatedFlow annotated, PatternTemplate pattern, List<Step> steps, int start) {
        List<ElementMatcher> sequence = pattern.sequence();
        if (start + sequence.size() > steps.size()) {
            return null;
        }
        var context = new MatchContext(annotated);
        var paths = new ArrayList<String>();
        Step previous = null;
        for (int k = 0; k < sequence.size(); k++) {
            Step step = steps.get(start + k);
            if (!context.matches(sequence.get(k), step, previous, null)) {
                return null;
            }
            paths.add(step.path());
            previous = step;
        }
        return new PatternTag(pattern.id(), paths, context.captures, context.values, pattern.confidence());
    }

    /** Captures and extracted values for one attempted match. */
    private final class MatchContext {

        final AnnotatedFlow annotated;
        final Map<String, Step> captures = new LinkedHashMap<>();
        final Map<String, String> values = new LinkedHashMap<>();

        MatchContext(AnnotatedFlow annotated) {
            this.annotated = annotated;
        }

        boolean matches(ElementMatcher matcher, Step step, Step previous, String element) {
            if (step.verb() != matcher.verb() || annotated.hasDanglingUnder(step.path())) {
                return false;
            }
            for (Requirement requirement : matcher.requires()) {
                if (!satisfies(requirement, step, previous, element)) {
                    return false;
                }
            }
            if (step instanceof Step.LoopStep loop && !matcher.body().isEmpty()) {
                if (loop.steps().size() != matcher.body().size()) {
                    return false;
                }
                String loopElement = References.root(loop.inputArray());
                Step bodyPrevious = null;
                for (int k = 0; k < loop.steps().size(); k++) {
                    if (!matches(matcher.body().get(k), loop.steps().get(k), bodyPrevious, loopElement)) {
                        return false;
                    }
                    bodyPrevious = loop.steps().get(k);
                }
            }
            if (matcher.capture() != null) {
                capture(matcher.capture(), step);
            }
            return true;
        }

        boolean satisfies(Requirement requirement, Step step, Step previous, String element) {
            return switch (requirement) {
                case RESOLVED_CONNECTOR -> step instanceof Step.InvokeStep invoke
                    && services.lookup(invoke.service()) instanceof CatalogEntry.Known known
                    && known.template().isConnector();
                case INTRODUCES_LIST -> {
                    PipelineState after = annotated.statesOf(step.path()).after();
                    yield introduced(step).stream()
                        .anyMatch(name -> after.typeOf(name).map(FieldType::isList).orElse(false));
                }
                case INTRODUCES_VARIABLE -> !introduced(step).isEmpty();
                case ITERATES_INTRODUCED_LIST -> {
                    if (!(step instanceof Step.LoopStep loop) || previous == null) {
                        yield false;
                    }
                    String input = References.root(loop.inputArray());
                    yield introduced(previous).contains(input)
                        && annotated.statesOf(previous.path()).after().typeOf(input)
                            .map(FieldType::isList).orElse(false);
                }
                case NO_INDEX_STATE -> step instanceof Step.LoopStep
                    && !References.deep(step).contains(PipelineTracker.ITERATION_VARIABLE);
                case NO_OUTPUT_ARRAY -> step instanceof Step.LoopStep loop && !loop.collectsOutput();
                case CONSUMES_ELEMENT -> element != null && References.deep(step).contains(element);
                case CONSUMES_INTRODUCED -> previous != null
                    && !Collections.disjoint(References.deep(step), introduced(previous));
                case SIMPLE_ASSIGNMENTS -> step instanceof Step.MapStep map && ShapeConverter.isSimple(map);
            };
        }

        Set<String> introduced(Step step) {
            StepStates states = annotated.statesOf(step.path());
            var names = new LinkedHashSet<>(states.after().names());
            names.removeAll(states.before().names());
            return names;
        }

        void capture(String name, Step step) {
            captures.put(name, step);
            values.put(name + ".path", step.path());
            values.put(name + ".label", ShapeConverter.label(step));
            if (step instanceof Step.InvokeStep invoke) {
                values.put(name + ".service", invoke.service());
                if (services.lookup(invoke.service()) instanceof CatalogEntry.Known known) {
                    known.template().configuration().forEach((key, value) -> values.put(name + "." + key, value));
                }
            } else if (step instanceof Step.LoopStep loop) {
                values.put(name + ".input", loop.inputArray());
                if (loop.outputArray() != null) {
                    values.put(name + ".output", loop.outputArray());
                }
            }
        }
    }
}
