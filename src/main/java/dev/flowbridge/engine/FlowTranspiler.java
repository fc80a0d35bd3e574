package dev.flowbridge.engine;

import dev.flowbridge.catalog.PatternCatalog;
import dev.flowbridge.catalog.ServiceCatalog;
import dev.flowbridge.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;

/**
 * Runs one flow through every stage: parse, track, recognize, convert,
 * assemble, validate. Stages share nothing mutable, so one transpiler may
 * serve many threads.
 */
public final class FlowTranspiler {

    private static final Logger log = LoggerFactory.getLogger(FlowTranspiler.class);

    private final ConversionSettings settings;
    private final PipelineTracker tracker;
    private final PatternRecognizer recognizer;
    private final ShapeConverter converter;
    private final GraphAssembler assembler;

    public FlowTranspiler(ServiceCatalog services, PatternCatalog patterns, ConversionSettings settings) {
        this.settings = settings;
        this.tracker = new PipelineTracker(services);
        this.recognizer = new PatternRecognizer(patterns, services, settings);
        this.converter = new ShapeConverter(services, patterns, settings);
        this.assembler = new GraphAssembler(settings);
    }

    /**
     * Convert a {@code flow.xml} document.
     *
     * @throws FlowParseException    if the document is not a valid flow
     * @throws CancellationException if the calling thread is interrupted between stages
     */
    public ConversionOutcome convert(String xml) throws FlowParseException {
        return convert(FlowParser.parse(xml));
    }

    public ConversionOutcome convert(FlowDefinition flow) {
        checkCancelled(flow);
        AnnotatedFlow annotated = tracker.track(flow);
        checkCancelled(flow);
        TaggedFlow tagged = recognizer.recognize(annotated);
        checkCancelled(flow);
        ShapePlan plan = converter.convert(tagged);
        checkCancelled(flow);
        ProcessDocument document = assembler.assemble(flow.name(), plan);
        checkCancelled(flow);
        ValidationReport report = ProcessValidator.validate(document);

        if (!report.accepted()) {
            log.warn("Rejected {}: {} validation error(s), first: {}",
                flow.name(), report.errors().size(), report.errors().get(0).message());
            return new ConversionOutcome.Rejected(flow.name(), report, plan.notes(), plan.warnings());
        }

        int aggregate = plan.aggregateConfidence(settings);
        var result = new ConversionResult(
            flow.name(),
            document,
            plan.stepConfidence(),
            aggregate,
            aggregate >= settings.unattendedThreshold(),
            tagged.patternIds(),
            plan.notes(),
            plan.warnings(),
            FlowStatistics.of(flow));
        log.info("Converted {}: {} shapes, confidence {}, {} review note(s){}",
            flow.name(), document.nodes().size(), aggregate, plan.notes().size(),
            result.readyForUnattendedDeployment() ? "" : " [needs review]");
        return new ConversionOutcome.Validated(result, report);
    }

    private static void checkCancelled(FlowDefinition flow) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Conversion of " + flow.name() + " cancelled");
        }
    }
}
