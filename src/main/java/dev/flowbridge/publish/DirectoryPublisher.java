package dev.flowbridge.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.flowbridge.engine.ProcessXmlWriter;
import dev.flowbridge.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Writes {@code <flow>.xml} (the process component) and {@code <flow>.report.json}
 * (confidence, notes, warnings, statistics) into one output directory.
 */
public final class DirectoryPublisher implements ProcessPublisher {

    private static final Logger log = LoggerFactory.getLogger(DirectoryPublisher.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path outputDir;
    // file base name -> flow that owns it
    private final Map<String, String> claimed = new HashMap<>();

    public DirectoryPublisher(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public PublishReceipt publish(ConversionOutcome.Validated outcome) throws IOException {
        ConversionResult result = outcome.result();
        Files.createDirectories(outputDir);

        String base = claim(result.flowName());
        Path processFile = outputDir.resolve(base + ".xml");
        Path reportFile = outputDir.resolve(base + ".report.json");

        Files.writeString(processFile, ProcessXmlWriter.write(result.document()), StandardCharsets.UTF_8);
        MAPPER.writeValue(reportFile.toFile(), report(result, outcome.report()));
        log.info("Published {} to {}", result.flowName(), processFile);

        return new PublishReceipt(result.flowName(), processFile, reportFile,
            result.aggregateConfidence(), result.readyForUnattendedDeployment());
    }

    @Override
    public String getName() {
        return "directory:" + outputDir;
    }

    /**
     * Reserve a base name for a flow. Distinct flows whose names sanitize to the
     * same file get a numeric suffix; publishing the same flow again reuses its name.
     */
    synchronized String claim(String flowName) {
        String base = fileName(flowName);
        String candidate = base;
        for (int n = 2; claimed.containsKey(candidate) && !claimed.get(candidate).equals(flowName); n++) {
            candidate = base + "-" + n;
        }
        if (!candidate.equals(base)) {
            log.warn("Flow {} would overwrite the output of {}; writing it as {}",
                flowName, claimed.get(base), candidate);
        }
        claimed.put(candidate, flowName);
        return candidate;
    }

    /** Flow names contain ':' and other characters that do not belong in file names. */
    static String fileName(String flowName) {
        return flowName.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    static ObjectNode report(ConversionResult result, ValidationReport validation) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("flow", result.flowName());
        root.put("aggregateConfidence", result.aggregateConfidence());
        root.put("readyForUnattendedDeployment", result.readyForUnattendedDeployment());

        ArrayNode patterns = root.putArray("patterns");
        result.patterns().forEach(patterns::add);

        ObjectNode steps = root.putObject("stepConfidence");
        result.stepConfidence().forEach((path, confidence) -> steps.put(path, confidence.intValue()));

        ArrayNode notes = root.putArray("reviewNotes");
        for (ReviewNote note : result.reviewNotes()) {
            notes.addObject().put("step", note.stepPath()).put("message", note.message());
        }

        ArrayNode warnings = root.putArray("warnings");
        for (ConversionWarning warning : result.warnings()) {
            warnings.addObject()
                .put("type", warning.getClass().getSimpleName())
                .put("step", warning.stepPath())
                .put("message", warning.message());
        }

        FlowStatistics stats = result.statistics();
        ObjectNode statistics = root.putObject("statistics");
        statistics.put("totalSteps", stats.totalSteps());
        statistics.put("maxDepth", stats.maxDepth());
        statistics.put("complexityScore", stats.complexityScore());
        statistics.put("complexity", stats.complexity().name());
        ObjectNode verbs = statistics.putObject("verbs");
        for (Verb verb : Verb.values()) {
            verbs.put(verb.name(), stats.verbCounts().getOrDefault(verb, 0));
        }

        ObjectNode validationNode = root.putObject("validation");
        validationNode.put("status", validation.status().name());
        ArrayNode issues = validationNode.putArray("issues");
        for (ValidationIssue issue : validation.issues()) {
            issues.addObject()
                .put("kind", issue.kind().name())
                .put("severity", issue.severity().name())
                .put("shape", issue.nodeId())
                .put("message", issue.message());
        }
        return root;
    }
}
