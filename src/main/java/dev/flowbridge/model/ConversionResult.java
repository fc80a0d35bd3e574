package dev.flowbridge.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything produced for one flow: the process document, how far it can be trusted,
 * and what needs a person's attention.
 */
public record ConversionResult(
    String flowName,
    ProcessDocument document,
    Map<String, Integer> stepConfidence,
    int aggregateConfidence,
    boolean readyForUnattendedDeployment,
    List<String> patterns,
    List<ReviewNote> reviewNotes,
    List<ConversionWarning> warnings,
    FlowStatistics statistics
) {
    public ConversionResult {
        stepConfidence = Collections.unmodifiableMap(new LinkedHashMap<>(stepConfidence));
        patterns = List.copyOf(patterns);
        reviewNotes = List.copyOf(reviewNotes);
        warnings = List.copyOf(warnings);
    }
}
