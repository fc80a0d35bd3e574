package dev.flowbridge.engine;

import dev.flowbridge.model.ConversionSettings;
import dev.flowbridge.model.ConversionWarning;
import dev.flowbridge.model.ReviewNote;
import dev.flowbridge.model.ShapeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shapes planned for one flow, before ids and coordinates are assigned.
 * Nodes are in traversal order; dependencies refer to node keys or {@link #START}.
 */
public record ShapePlan(
    List<PlannedNode> nodes,
    List<Dependency> dependencies,
    List<OpenEnd> openEnds,
    List<ReviewNote> notes,
    List<ConversionWarning> warnings,
    Map<String, Integer> stepConfidence
) {
    /** Stands for the start shape the assembler prepends. */
    public static final String START = "START";

    public ShapePlan {
        nodes = List.copyOf(nodes);
        dependencies = List.copyOf(dependencies);
        openEnds = List.copyOf(openEnds);
        notes = List.copyOf(notes);
        warnings = List.copyOf(warnings);
        stepConfidence = Collections.unmodifiableMap(new LinkedHashMap<>(stepConfidence));
    }

    public record PlannedNode(
        String key,
        ShapeKind kind,
        String label,
        Map<String, Object> configuration,
        int confidence,
        String stepPath,
        int row,
        int column,
        List<ConversionWarning> warnings
    ) {
        public PlannedNode {
            configuration = Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
            warnings = List.copyOf(warnings);
        }
    }

    public record Dependency(String from, String to, String label) {}

    /** A path that still needs a successor; the assembler routes it to a stop shape. */
    public record OpenEnd(String nodeKey, String label) {}

    /**
     * Mean node confidence, held below the unattended threshold when any node
     * needs manual review. A plan with no nodes scores 100.
     */
    public int aggregateConfidence(ConversionSettings settings) {
        if (nodes.isEmpty()) {
            return 100;
        }
        int mean = (int) Math.round(nodes.stream().mapToInt(PlannedNode::confidence).average().orElse(100));
        boolean needsReview = nodes.stream().anyMatch(n -> n.confidence() <= settings.manualReviewCeiling());
        return needsReview ? Math.min(mean, settings.unattendedThreshold() - 1) : mean;
    }
}
