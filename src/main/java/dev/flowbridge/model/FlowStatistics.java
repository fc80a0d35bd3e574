package dev.flowbridge.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Verb counts and a weighted complexity rating for one flow.
 */
public record FlowStatistics(
    Map<Verb, Integer> verbCounts,
    int maxDepth,
    int complexityScore,
    Complexity complexity
) {
    public enum Complexity { LOW, MEDIUM, HIGH }

    private static final int NESTING_WEIGHT = 3;

    public FlowStatistics {
        verbCounts = Map.copyOf(verbCounts);
    }

    public static FlowStatistics of(FlowDefinition flow) {
        var counts = new EnumMap<Verb, Integer>(Verb.class);
        for (Verb verb : Verb.values()) {
            counts.put(verb, 0);
        }
        int depth = count(flow.steps(), counts, 0);

        int score = depth * NESTING_WEIGHT;
        for (var entry : counts.entrySet()) {
            score += entry.getValue() * weight(entry.getKey());
        }
        Complexity level = score < 20 ? Complexity.LOW
            : score < 50 ? Complexity.MEDIUM
            : Complexity.HIGH;
        return new FlowStatistics(counts, depth, score, level);
    }

    public int totalSteps() {
        return verbCounts.values().stream().mapToInt(Integer::intValue).sum();
    }

    private static int count(List<Step> steps, Map<Verb, Integer> counts, int depth) {
        int max = depth;
        for (Step step : steps) {
            counts.merge(step.verb(), 1, Integer::sum);
            if (!step.children().isEmpty()) {
                max = Math.max(max, count(step.children(), counts, depth + 1));
            }
        }
        return max;
    }

    private static int weight(Verb verb) {
        return switch (verb) {
            case MAP, EXIT -> 1;
            case SEQUENCE, INVOKE, TRY, CATCH -> 2;
            case BRANCH -> 3;
            case LOOP, REPEAT -> 4;
        };
    }
}
