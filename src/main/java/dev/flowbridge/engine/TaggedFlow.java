package dev.flowbridge.engine;

import dev.flowbridge.model.PatternTag;

import java.util.List;
import java.util.Optional;

/**
 * An annotated flow plus the pattern tags found in it. Tags never overlap.
 */
public record TaggedFlow(AnnotatedFlow annotated, List<PatternTag> tags) {

    public TaggedFlow {
        tags = List.copyOf(tags);
    }

    /** The tag whose run starts at this step, if any. */
    public Optional<PatternTag> tagStartingAt(String stepPath) {
        return tags.stream().filter(t -> t.firstStepPath().equals(stepPath)).findFirst();
    }

    public List<String> patternIds() {
        return tags.stream().map(PatternTag::patternId).toList();
    }
}
