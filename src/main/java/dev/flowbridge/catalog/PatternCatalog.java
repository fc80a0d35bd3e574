package dev.flowbridge.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Versioned, ordered set of pattern templates. Declaration order breaks ties.
 */
public record PatternCatalog(String version, List<PatternTemplate> patterns) {

    public PatternCatalog {
        patterns = List.copyOf(patterns);
    }

    public static PatternCatalog empty() {
        return new PatternCatalog("empty", List.of());
    }

    public Optional<PatternTemplate> find(String id) {
        return patterns.stream().filter(p -> p.id().equals(id)).findFirst();
    }
}
