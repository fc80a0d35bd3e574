package dev.flowbridge.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One positioned shape of a generated process.
 *
 * <p>Configuration values are strings, numbers, booleans, or lists of strings or
 * string-to-string maps; that is all the process writer knows how to emit.
 */
public record TargetNode(
    String id,
    ShapeKind kind,
    String label,
    Position position,
    Map<String, Object> configuration,
    int confidence,
    String sourceStep, // nullable for synthesized start/stop shapes
    List<ConversionWarning> warnings
) {
    public TargetNode {
        configuration = Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
        warnings = List.copyOf(warnings);
    }

    public record Position(int x, int y) {}
}
