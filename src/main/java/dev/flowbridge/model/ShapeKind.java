package dev.flowbridge.model;

import java.util.Optional;
import java.util.Set;

/**
 * Shapes of the target process graph, with the platform's shape type code and the
 * configuration keys a shape must carry to be deployable.
 */
public enum ShapeKind {
    START("start", Set.of()),
    STOP("stop", Set.of()),
    EXCEPTION("exception", Set.of("message")),
    MAP("map", Set.of("mappings")),
    CONNECTOR("connectoraction", Set.of("connectorType", "operation")),
    DECISION("decision", Set.of("routes")),
    TRY_CATCH("catcherrors", Set.of("retryCount")),
    FOR_EACH("flowcontrol", Set.of("input")),
    DATA_PROCESS("dataprocess", Set.of("script")),
    SET_PROPERTIES("documentproperties", Set.of("properties")),
    NOTIFY("notify", Set.of("message")),
    PROCESS_CALL("processcall", Set.of("process")),
    PLACEHOLDER("dataprocess", Set.of("service"));

    private final String shapeType;
    private final Set<String> requiredConfiguration;

    ShapeKind(String shapeType, Set<String> requiredConfiguration) {
        this.shapeType = shapeType;
        this.requiredConfiguration = requiredConfiguration;
    }

    public String shapeType() {
        return shapeType;
    }

    public Set<String> requiredConfiguration() {
        return requiredConfiguration;
    }

    /** Terminal shapes end a path and need no outgoing connection. */
    public boolean isTerminal() {
        return this == STOP || this == EXCEPTION;
    }

    public static Optional<ShapeKind> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        for (ShapeKind kind : values()) {
            if (kind.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
