package dev.flowbridge.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the pipeline at one point of a flow: variable name to declared type,
 * in insertion order. Every transition returns a new instance.
 */
public final class PipelineState {

    private static final PipelineState EMPTY = new PipelineState(new LinkedHashMap<>());

    private final Map<String, FieldType> variables;

    private PipelineState(LinkedHashMap<String, FieldType> variables) {
        this.variables = Collections.unmodifiableMap(variables);
    }

    public static PipelineState empty() {
        return EMPTY;
    }

    public static PipelineState of(List<FieldDecl> fields) {
        var vars = new LinkedHashMap<String, FieldType>();
        for (FieldDecl field : fields) {
            vars.put(field.name(), field.type());
        }
        return new PipelineState(vars);
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public Optional<FieldType> typeOf(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public Set<String> names() {
        return variables.keySet();
    }

    public Map<String, FieldType> asMap() {
        return variables;
    }

    public int size() {
        return variables.size();
    }

    /**
     * Add or replace a variable. A later assignment to the same name overrides its type
     * and keeps its original position.
     */
    public PipelineState with(String name, FieldType type) {
        if (type == variables.get(name)) {
            return this;
        }
        var copy = new LinkedHashMap<>(variables);
        copy.put(name, type);
        return new PipelineState(copy);
    }

    public PipelineState withAll(Map<String, FieldType> additions) {
        if (additions.isEmpty()) {
            return this;
        }
        var copy = new LinkedHashMap<>(variables);
        copy.putAll(additions);
        return new PipelineState(copy);
    }

    public PipelineState without(String name) {
        if (!variables.containsKey(name)) {
            return this;
        }
        var copy = new LinkedHashMap<>(variables);
        copy.remove(name);
        return new PipelineState(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PipelineState other)) return false;
        return variables.equals(other.variables);
    }

    @Override
    public int hashCode() {
        return variables.hashCode();
    }

    @Override
    public String toString() {
        return "PipelineState" + variables;
    }
}
