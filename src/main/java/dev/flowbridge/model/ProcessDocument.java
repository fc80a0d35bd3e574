package dev.flowbridge.model;

import java.util.List;
import java.util.Optional;

/**
 * A complete generated process: positioned shapes and explicit connections.
 */
public record ProcessDocument(
    String name,
    String description,
    List<TargetNode> nodes,
    List<TargetEdge> edges
) {
    public ProcessDocument {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public Optional<TargetNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public List<TargetEdge> outgoing(String id) {
        return edges.stream().filter(e -> e.fromId().equals(id)).toList();
    }

    public List<TargetEdge> incoming(String id) {
        return edges.stream().filter(e -> e.toId().equals(id)).toList();
    }

    public List<TargetNode> nodesOfKind(ShapeKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).toList();
    }
}
