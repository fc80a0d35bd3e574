package dev.flowbridge.engine;

import dev.flowbridge.engine.ShapePlan.Dependency;
import dev.flowbridge.engine.ShapePlan.OpenEnd;
import dev.flowbridge.engine.ShapePlan.PlannedNode;
import dev.flowbridge.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphAssemblerTest {

    private final GraphAssembler assembler = new GraphAssembler(ConversionSettings.defaults());

    private static PlannedNode node(String key, int row, int column) {
        return new PlannedNode(key, ShapeKind.MAP, "Map " + key,
            Map.of("mappings", List.of(Map.of("value", "1", "to", key))), 90, "FLOW/MAP[" + key + "]",
            row, column, List.of());
    }

    @Test
    void assignsIdsInTraversalOrderAndAppendsStop() {
        var plan = new ShapePlan(
            List.of(node("n1", 1, 0), node("n2", 2, 1)),
            List.of(new Dependency(ShapePlan.START, "n1", null), new Dependency("n1", "n2", "next")),
            List.of(new OpenEnd("n2", null)),
            List.of(), List.of(), Map.of());

        ProcessDocument process = assembler.assemble("orders:sync", plan);

        assertThat(process.name()).isEqualTo("orders:sync");
        assertThat(process.description()).isEqualTo("Generated from flow service orders:sync");
        assertThat(process.nodes()).extracting(TargetNode::id)
            .containsExactly("shape1", "shape2", "shape3", "shape4");
        assertThat(process.nodes()).extracting(TargetNode::kind)
            .containsExactly(ShapeKind.START, ShapeKind.MAP, ShapeKind.MAP, ShapeKind.STOP);
        assertThat(process.edges()).containsExactly(
            new TargetEdge("shape1", "shape2", null),
            new TargetEdge("shape2", "shape3", "next"),
            new TargetEdge("shape3", "shape4", null));

        // Verify grid positions
        assertThat(process.node("shape1").orElseThrow().position()).isEqualTo(new TargetNode.Position(50, 50));
        assertThat(process.node("shape2").orElseThrow().position()).isEqualTo(new TargetNode.Position(50, 200));
        assertThat(process.node("shape3").orElseThrow().position()).isEqualTo(new TargetNode.Position(300, 350));
        assertThat(process.node("shape4").orElseThrow().position()).isEqualTo(new TargetNode.Position(50, 500));
        assertThat(process.node("shape4").orElseThrow().configuration()).containsEntry("continue", true);
    }

    @Test
    void everyEdgeConnectsKnownShapes() {
        var plan = new ShapePlan(
            List.of(node("n1", 1, 0), node("n2", 2, 0), node("n3", 3, 1)),
            List.of(new Dependency(ShapePlan.START, "n1", null),
                new Dependency("n1", "n2", "A"),
                new Dependency("n1", "n3", "B")),
            List.of(new OpenEnd("n2", null), new OpenEnd("n3", null), new OpenEnd("n1", "default")),
            List.of(), List.of(), Map.of());

        ProcessDocument process = assembler.assemble("branchy", plan);

        var ids = process.nodes().stream().map(TargetNode::id).collect(Collectors.toSet());
        assertThat(ids).hasSize(process.nodes().size());
        for (TargetEdge edge : process.edges()) {
            assertThat(ids).contains(edge.fromId(), edge.toId());
        }
        assertThat(process.incoming("shape5")).hasSize(3);
    }

    @Test
    void closedPlanGetsNoStop() {
        var exception = new PlannedNode("n1", ShapeKind.EXCEPTION, "Fail", Map.of("message", "boom"), 90,
            "FLOW/EXIT[0]", 1, 0, List.of());
        var plan = new ShapePlan(List.of(exception), List.of(new Dependency(ShapePlan.START, "n1", null)),
            List.of(), List.of(), List.of(), Map.of());

        ProcessDocument process = assembler.assemble("fails", plan);

        assertThat(process.nodesOfKind(ShapeKind.STOP)).isEmpty();
        assertThat(process.nodes()).hasSize(2);
    }

    @Test
    void dependencyOnUnplannedShapeIsABug() {
        var plan = new ShapePlan(List.of(node("n1", 1, 0)),
            List.of(new Dependency("n7", "n1", null)), List.of(), List.of(), List.of(), Map.of());

        assertThatThrownBy(() -> assembler.assemble("bad", plan))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("n7");
    }
}
