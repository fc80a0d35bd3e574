package dev.flowbridge.engine;

import dev.flowbridge.engine.ShapePlan.Dependency;
import dev.flowbridge.engine.ShapePlan.OpenEnd;
import dev.flowbridge.engine.ShapePlan.PlannedNode;
import dev.flowbridge.model.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lays out a shape plan and turns it into a process document with stable ids.
 *
 * <p>The start shape is {@code shape1}; planned shapes follow in traversal
 * order; a stop shape is appended when any path is still open. Row and column
 * hints become coordinates on a fixed grid.
 */
public final class GraphAssembler {

    static final int ORIGIN = 50;

    private final ConversionSettings settings;

    public GraphAssembler(ConversionSettings settings) {
        this.settings = settings;
    }

    public ProcessDocument assemble(String flowName, ShapePlan plan) {
        var ids = new HashMap<String, String>();
        var nodes = new ArrayList<TargetNode>();

        String startId = shapeId(1);
        ids.put(ShapePlan.START, startId);
        nodes.add(new TargetNode(startId, ShapeKind.START, "Start", position(0, 0),
            Map.of(), 100, null, List.of()));

        int maxRow = 0;
        for (PlannedNode planned : plan.nodes()) {
            String id = shapeId(nodes.size() + 1);
            ids.put(planned.key(), id);
            nodes.add(new TargetNode(id, planned.kind(), planned.label(),
                position(planned.row(), planned.column()), planned.configuration(),
                planned.confidence(), planned.stepPath(), planned.warnings()));
            maxRow = Math.max(maxRow, planned.row());
        }

        var edges = new ArrayList<TargetEdge>();
        for (Dependency dependency : plan.dependencies()) {
            edges.add(new TargetEdge(resolve(ids, dependency.from()), resolve(ids, dependency.to()),
                dependency.label()));
        }

        if (!plan.openEnds().isEmpty()) {
            String stopId = shapeId(nodes.size() + 1);
            nodes.add(new TargetNode(stopId, ShapeKind.STOP, "Stop", position(maxRow + 1, 0),
                Map.of("continue", true), 100, null, List.of()));
            for (OpenEnd end : plan.openEnds()) {
                edges.add(new TargetEdge(resolve(ids, end.nodeKey()), stopId, end.label()));
            }
        }
        return new ProcessDocument(flowName, "Generated from flow service " + flowName, nodes, edges);
    }

    private TargetNode.Position position(int row, int column) {
        return new TargetNode.Position(
            ORIGIN + column * settings.columnSpacing(),
            ORIGIN + row * settings.rowSpacing());
    }

    private static String resolve(Map<String, String> ids, String key) {
        String id = ids.get(key);
        if (id == null) {
            throw new IllegalStateException("Connection refers to unplanned shape " + key);
        }
        return id;
    }

    static String shapeId(int n) {
        return "shape" + n;
    }
}
