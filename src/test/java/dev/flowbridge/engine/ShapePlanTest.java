package dev.flowbridge.engine;

import dev.flowbridge.engine.ShapePlan.PlannedNode;
import dev.flowbridge.model.ConversionSettings;
import dev.flowbridge.model.ShapeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ShapePlanTest {

    private static final ConversionSettings SETTINGS = ConversionSettings.defaults();

    private static PlannedNode node(String key, int confidence) {
        return new PlannedNode(key, ShapeKind.MAP, key, Map.of(), confidence, "FLOW/MAP[0]", 1, 0, List.of());
    }

    private static ShapePlan planOf(List<PlannedNode> nodes) {
        return new ShapePlan(nodes, List.of(), List.of(), List.of(), List.of(), Map.of());
    }

    @Test
    void emptyPlanIsFullyConfident() {
        assertThat(planOf(List.of()).aggregateConfidence(SETTINGS)).isEqualTo(100);
    }

    @Test
    void aggregateIsTheMeanNodeConfidence() {
        ShapePlan plan = planOf(List.of(node("n1", 90), node("n2", 95), node("n3", 100)));

        assertThat(plan.aggregateConfidence(SETTINGS)).isEqualTo(95);
    }

    @Test
    void anyNodeNeedingReviewHoldsAggregateBelowThreshold() {
        // mean is 85, but one node sits at the manual review ceiling
        ShapePlan plan = planOf(List.of(node("n1", 100), node("n2", 100), node("n3", 70), node("n4", 70)));

        assertThat(plan.aggregateConfidence(SETTINGS)).isEqualTo(SETTINGS.unattendedThreshold() - 1);
    }
}
