package dev.flowbridge.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FlowStatisticsTest {

    private static Step.MapStep map(String path) {
        return new Step.MapStep(path, null, List.of(new MapOperation.Set("a", "1", null)));
    }

    private static Step.InvokeStep invoke(String path) {
        return new Step.InvokeStep(path, null, "pub.client:http", List.of(), List.of());
    }

    @Test
    void countsVerbsAndNesting() {
        var loop = new Step.LoopStep("FLOW/LOOP[1]", null, "items", null,
            List.of(invoke("FLOW/LOOP[1]/INVOKE[0]")), List.of());
        var flow = new FlowDefinition("stats", List.of(), List.of(invoke("FLOW/INVOKE[0]"), loop));

        FlowStatistics stats = FlowStatistics.of(flow);

        assertThat(stats.verbCounts())
            .containsEntry(Verb.INVOKE, 2)
            .containsEntry(Verb.LOOP, 1)
            .containsEntry(Verb.BRANCH, 0);
        assertThat(stats.totalSteps()).isEqualTo(3);
        assertThat(stats.maxDepth()).isEqualTo(1);
        // nesting 1*3 + INVOKE 2*2 + LOOP 4
        assertThat(stats.complexityScore()).isEqualTo(11);
        assertThat(stats.complexity()).isEqualTo(FlowStatistics.Complexity.LOW);
    }

    @Test
    void deeplyNestedFlowIsHighComplexity() {
        Step inner = map("FLOW/X/MAP[0]");
        for (int depth = 0; depth < 8; depth++) {
            inner = new Step.RepeatStep("FLOW/REPEAT" + depth, null, 3, Step.RepeatOn.FAILURE,
                List.of(inner), List.of());
        }
        var branch = new Step.BranchStep("FLOW/BRANCH[1]", null, "tier",
            List.of(new BranchCase("a", false, List.of(map("a"))), new BranchCase("b", false, List.of(map("b")))),
            List.of());
        var flow = new FlowDefinition("deep", List.of(), List.of(inner, branch));

        FlowStatistics stats = FlowStatistics.of(flow);

        assertThat(stats.maxDepth()).isEqualTo(8);
        assertThat(stats.verbCounts()).containsEntry(Verb.REPEAT, 8).containsEntry(Verb.MAP, 3);
        assertThat(stats.complexity()).isEqualTo(FlowStatistics.Complexity.HIGH);
    }

    @Test
    void emptyFlowHasNoComplexity() {
        FlowStatistics stats = FlowStatistics.of(new FlowDefinition("empty", List.of(), List.of()));

        assertThat(stats.totalSteps()).isZero();
        assertThat(stats.complexityScore()).isZero();
        assertThat(stats.complexity()).isEqualTo(FlowStatistics.Complexity.LOW);
    }
}
