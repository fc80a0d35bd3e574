package dev.flowbridge.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineStateTest {

    @Test
    void transitionsReturnNewInstances() {
        PipelineState empty = PipelineState.empty();
        PipelineState one = empty.with("order", FieldType.DOCUMENT);

        assertThat(empty.size()).isZero();
        assertThat(one.typeOf("order")).contains(FieldType.DOCUMENT);
        assertThat(one.without("order")).isEqualTo(empty);
        assertThat(one.size()).isEqualTo(1);
    }

    @Test
    void reassignmentKeepsPositionAndReplacesType() {
        PipelineState state = PipelineState.of(List.of(
            new FieldDecl("a", FieldType.STRING),
            new FieldDecl("b", FieldType.STRING)));

        PipelineState changed = state.with("a", FieldType.DOCUMENT);

        assertThat(changed.names()).containsExactly("a", "b");
        assertThat(changed.typeOf("a")).contains(FieldType.DOCUMENT);
        assertThat(state.typeOf("a")).contains(FieldType.STRING);
    }

    @Test
    void noOpTransitionsReturnSameInstance() {
        PipelineState state = PipelineState.empty().with("a", FieldType.STRING);

        assertThat(state.with("a", FieldType.STRING)).isSameAs(state);
        assertThat(state.without("missing")).isSameAs(state);
        assertThat(state.withAll(Map.of())).isSameAs(state);
    }

    @Test
    void exposedViewsAreReadOnly() {
        PipelineState state = PipelineState.empty().with("a", FieldType.STRING);

        assertThatThrownBy(() -> state.asMap().put("b", FieldType.STRING))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> state.names().remove("a"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
