package com.formflow.formflow_engine.engine;

import com.formflow.formflow_engine.model.variable.VariableMeta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoopVariableScopeTest {

    private LoopVariableScope scope;

    @BeforeEach
    void setUp() {
        scope = new LoopVariableScope();
    }

    @Test
    void pushAndPop_shouldTrackDepth() {
        assertThat(scope.isInsideLoop()).isFalse();
        assertThat(scope.current()).isNull();

        scope.push(Map.of("item", "a", "index", 0));
        assertThat(scope.isInsideLoop()).isTrue();
        assertThat(scope.getDepth()).isEqualTo(1);
        assertThat(scope.getValue("item")).isEqualTo("a");

        Map<String, Object> popped = scope.pop();
        assertThat(popped).containsEntry("index", 0);
        assertThat(scope.getDepth()).isZero();
        assertThat(scope.getValue("item")).isNull();
    }

    @Test
    void pop_shouldFailOnEmptyStack() {
        assertThatThrownBy(() -> scope.pop()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void innerFrame_shouldShadowOuterUntilPopped() {
        scope.push(Map.of("item", "outer", "index", 3));
        scope.push(Map.of("item", "inner"));

        assertThat(scope.getValue("item")).isEqualTo("inner");
        assertThat(scope.getValue("index")).isEqualTo(3);

        scope.pop();
        assertThat(scope.getValue("item")).isEqualTo("outer");
    }

    @Test
    void getValue_shouldReturnNullBoundInInnerFrame() {
        Map<String, Object> inner = new HashMap<>();
        inner.put("item", null);
        scope.push(Map.of("item", "outer"));
        scope.push(inner);

        assertThat(scope.contains("item")).isTrue();
        assertThat(scope.getValue("item")).isNull();
    }

    @Test
    void getAvailableVariables_shouldKeepInnermostValue() {
        scope.push(Map.of("item", "outer", "total", 2));
        scope.push(Map.of("item", "inner"));

        List<VariableMeta> available = scope.getAvailableVariables();

        assertThat(available).extracting(VariableMeta::getName).containsExactlyInAnyOrder("item", "total");
        VariableMeta item = available.stream().filter(m -> m.getName().equals("item")).findFirst().orElseThrow();
        assertThat(item.getValue()).isEqualTo("inner");
        assertThat(item.getDepth()).isEqualTo(2);
        assertThat(item.isStandard()).isTrue();
        assertThat(item.getDescription()).isEqualTo("Current loop element");
    }

    @Test
    void getVariableDescription_shouldOnlyKnowStandardNames() {
        assertThat(LoopVariableScope.getVariableDescription("iteration")).isEqualTo("Current iteration number (1-based)");
        assertThat(LoopVariableScope.getVariableDescription("customer")).isNull();
    }

    @Test
    void createStandardVariableMeta_shouldFlagNonStandardNames() {
        Map<String, VariableMeta> meta = LoopVariableScope.createStandardVariableMeta(Map.of("row", 1, "index", 0));

        assertThat(meta.get("row").isStandard()).isFalse();
        assertThat(meta.get("index").isStandard()).isTrue();
    }

    @Test
    void clear_shouldDropAllFrames() {
        scope.push(Map.of("item", 1));
        scope.push(Map.of("item", 2));
        scope.clear();

        assertThat(scope.isInsideLoop()).isFalse();
    }
}
