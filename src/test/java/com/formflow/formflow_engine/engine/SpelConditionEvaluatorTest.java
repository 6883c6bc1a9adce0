package com.formflow.formflow_engine.engine;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SpelConditionEvaluatorTest {

    private final SpelConditionEvaluator evaluator = new SpelConditionEvaluator();

    @Test
    void evaluate_shouldHandleComparisonsOverBindings() {
        Map<String, Object> bindings = Map.of("count", 3, "status", "done");

        assertThat(evaluator.evaluate("count > 2", bindings)).isTrue();
        assertThat(evaluator.evaluate("count <= 2", bindings)).isFalse();
        assertThat(evaluator.evaluate("status == 'done' && count == 3", bindings)).isTrue();
    }

    @Test
    void evaluate_shouldAcceptStrictEqualityOperators() {
        Map<String, Object> values = Map.of("shouldContinue", false);
        Map<String, Object> bindings = Map.of("values", values);

        assertThat(evaluator.evaluate("values.shouldContinue === false", bindings)).isTrue();
        assertThat(evaluator.evaluate("values.shouldContinue !== false", bindings)).isFalse();
    }

    @Test
    void evaluate_shouldCoerceNonBooleanResults() {
        assertThat(evaluator.evaluate("1", Map.of())).isTrue();
        assertThat(evaluator.evaluate("0", Map.of())).isFalse();
        assertThat(evaluator.evaluate("'text'", Map.of())).isTrue();
        assertThat(evaluator.evaluate("'false'", Map.of())).isFalse();
        assertThat(evaluator.evaluate("null", Map.of())).isFalse();
    }

    @Test
    void evaluate_shouldReturnFalseForGarbageOrUnknownNames() {
        assertThat(evaluator.evaluate("???", Map.of())).isFalse();
        assertThat(evaluator.evaluate("missing > 1", Map.of())).isFalse();
        assertThat(evaluator.evaluate("", Map.of())).isFalse();
        assertThat(evaluator.evaluate(null, Map.of())).isFalse();
    }

    @Test
    void evaluate_shouldRejectTypeReferencesAndAssignment() {
        Map<String, Object> bindings = new HashMap<>();
        bindings.put("count", 1);

        assertThat(evaluator.evaluate("T(java.lang.Runtime).getRuntime() != null", bindings)).isFalse();
        assertThat(evaluator.evaluate("count = 5", bindings)).isFalse();
        assertThat(bindings).containsEntry("count", 1);
    }
}
