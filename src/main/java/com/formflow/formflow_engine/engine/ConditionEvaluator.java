package com.formflow.formflow_engine.engine;

import java.util.Map;

/**
 * Evaluates a boolean expression against named bindings. Implementations must not throw:
 * anything that cannot be evaluated is false.
 */
public interface ConditionEvaluator {

    boolean evaluate(String expression, Map<String, Object> bindings);
}
