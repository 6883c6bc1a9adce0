package com.formflow.formflow_engine.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.HashMap;
import java.util.Map;

/**
 * SpEL over a read-only map of bindings. {@link SimpleEvaluationContext} rules out type
 * references, constructors and bean lookups; the accessor below rules out assignment.
 * JavaScript-style strict operators are accepted and mapped to SpEL equality.
 */
@Slf4j
public class SpelConditionEvaluator implements ConditionEvaluator {

    private final ExpressionParser parser = new SpelExpressionParser();
    private final ReadOnlyMapAccessor accessor = new ReadOnlyMapAccessor();

    @Override
    public boolean evaluate(String expression, Map<String, Object> bindings) {
        if (expression == null || expression.isBlank()) return false;
        String normalized = normalize(expression);
        try {
            Expression parsed = parser.parseExpression(normalized);
            EvaluationContext context = SimpleEvaluationContext
                    .forPropertyAccessors(accessor)
                    .build();
            Map<String, Object> root = bindings != null ? new HashMap<>(bindings) : new HashMap<>();
            return toBoolean(parsed.getValue(context, root));
        } catch (Exception e) {
            log.warn("[CONDITION] Could not evaluate '{}': {}", expression, e.getMessage());
            return false;
        }
    }

    static String normalize(String expression) {
        return expression.trim()
                .replace("!==", "!=")
                .replace("===", "==");
    }

    static boolean toBoolean(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0;
        String s = value.toString().trim();
        return !s.isEmpty() && !"false".equalsIgnoreCase(s);
    }

    private static class ReadOnlyMapAccessor extends MapAccessor {
        @Override
        public boolean canWrite(EvaluationContext context, Object target, String name) {
            return false;
        }
    }
}
