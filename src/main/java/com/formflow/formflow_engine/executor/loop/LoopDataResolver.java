package com.formflow.formflow_engine.executor.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.formflow.formflow_engine.engine.ConditionEvaluator;
import com.formflow.formflow_engine.engine.LoopVariableScope;
import com.formflow.formflow_engine.engine.TemplateResolver;
import com.formflow.formflow_engine.exception.LoopUsageException;
import com.formflow.formflow_engine.model.context.ActionContext;
import com.formflow.formflow_engine.model.context.FormState;
import com.formflow.formflow_engine.model.domain.LoopFormAction;
import com.formflow.formflow_engine.model.domain.LoopType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns loop configuration into iteration data: list sources, count ranges and
 * per-round conditions. Lookups never throw; anything unresolvable degrades to a literal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoopDataResolver {

    private static final Pattern BARE_NAME = Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$]*$");

    private final TemplateResolver templateResolver;
    private final ConditionEvaluator conditionEvaluator;
    private final ObjectMapper objectMapper;

    /**
     * Materialised iteration items. CONDITION and PAGINATION loops are driven round by round
     * and get an empty list here. The loop executor walks COUNT ranges through
     * {@link #countIterationTotal} and {@link #countIterationValue} instead, so an unbounded
     * range never has to fit in memory.
     */
    public List<Object> resolveIterations(LoopFormAction loop, ActionContext context) {
        LoopType type = loop.getLoopType() != null ? loop.getLoopType() : LoopType.LIST;
        return switch (type) {
            case LIST -> resolveListDataSource(loop.getListDataSource(), context);
            case COUNT -> new ArrayList<>(generateCountIterations(
                    valueOr(loop.getCountStart(), 0),
                    valueOr(loop.getCountEnd(), 0),
                    valueOr(loop.getCountStep(), 1)));
            case CONDITION, PAGINATION -> new ArrayList<>();
        };
    }

    /**
     * Inclusive arithmetic sequence from start to end. The direction comes from the endpoints,
     * only the magnitude of step is used.
     */
    public List<Integer> generateCountIterations(int start, int end, int step) {
        long total = countIterationTotal(start, end, step);
        List<Integer> result = new ArrayList<>();
        for (long position = 0; position < total; position++) {
            result.add(countIterationValue(start, end, step, position));
        }
        return result;
    }

    /** Number of values in the inclusive range, computed without building it. */
    public long countIterationTotal(int start, int end, int step) {
        if (step == 0) {
            throw new LoopUsageException("Loop step cannot be 0");
        }
        return Math.abs((long) end - start) / Math.abs((long) step) + 1;
    }

    /** Value at the zero-based position of the range; position must be below the total. */
    public int countIterationValue(int start, int end, int step, long position) {
        long offset = position * Math.abs((long) step);
        return (int) (start <= end ? start + offset : start - offset);
    }

    public List<Object> resolveListDataSource(String sourceRef, ActionContext context) {
        if (sourceRef == null || sourceRef.isBlank()) return new ArrayList<>();
        String text = sourceRef.trim();

        List<Object> direct = asList(lookupPath(text, context));
        if (direct != null) return direct;

        if (text.contains("{{")) {
            if (templateResolver.isSinglePlaceholder(text)) {
                List<Object> resolved = asList(templateResolver.resolveToObject(text, context));
                if (resolved != null) return resolved;
            }
            text = templateResolver.resolve(text, context).trim();
            if (text.isEmpty()) return new ArrayList<>();
            List<Object> substituted = asList(lookupPath(text, context));
            if (substituted != null) return substituted;
        }

        if (text.startsWith("[") && text.endsWith("]")) {
            try {
                return new ArrayList<>(objectMapper.readValue(text, List.class));
            } catch (Exception e) {
                log.debug("[LOOP] List source '{}' looks like JSON but does not parse: {}", text, e.getMessage());
            }
        }

        if (text.contains("\n")) return split(text, "\\r?\\n");
        if (text.contains(",")) return split(text, ",");

        if (BARE_NAME.matcher(text).matches()) {
            Object scalar = lookupPath(text, context);
            if (scalar != null) {
                List<Object> single = new ArrayList<>();
                single.add(scalar);
                return single;
            }
        }

        // indexed paths such as "names.0" are deliberately not element lookups
        List<Object> literal = new ArrayList<>();
        literal.add(text);
        return literal;
    }

    /**
     * Boolean view of an expression. Never throws: blank, unparsable or failing expressions
     * are false.
     */
    public boolean evaluateCondition(String expression, ActionContext context) {
        if (expression == null || expression.isBlank()) return false;
        try {
            String resolved = templateResolver.resolve(expression, context).trim();
            if ("true".equals(resolved)) return true;
            if ("false".equals(resolved)) return false;

            if (BARE_NAME.matcher(resolved).matches()) {
                Object bound = lookupBareName(resolved, context);
                if (bound instanceof Boolean b) return b;
            }

            return conditionEvaluator.evaluate(resolved, buildBindings(context));
        } catch (Exception e) {
            log.warn("[LOOP] Condition '{}' failed, treating as false: {}", expression, e.getMessage());
            return false;
        }
    }

    /**
     * values[key], then idValues[key]; dotted paths walk maps from values, then from the
     * root namespaces state / values / idValues / loop. Returns null when nothing matches.
     */
    public Object lookupPath(String path, ActionContext context) {
        if (path == null || path.isBlank() || context == null) return null;
        Map<String, Object> values = values(context);
        Map<String, Object> idValues = idValues(context);

        if (values.containsKey(path)) return values.get(path);
        if (idValues.containsKey(path)) return idValues.get(path);
        if (!path.contains(".")) return null;

        List<String> segments = Arrays.asList(path.split("\\."));
        Object fromValues = walkMaps(values, segments);
        if (fromValues != null) return fromValues;
        return walkMaps(rootNamespaces(context), segments);
    }

    Map<String, Object> buildBindings(ActionContext context) {
        Map<String, Object> bindings = new HashMap<>(values(context));
        LoopVariableScope scope = context.getScope();
        if (scope != null) bindings.putAll(scope.getVisibleVariables());
        bindings.putAll(rootNamespaces(context));
        return bindings;
    }

    private Map<String, Object> rootNamespaces(ActionContext context) {
        Map<String, Object> values = values(context);
        Map<String, Object> idValues = idValues(context);
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("values", values);
        state.put("idValues", idValues);

        LoopVariableScope scope = context.getScope();
        Map<String, Object> root = new HashMap<>();
        root.put("state", state);
        root.put("values", values);
        root.put("idValues", idValues);
        root.put("loop", scope != null ? scope.getVisibleVariables() : Map.of());
        return root;
    }

    private Object lookupBareName(String name, ActionContext context) {
        LoopVariableScope scope = context.getScope();
        if (scope != null && scope.contains(name)) return scope.getValue(name);
        return lookupPath(name, context);
    }

    @SuppressWarnings("unchecked")
    private static Object walkMaps(Map<String, Object> root, List<String> segments) {
        Object current = root;
        for (String segment : segments) {
            if (!(current instanceof Map<?, ?> map)) return null;
            current = ((Map<String, Object>) map).get(segment);
            if (current == null) return null;
        }
        return current;
    }

    private static List<Object> asList(Object value) {
        if (value instanceof Collection<?> collection) return new ArrayList<>(collection);
        if (value instanceof Map<?, ?> map) return new ArrayList<>(map.values());
        return null;
    }

    private static List<Object> split(String text, String separator) {
        List<Object> items = new ArrayList<>();
        for (String part : text.split(separator)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) items.add(trimmed);
        }
        return items;
    }

    private static Map<String, Object> values(ActionContext context) {
        FormState state = context.getState();
        return state != null && state.getValues() != null ? state.getValues() : Map.of();
    }

    private static Map<String, Object> idValues(ActionContext context) {
        FormState state = context.getState();
        return state != null && state.getIdValues() != null ? state.getIdValues() : Map.of();
    }

    private static int valueOr(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
