package com.formflow.formflow_engine.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formflow.formflow_engine.model.context.ActionContext;
import com.formflow.formflow_engine.model.context.FormState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {{...}} placeholders in action text.
 * <ul>
 *   <li>{{@name}} and {{output:name}} read form values</li>
 *   <li>{{name}} reads the loop scope first, then form values</li>
 *   <li>{{name.path.0}} walks into maps and lists below the first segment</li>
 * </ul>
 * Placeholders that resolve to nothing are left as written, so internal template variables
 * such as {{date}} survive for the renderer that owns them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TemplateResolver {

    private static final Pattern REF_PATTERN = Pattern.compile("\\{\\{([^}]+)}}");
    private static final Pattern SINGLE_REF = Pattern.compile("^\\s*\\{\\{([^}]+)}}\\s*$");

    private final ObjectMapper objectMapper;

    public String resolve(String template, ActionContext context) {
        if (template == null || !template.contains("{{")) return template;

        Matcher matcher = REF_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String ref = matcher.group(1).trim();
            Object value = lookup(ref, context);
            String replacement = value != null ? stringify(value) : matcher.group(0);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Raw value when the text is exactly one placeholder (lists and maps keep their shape),
     * otherwise the substituted string.
     */
    public Object resolveToObject(String template, ActionContext context) {
        if (template == null) return null;
        Matcher single = SINGLE_REF.matcher(template);
        if (single.matches()) {
            Object value = lookup(single.group(1).trim(), context);
            if (value != null) return value;
        }
        return resolve(template, context);
    }

    public boolean isSinglePlaceholder(String template) {
        return template != null && SINGLE_REF.matcher(template).matches();
    }

    private Object lookup(String ref, ActionContext context) {
        if (ref.isEmpty() || context == null) return null;
        Map<String, Object> values = formValues(context);

        if (ref.startsWith("@")) {
            return readPath(values, ref.substring(1).trim());
        }
        if (ref.startsWith("output:")) {
            return readPath(values, ref.substring("output:".length()).trim());
        }

        String head = ref;
        String rest = null;
        int dot = ref.indexOf('.');
        if (dot > 0) {
            head = ref.substring(0, dot);
            rest = ref.substring(dot + 1);
        }

        LoopVariableScope scope = context.getScope();
        if (scope != null && scope.contains(head)) {
            Object scoped = scope.getValue(head);
            return rest == null ? scoped : resolveNestedPath(scoped, rest);
        }
        return readPath(values, ref);
    }

    private Object readPath(Map<String, Object> values, String path) {
        if (path.isEmpty()) return null;
        if (values.containsKey(path)) return values.get(path);
        int dot = path.indexOf('.');
        if (dot <= 0) return null;
        return resolveNestedPath(values.get(path.substring(0, dot)), path.substring(dot + 1));
    }

    /** Walk a map/list tree by dot path. Returns null if any step is missing. */
    @SuppressWarnings("unchecked")
    static Object resolveNestedPath(Object root, String path) {
        if (root == null || path == null || path.isBlank()) return null;
        Object current = root;
        for (String raw : path.split("\\.")) {
            if (current == null) return null;
            String seg = raw.trim();
            if (seg.isEmpty()) return null;
            if (current instanceof Map<?, ?> map) {
                current = ((Map<String, Object>) map).get(seg);
            } else if (current instanceof List<?> list && seg.matches("\\d+")) {
                int idx = Integer.parseInt(seg);
                if (idx >= list.size()) return null;
                current = list.get(idx);
            } else {
                return null;
            }
        }
        return current;
    }

    private String stringify(Object value) {
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                log.warn("[TEMPLATE] Could not serialise value for placeholder: {}", e.getMessage());
                return value.toString();
            }
        }
        return value.toString();
    }

    private static Map<String, Object> formValues(ActionContext context) {
        FormState state = context.getState();
        return state != null && state.getValues() != null ? state.getValues() : Map.of();
    }
}
