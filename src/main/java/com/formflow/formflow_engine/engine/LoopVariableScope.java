package com.formflow.formflow_engine.engine;

import com.formflow.formflow_engine.model.variable.VariableMeta;
import com.formflow.formflow_engine.variable.VariableConstants;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stack of loop variable frames for one form execution. The innermost frame shadows outer ones
 * until it is popped. Frames hold references, values are never copied.
 * <p>
 * Not thread-safe: a form execution runs one action at a time.
 */
public class LoopVariableScope {

    private final Deque<Frame> frames = new ArrayDeque<>();

    public void push(Map<String, Object> variables) {
        push(variables, null);
    }

    public void push(Map<String, Object> variables, Map<String, VariableMeta> meta) {
        Map<String, Object> vars = variables != null ? variables : Collections.emptyMap();
        Map<String, VariableMeta> frameMeta = meta != null ? meta : createStandardVariableMeta(vars);
        frames.push(new Frame(vars, frameMeta));
    }

    public Map<String, Object> pop() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("Loop variable scope is empty, nothing to pop");
        }
        return frames.pop().variables();
    }

    /** Innermost frame, or null outside any loop. */
    public Map<String, Object> current() {
        Frame top = frames.peek();
        return top != null ? top.variables() : null;
    }

    public Object getValue(String name) {
        if (name == null) return null;
        for (Frame frame : frames) {
            if (frame.variables().containsKey(name)) {
                return frame.variables().get(name);
            }
        }
        return null;
    }

    public boolean contains(String name) {
        if (name == null) return false;
        for (Frame frame : frames) {
            if (frame.variables().containsKey(name)) return true;
        }
        return false;
    }

    public void clear() {
        frames.clear();
    }

    public int getDepth() {
        return frames.size();
    }

    public boolean isInsideLoop() {
        return !frames.isEmpty();
    }

    /** Visible bindings, innermost value winning. */
    public Map<String, Object> getVisibleVariables() {
        Map<String, Object> visible = new LinkedHashMap<>();
        // outermost first so inner frames overwrite
        Iterator<Frame> it = frames.descendingIterator();
        while (it.hasNext()) {
            visible.putAll(it.next().variables());
        }
        return visible;
    }

    public List<VariableMeta> getAvailableVariables() {
        Map<String, VariableMeta> available = new LinkedHashMap<>();
        int depth = 1;
        Iterator<Frame> it = frames.descendingIterator();
        while (it.hasNext()) {
            Frame frame = it.next();
            for (Map.Entry<String, Object> entry : frame.variables().entrySet()) {
                VariableMeta known = frame.meta().get(entry.getKey());
                available.put(entry.getKey(), VariableMeta.builder()
                        .name(entry.getKey())
                        .value(entry.getValue())
                        .description(known != null ? known.getDescription() : getVariableDescription(entry.getKey()))
                        .standard(known != null ? known.isStandard() : isStandardName(entry.getKey()))
                        .depth(depth)
                        .build());
            }
            depth++;
        }
        return new ArrayList<>(available.values());
    }

    public static String getVariableDescription(String name) {
        if (name == null) return null;
        return VariableConstants.STANDARD_DESCRIPTIONS.get(name);
    }

    public static Map<String, VariableMeta> createStandardVariableMeta(Map<String, Object> variables) {
        Map<String, VariableMeta> meta = new LinkedHashMap<>();
        if (variables == null) return meta;
        variables.forEach((name, value) -> meta.put(name, VariableMeta.builder()
                .name(name)
                .value(value)
                .description(getVariableDescription(name))
                .standard(isStandardName(name))
                .build()));
        return meta;
    }

    private static boolean isStandardName(String name) {
        return VariableConstants.STANDARD_DESCRIPTIONS.containsKey(name);
    }

    private record Frame(Map<String, Object> variables, Map<String, VariableMeta> meta) {
    }
}
