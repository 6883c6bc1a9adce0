package com.formflow.formflow_engine.model.context;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Mutable value store of one form execution.
 * values are keyed by field label / variable name, idValues by field id.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FormState {
    private Map<String, Object> values = new HashMap<>();
    private Map<String, Object> idValues = new HashMap<>();

    public static FormState of(Map<String, Object> values) {
        FormState state = new FormState();
        if (values != null) state.getValues().putAll(values);
        return state;
    }
}
