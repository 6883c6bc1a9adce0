package com.formflow.formflow_engine.model.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FormField {
    private String id;

    // The label doubles as the variable name ({{@label}})
    private String label;

    private String description;
    private Object defaultValue;

    public FormField(String id, String label) {
        this.id = id;
        this.label = label;
    }
}
