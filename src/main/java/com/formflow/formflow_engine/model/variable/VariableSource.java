package com.formflow.formflow_engine.model.variable;

public enum VariableSource {
    FORM_FIELD,
    LOOP_VAR,
    SUGGEST_MODAL,
    AI_OUTPUT,
    INTERNAL,          // built-in template variables such as {{date}}
    SYSTEM_RESERVED    // fixed loop variable names
}
