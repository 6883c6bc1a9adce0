package com.formflow.formflow_engine.model.domain;

public enum CollectVariableType {
    STRING,  // APPEND joins with a newline
    ARRAY    // APPEND adds one element per iteration
}
