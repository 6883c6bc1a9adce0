package com.formflow.formflow_engine.model.variable;

public enum ConflictType {
    DUPLICATE,      // same source kind declares the name twice
    RESERVED,       // collides with an internal or system-reserved name
    CROSS_SCOPE,    // collides across different variable sources
    SELF_CONFLICT   // two slots of the same loop action share a name
}
