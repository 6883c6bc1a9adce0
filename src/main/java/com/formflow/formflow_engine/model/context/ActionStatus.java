package com.formflow.formflow_engine.model.context;

public enum ActionStatus {
    SUCCESS,
    SKIPPED,   // condition evaluated to false
    FAILURE
}
