package com.formflow.formflow_engine.model.context;

public enum LoopStatus {
    PENDING,
    ITERATING,
    COMPLETED,
    STOPPED_BY_ERROR,
    BROKEN     // ended by a BREAK action; the chain carries on as for COMPLETED
}
