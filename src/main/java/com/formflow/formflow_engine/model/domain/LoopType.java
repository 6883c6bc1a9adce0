package com.formflow.formflow_engine.model.domain;

public enum LoopType {
    LIST,
    COUNT,
    CONDITION,   // re-evaluated before every round
    PAGINATION   // page driver, continues while hasNextPageCondition holds
}
