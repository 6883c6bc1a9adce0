package com.formflow.formflow_engine.model.domain;

public enum StorageMode {
    APPEND,
    REPLACE
}
