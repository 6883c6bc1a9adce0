package com.formflow.formflow_engine.model.dto;

import com.formflow.formflow_engine.model.domain.FormConfig;

import java.util.Map;

/** Request body for POST /api/forms/execute. */
public record FormExecutionRequest(
    FormConfig formConfig,
    Map<String, Object> values
) {
    public Map<String, Object> values() {
        return values != null ? values : java.util.Collections.emptyMap();
    }
}
