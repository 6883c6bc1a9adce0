package com.formflow.formflow_engine.model.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FormExecutionResult {

    public enum Status { SUCCESS, FAILURE }

    private Status status;
    private Map<String, Object> values;
    private Map<String, ActionResult> results;
    private List<String> executionOrder;
    private String errorMessage;
}
