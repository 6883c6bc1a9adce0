package com.formflow.formflow_engine.model.variable;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VariableInfo {
    private String name;
    private VariableSource source;
    private String sourceId;
    private String description;
    private VariableLocation location;
    private Map<String, Object> meta;
    private boolean reserved;
}
