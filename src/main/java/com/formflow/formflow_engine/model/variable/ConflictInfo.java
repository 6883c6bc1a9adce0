package com.formflow.formflow_engine.model.variable;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConflictInfo {
    private String variableName;
    private ConflictType conflictType;
    private List<VariableInfo> items;

    // Alternative name that collides with nothing currently known
    private String suggestion;

    private String messageKey;
}
