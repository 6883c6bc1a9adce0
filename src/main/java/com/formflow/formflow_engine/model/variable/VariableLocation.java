package com.formflow.formflow_engine.model.variable;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.formflow.formflow_engine.model.domain.ActionType;
import lombok.Builder;
import lombok.Data;

/**
 * Points back at the field or action that declares a variable. actionGroupId is set for loop
 * variables so tooling can jump to the loop body.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VariableLocation {
    private String fieldId;
    private String actionId;
    private ActionType actionType;
    private String actionGroupId;
    private Integer index;
    private String path;
}
