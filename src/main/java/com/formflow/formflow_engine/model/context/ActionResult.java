package com.formflow.formflow_engine.model.context;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.formflow.formflow_engine.model.domain.ActionType;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionResult {
    private String actionId;
    private ActionType actionType;
    private ActionStatus status;
    private Map<String, Object> output;
    private String errorMessage;

    public static ActionResult success(String actionId, ActionType type, Map<String, Object> output) {
        return ActionResult.builder()
                .actionId(actionId)
                .actionType(type)
                .status(ActionStatus.SUCCESS)
                .output(output)
                .build();
    }
}
