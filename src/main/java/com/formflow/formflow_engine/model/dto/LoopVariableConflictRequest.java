package com.formflow.formflow_engine.model.dto;

import com.formflow.formflow_engine.model.domain.FormConfig;
import com.formflow.formflow_engine.model.domain.LoopFormAction;

import java.util.List;

/**
 * Request body for POST /api/forms/conflicts/loop-variable.
 * Either loopActionId (a loop already in the form) or loopAction (one being edited) is required.
 */
public record LoopVariableConflictRequest(
    FormConfig formConfig,
    String loopActionId,
    LoopFormAction loopAction,
    String variableName,
    List<String> siblingNames
) {
    public List<String> siblingNames() {
        return siblingNames != null ? siblingNames : java.util.Collections.emptyList();
    }
}
