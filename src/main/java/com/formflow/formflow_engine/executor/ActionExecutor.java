package com.formflow.formflow_engine.executor;

import com.formflow.formflow_engine.model.context.ActionContext;
import com.formflow.formflow_engine.model.context.ActionResult;
import com.formflow.formflow_engine.model.domain.ActionType;
import com.formflow.formflow_engine.model.domain.FormAction;

public interface ActionExecutor {

    ActionType supportedType();

    // Runs the action against the shared form state; may throw to stop the chain
    ActionResult execute(FormAction action, ActionContext context);
}
