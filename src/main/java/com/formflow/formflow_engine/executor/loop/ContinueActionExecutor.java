package com.formflow.formflow_engine.executor.loop;

import com.formflow.formflow_engine.exception.LoopContinueSignal;
import com.formflow.formflow_engine.exception.LoopUsageException;
import com.formflow.formflow_engine.executor.ActionExecutor;
import com.formflow.formflow_engine.model.context.ActionContext;
import com.formflow.formflow_engine.model.context.ActionResult;
import com.formflow.formflow_engine.model.context.LoopContext;
import com.formflow.formflow_engine.model.domain.ActionType;
import com.formflow.formflow_engine.model.domain.FormAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Skips the rest of the current iteration of the innermost loop. */
@Slf4j
@Component
public class ContinueActionExecutor implements ActionExecutor {

    @Override
    public ActionType supportedType() {
        return ActionType.CONTINUE;
    }

    @Override
    public ActionResult execute(FormAction action, ActionContext context) {
        LoopContext loopContext = context.getLoopContext();
        if (loopContext == null) {
            throw new LoopUsageException("CONTINUE action '" + action.getId() + "' can only be used inside a loop body");
        }
        if (!loopContext.isCanContinue()) {
            throw new LoopUsageException("CONTINUE is not allowed in the current loop context");
        }

        loopContext.setContinueRequested(true);
        loopContext.setBreakRequested(false);
        context.recordResult(ActionResult.success(action.getId(), ActionType.CONTINUE,
                Map.of("depth", loopContext.getDepth())));
        log.debug("[LOOP] Continue requested at depth {}", loopContext.getDepth());
        throw new LoopContinueSignal();
    }
}
