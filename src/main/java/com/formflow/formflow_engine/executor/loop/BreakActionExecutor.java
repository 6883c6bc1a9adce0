package com.formflow.formflow_engine.executor.loop;

import com.formflow.formflow_engine.exception.LoopBreakSignal;
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

/**
 * Ends the innermost loop. Never returns normally: it raises {@link LoopBreakSignal}, which the
 * owning loop executor turns into a BROKEN loop.
 */
@Slf4j
@Component
public class BreakActionExecutor implements ActionExecutor {

    @Override
    public ActionType supportedType() {
        return ActionType.BREAK;
    }

    @Override
    public ActionResult execute(FormAction action, ActionContext context) {
        LoopContext loopContext = context.getLoopContext();
        if (loopContext == null) {
            throw new LoopUsageException("BREAK action '" + action.getId() + "' can only be used inside a loop body");
        }
        if (!loopContext.isCanBreak()) {
            throw new LoopUsageException("BREAK is not allowed in the current loop context");
        }

        loopContext.setBreakRequested(true);
        loopContext.setContinueRequested(false);
        context.recordResult(ActionResult.success(action.getId(), ActionType.BREAK,
                Map.of("depth", loopContext.getDepth())));
        log.debug("[LOOP] Break requested at depth {}", loopContext.getDepth());
        throw new LoopBreakSignal();
    }
}
