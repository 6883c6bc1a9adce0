package com.formflow.formflow_engine.engine;

import com.formflow.formflow_engine.exception.LoopControlSignal;
import com.formflow.formflow_engine.executor.ActionExecutorRegistry;
import com.formflow.formflow_engine.executor.loop.LoopDataResolver;
import com.formflow.formflow_engine.model.context.ActionContext;
import com.formflow.formflow_engine.model.context.ActionResult;
import com.formflow.formflow_engine.model.context.ActionStatus;
import com.formflow.formflow_engine.model.domain.FormAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs an action list in order against one context. Used for the form's top-level actions
 * and, per iteration, for loop bodies.
 * <p>
 * Control signals and failures propagate to the caller; a failing action is recorded as
 * FAILURE unless its executor already recorded a result of its own.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActionChain {

    private final ActionExecutorRegistry executorRegistry;
    private final LoopDataResolver dataResolver;

    public void run(List<FormAction> actions, ActionContext context) {
        if (actions == null) return;

        for (FormAction action : actions) {
            if (action == null) continue;
            if (context.isCancelled()) {
                log.debug("[CHAIN] Cancelled before action {}", action.getId());
                return;
            }

            if (action.getCondition() != null && !action.getCondition().isBlank()
                    && !dataResolver.evaluateCondition(action.getCondition(), context)) {
                log.debug("[CHAIN] Skipping action {}: condition '{}' is false", action.getId(), action.getCondition());
                context.recordResult(ActionResult.builder()
                        .actionId(action.getId())
                        .actionType(action.getType())
                        .status(ActionStatus.SKIPPED)
                        .build());
                continue;
            }

            ActionResult before = context.getResults().get(action.getId());
            try {
                ActionResult result = executorRegistry.get(action.getType()).execute(action, context);
                context.recordResult(result);
            } catch (LoopControlSignal signal) {
                throw signal;
            } catch (RuntimeException ex) {
                if (context.getResults().get(action.getId()) == before) {
                    String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
                    context.recordResult(ActionResult.builder()
                            .actionId(action.getId())
                            .actionType(action.getType())
                            .status(ActionStatus.FAILURE)
                            .errorMessage(msg)
                            .build());
                }
                throw ex;
            }
        }
    }
}
