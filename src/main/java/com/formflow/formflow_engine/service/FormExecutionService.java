package com.formflow.formflow_engine.service;

import com.formflow.formflow_engine.engine.ActionChain;
import com.formflow.formflow_engine.exception.LoopControlSignal;
import com.formflow.formflow_engine.model.context.ActionContext;
import com.formflow.formflow_engine.model.context.FormExecutionResult;
import com.formflow.formflow_engine.model.context.FormState;
import com.formflow.formflow_engine.model.domain.FormConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class FormExecutionService {

    private final ActionChain actionChain;

    /**
     * Runs the form's top-level actions once against a fresh state seeded with initialValues.
     * Failures never escape: they come back as a FAILURE result.
     */
    public FormExecutionResult execute(FormConfig formConfig, Map<String, Object> initialValues) {
        FormState state = FormState.of(initialValues != null ? new HashMap<>(initialValues) : null);
        ActionContext context = ActionContext.create(formConfig, state);
        String formId = formConfig != null ? formConfig.getId() : null;

        log.info("[FORM] Executing form {} with {} initial value(s)", formId, state.getValues().size());
        try {
            actionChain.run(formConfig != null ? formConfig.getActions() : null, context);
            log.info("[FORM] Form {} finished, {} action result(s)", formId, context.getResults().size());
            return result(context, FormExecutionResult.Status.SUCCESS, null);
        } catch (LoopControlSignal signal) {
            String msg = "BREAK/CONTINUE reached the top level of form " + formId + " outside any loop";
            log.error("[FORM] {}", msg);
            return result(context, FormExecutionResult.Status.FAILURE, msg);
        } catch (Exception ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("[FORM] Form {} execution failed: {}", formId, msg, ex);
            return result(context, FormExecutionResult.Status.FAILURE, msg);
        } finally {
            context.getScope().clear();
        }
    }

    private static FormExecutionResult result(ActionContext context, FormExecutionResult.Status status, String error) {
        return FormExecutionResult.builder()
                .status(status)
                .values(new LinkedHashMap<>(context.getState().getValues()))
                .results(new LinkedHashMap<>(context.getResults()))
                .executionOrder(context.getExecutionOrder())
                .errorMessage(error)
                .build();
    }
}
