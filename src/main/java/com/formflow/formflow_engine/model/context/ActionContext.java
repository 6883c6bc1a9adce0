package com.formflow.formflow_engine.model.context;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.formflow.formflow_engine.engine.LoopVariableScope;
import com.formflow.formflow_engine.model.domain.FormConfig;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything an executing action can see. One instance per form execution; loop iterations
 * get a shallow copy via {@link #forIteration} that shares state, scope and results.
 */
@Data
@Builder(toBuilder = true)
public class ActionContext {

    private FormConfig config;
    private FormState state;

    @JsonIgnore
    private LoopVariableScope scope;

    // null outside any loop body
    private LoopContext loopContext;

    @JsonIgnore
    @Builder.Default
    private CancellationToken cancellation = new CancellationToken();

    /** Keyed by action id; a loop body action that runs many times keeps its last result. */
    @Builder.Default
    private Map<String, ActionResult> results = new LinkedHashMap<>();

    @Builder.Default
    private List<String> executionOrder = new ArrayList<>();

    public static ActionContext create(FormConfig config, FormState state) {
        return ActionContext.builder()
                .config(config)
                .state(state != null ? state : new FormState())
                .scope(new LoopVariableScope())
                .build();
    }

    public ActionContext forIteration(LoopContext iterationLoopContext) {
        return toBuilder().loopContext(iterationLoopContext).build();
    }

    public ActionContext withCancellation(CancellationToken token) {
        return toBuilder().cancellation(token).build();
    }

    public void recordResult(ActionResult result) {
        if (result == null || result.getActionId() == null) return;
        results.put(result.getActionId(), result);
        executionOrder.add(result.getActionId());
    }

    public boolean isCancelled() {
        return cancellation != null && cancellation.isCancelled();
    }
}
