package com.formflow.formflow_engine.model.context;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Map;

/**
 * Per-iteration loop state threaded to nested actions. BREAK / CONTINUE set the request flags;
 * parent links mirror the scope stack.
 */
@Data
@Builder
public class LoopContext {
    private Map<String, Object> variables;
    private int depth;
    private boolean canBreak;
    private boolean canContinue;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private LoopContext parent;

    private boolean breakRequested;
    private boolean continueRequested;
}
