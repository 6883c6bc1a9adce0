package com.formflow.formflow_engine.exception;

import lombok.Getter;

/**
 * Runaway-loop guard. Always fatal: no error handling strategy applies to it.
 */
@Getter
public class LoopMaxIterationException extends FormflowException {

    private final int maxIterations;

    public LoopMaxIterationException(int maxIterations) {
        super("Loop exceeded maximum iterations: " + maxIterations);
        this.maxIterations = maxIterations;
    }
}
