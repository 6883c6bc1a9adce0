package com.formflow.formflow_engine.exception;

/**
 * Authoring mistake detected at run time: break/continue/collect outside a loop, a zero count
 * step, an invalid variable identifier. Never retried.
 */
public class LoopUsageException extends FormflowException {

    public LoopUsageException(String message) {
        super(message);
    }
}
