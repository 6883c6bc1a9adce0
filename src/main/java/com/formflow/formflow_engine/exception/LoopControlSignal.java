package com.formflow.formflow_engine.exception;

/**
 * Non-local exit out of a loop body. Not an error: only the loop executor that owns the
 * current iteration catches it. No stack trace is captured.
 */
public abstract class LoopControlSignal extends RuntimeException {

    protected LoopControlSignal(String message) {
        super(message, null, false, false);
    }
}
