package com.formflow.formflow_engine.exception;

/** Thrown by a CONTINUE action inside a loop body. */
public final class LoopContinueSignal extends LoopControlSignal {

    public LoopContinueSignal() {
        super("Loop continue requested");
    }
}
