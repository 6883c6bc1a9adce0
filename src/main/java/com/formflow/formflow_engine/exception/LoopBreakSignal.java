package com.formflow.formflow_engine.exception;

/** Thrown by a BREAK action inside a loop body. */
public final class LoopBreakSignal extends LoopControlSignal {

    public LoopBreakSignal() {
        super("Loop break requested");
    }
}
