package com.formflow.formflow_engine.exception;

public class LoopCancelledException extends FormflowException {

    public LoopCancelledException() {
        super("Loop execution aborted");
    }
}
