package com.formflow.formflow_engine.exception;

import lombok.Getter;

@Getter
public class LoopTimeoutException extends FormflowException {

    private final long timeoutMs;

    public LoopTimeoutException(long timeoutMs) {
        super("Loop execution exceeded timeout: " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public LoopTimeoutException(String message, long timeoutMs) {
        super(message);
        this.timeoutMs = timeoutMs;
    }
}
