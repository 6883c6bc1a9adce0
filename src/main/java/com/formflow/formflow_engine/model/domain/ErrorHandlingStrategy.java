package com.formflow.formflow_engine.model.domain;

/**
 * What a loop does when an iteration fails with a non-control error.
 */
public enum ErrorHandlingStrategy {
    STOP,
    CONTINUE,
    RETRY   // re-run the same iteration up to retryCount times, then behave like STOP
}
