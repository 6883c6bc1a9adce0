package com.formflow.formflow_engine.exception;

/**
 * Base runtime exception for errors raised by the form engine itself.
 * <p>
 * Loop control signals deliberately do not extend this type, so a handler catching engine
 * errors can never swallow a break or continue by accident.
 */
public class FormflowException extends RuntimeException {

    public FormflowException(String message) {
        super(message);
    }

    public FormflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
