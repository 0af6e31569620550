package com.taskflow.generator.codegen.exception;

/**
 * A task identifier is already taken in its module.
 */
public class DuplicateException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    public DuplicateException(String message) {
        super(message);
    }
}
