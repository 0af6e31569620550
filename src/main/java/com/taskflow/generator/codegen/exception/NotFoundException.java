package com.taskflow.generator.codegen.exception;

/**
 * A module, task or segment named by the caller does not exist.
 */
public class NotFoundException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String message) {
        super(message);
    }
}
