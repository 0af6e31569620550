package com.taskflow.generator.codegen.exception;

import java.util.List;

/**
 * Raised when caller input cannot be turned into a valid task definition.
 * Holds every problem found so callers can report them together.
 */
public class ValidationException extends WorkflowException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public ValidationException(String error) {
        this(List.of(error));
    }

    public ValidationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
