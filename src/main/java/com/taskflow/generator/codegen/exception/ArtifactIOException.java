package com.taskflow.generator.codegen.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reading or writing a module artifact failed.
 */
public class ArtifactIOException extends WorkflowException {

    private static final long serialVersionUID = 1L;

    public ArtifactIOException(String action, Path path, IOException cause) {
        super("Failed to " + action + " " + path + " (" + cause.getMessage() + ")", cause);
    }
}
