package com.taskflow.generator.codegen.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * An existing module artifact no longer parses. Only the engine writes artifacts,
 * so this is treated as fatal.
 */
public class ArtifactParseException extends WorkflowException {

    private static final long serialVersionUID = 1L;
    private final transient Path artifact;
    private final List<String> problems;

    public ArtifactParseException(Path artifact, List<String> problems) {
        super("Cannot parse " + artifact + ": " + String.join("; ", problems));
        this.artifact = artifact;
        this.problems = List.copyOf(problems);
    }

    public Path getArtifact() {
        return artifact;
    }

    public List<String> getProblems() {
        return problems;
    }
}
