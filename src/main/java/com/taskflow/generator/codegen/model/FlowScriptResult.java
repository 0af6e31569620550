package com.taskflow.generator.codegen.model;

import java.nio.file.Path;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A rendered script, plus where it was written and how it ran when requested.
 */
@Value
@Builder
public class FlowScriptResult {

    @NonNull
    String script;

    Path writtenTo;

    ExecutionResult execution;

    public Optional<Path> getWrittenTo() {
        return Optional.ofNullable(writtenTo);
    }

    public Optional<ExecutionResult> getExecution() {
        return Optional.ofNullable(execution);
    }
}
