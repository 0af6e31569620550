package com.taskflow.generator.codegen.model;

import java.nio.file.Path;
import java.time.Duration;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of running a flow script in a child process. Failures are reported
 * here instead of being thrown.
 */
@Value
@Builder
public class ExecutionResult {

    /** Exit code reported when the process never produced one. */
    public static final int NO_EXIT_CODE = -1;

    @NonNull
    ExecutionStatus status;

    @NonNull
    @Builder.Default
    String stdout = "";

    @NonNull
    @Builder.Default
    String stderr = "";

    @Builder.Default
    int exitCode = NO_EXIT_CODE;

    /**
     * Diagnostic only: the temporary file the script was run from. It has already
     * been deleted when this result is returned, so never read it back. Null when
     * the file could not be created.
     */
    Path scriptFile;

    @NonNull
    @Builder.Default
    Duration elapsed = Duration.ZERO;

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCEEDED;
    }
}
