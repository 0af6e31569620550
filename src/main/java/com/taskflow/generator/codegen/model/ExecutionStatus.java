package com.taskflow.generator.codegen.model;

public enum ExecutionStatus {
    SUCCEEDED,
    /** Process exited with a non-zero code. */
    FAILED,
    TIMED_OUT,
    /** Process could not be started. */
    LAUNCH_FAILED
}
