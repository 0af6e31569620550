package com.taskflow.generator.codegen.model;

/**
 * Terminal call of a flow script.
 */
public enum FlowAction {
    PREVIEW("preview"),
    RUN("run");

    private final String method;

    FlowAction(String method) {
        this.method = method;
    }

    /** Workflow method the script invokes. */
    public String getMethod() {
        return method;
    }
}
