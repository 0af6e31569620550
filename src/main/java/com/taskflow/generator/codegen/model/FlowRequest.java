package com.taskflow.generator.codegen.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything needed to render a flow script for one target task.
 */
@Value
@Builder(toBuilder = true)
public class FlowRequest {

    @NonNull
    String task;

    /** Raw module name, or null for the default module. */
    String module;

    @Singular
    Map<String, Object> params;

    /** Upstream tasks to reset before the action, in order. */
    @Singular
    List<String> resetTasks;

    /** Also reset the target itself. */
    boolean resetTarget;

    @NonNull
    @Builder.Default
    FlowAction action = FlowAction.RUN;

    /** Print the target's output after the action. */
    boolean loadOutput;
}
