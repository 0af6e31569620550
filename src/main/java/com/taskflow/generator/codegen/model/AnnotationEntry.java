package com.taskflow.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One key/value pair of a task's dependency annotation.
 */
@Value
@Builder
public class AnnotationEntry {

    /** "module.Task" when the reference named its module, otherwise "Task". */
    @NonNull
    String key;

    @NonNull
    ModuleId module;

    @NonNull
    String task;

    boolean crossModule;

    /**
     * Symbol the key maps to: qualified for cross-module references, bare otherwise.
     */
    public String getValue() {
        return crossModule ? module.getName() + "." + task : task;
    }
}
