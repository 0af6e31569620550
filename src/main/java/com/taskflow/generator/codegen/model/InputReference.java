package com.taskflow.generator.codegen.model;

import java.util.Optional;

import lombok.Value;

/**
 * An upstream task a definition depends on, as supplied by the caller. Names are
 * raw and are sanitized during resolution. An absent module means "same module".
 */
@Value
public class InputReference {

    String module;
    String task;

    public static InputReference of(String task) {
        return new InputReference(null, task);
    }

    public static InputReference of(String module, String task) {
        return new InputReference(module, task);
    }

    public Optional<String> getModule() {
        return Optional.ofNullable(module);
    }
}
