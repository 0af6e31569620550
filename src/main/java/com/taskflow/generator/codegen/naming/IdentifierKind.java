package com.taskflow.generator.codegen.naming;

import java.util.Set;

import lombok.Getter;

/**
 * The three kinds of names the engine generates, each with its own casing rule
 * and edge-case markers.
 */
@Getter
public enum IdentifierKind {

    /** lower_snake_case, also used as a package segment. */
    MODULE("module", "default_module", "m_", "_mod", Set.of()),

    /** PascalCase class name. */
    TASK("task", "DefaultTask", "T", "Task", Set.of()),

    /** lower_snake_case method name; may not shadow the task lifecycle hooks. */
    SEGMENT("segment", "default_segment", "s_", "_seg", Set.of("run", "output", "save", "requires"));

    private final String label;
    private final String fallback;
    private final String digitPrefix;
    private final String reservedSuffix;
    private final Set<String> reservedNames;

    IdentifierKind(String label, String fallback, String digitPrefix, String reservedSuffix,
                   Set<String> reservedNames) {
        this.label = label;
        this.fallback = fallback;
        this.digitPrefix = digitPrefix;
        this.reservedSuffix = reservedSuffix;
        this.reservedNames = reservedNames;
    }
}
