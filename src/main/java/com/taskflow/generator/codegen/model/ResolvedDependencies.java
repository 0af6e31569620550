package com.taskflow.generator.codegen.model;

import java.util.List;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.Value;

/**
 * Result of resolving a task's input references.
 */
@Value
public class ResolvedDependencies {

    private static final ResolvedDependencies NONE = new ResolvedDependencies(List.of(), List.of());

    @NonNull
    List<AnnotationEntry> entries;

    /** Other modules referenced, in first-seen order. */
    @NonNull
    List<ModuleId> crossModuleImports;

    public static ResolvedDependencies none() {
        return NONE;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Import lines for the module classes the cross-module references go through.
     */
    public String importBlock(String basePackage) {
        return crossModuleImports.stream()
                .map(module -> "import " + basePackage + "." + module.getName() + ";")
                .collect(Collectors.joining("\n"));
    }
}
