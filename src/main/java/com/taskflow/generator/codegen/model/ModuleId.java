package com.taskflow.generator.codegen.model;

import java.util.Objects;

import lombok.EqualsAndHashCode;

/**
 * Identity of a module. A caller that names no module gets {@link #DEFAULT},
 * which maps to the fixed default artifact instead of a named one.
 */
@EqualsAndHashCode
public final class ModuleId {

    public static final ModuleId DEFAULT = new ModuleId(null);

    private final String name;

    private ModuleId(String name) {
        this.name = name;
    }

    /**
     * @param identifier an already sanitized module identifier
     */
    public static ModuleId of(String identifier) {
        Objects.requireNonNull(identifier, "identifier");
        return new ModuleId(identifier);
    }

    public boolean isDefault() {
        return name == null;
    }

    /**
     * @throws IllegalStateException for the default module, which has no identifier
     */
    public String getName() {
        if (name == null) {
            throw new IllegalStateException("The default module has no identifier");
        }
        return name;
    }

    public String displayName() {
        return isDefault() ? "default module" : name;
    }

    @Override
    public String toString() {
        return displayName();
    }
}
