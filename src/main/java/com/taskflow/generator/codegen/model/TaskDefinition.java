package com.taskflow.generator.codegen.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A task definition as supplied to create and upsert.
 */
@Value
@Builder(toBuilder = true)
public class TaskDefinition {

    /** Raw task name; sanitized by the engine. */
    @NonNull
    String name;

    /** Raw module name, or null for the default module. */
    String module;

    /**
     * Segment name to body, in declaration order. Must contain the primary
     * segment {@code run}.
     */
    @Singular
    Map<String, String> segments;

    /** Upstream tasks. Null leaves an existing annotation alone on upsert. */
    List<InputReference> inputs;

    /** Extra import lines, one per line. */
    String imports;
}
