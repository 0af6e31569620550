package com.taskflow.generator.codegen.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Partial change to an existing task. Every part left null stays as it is.
 */
@Value
@Builder(toBuilder = true)
public class TaskUpdate {

    @NonNull
    String name;

    String module;

    /**
     * New segment bodies. {@code run} replaces the primary body; any other entry
     * replaces the whole set of additional segments.
     */
    Map<String, String> segments;

    /** Replaces the dependency annotation; an empty list removes it. */
    List<InputReference> inputs;

    String imports;
}
