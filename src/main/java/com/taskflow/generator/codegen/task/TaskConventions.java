package com.taskflow.generator.codegen.task;

import java.util.Set;

/**
 * Names shared between the generated task classes and the runtime they extend.
 */
public final class TaskConventions {

    /** Segment key and method name of the primary segment. */
    public static final String PRIMARY_SEGMENT = "run";

    /** Variable the primary segment must assign. */
    public static final String RESULT_BINDING = "result";

    public static final String SAVE_CALL = "save(" + RESULT_BINDING + ");";

    public static final String TASK_BASE_CLASS = "PersistedTask";

    /** Methods the runtime defines; never treated as additional segments. */
    public static final Set<String> LIFECYCLE_HOOKS = Set.of(PRIMARY_SEGMENT, "inputLoad", "output", "save", "requires");

    /** Imports every artifact starts with, in this order. */
    public static final String BASE_IMPORTS = "import taskflow.*;\nimport java.util.*;";

    private TaskConventions() {
        // Constants only
    }
}
