package com.taskflow.generator.codegen.task;

/**
 * The statement that loads a task's declared inputs. It is put in front of every
 * segment body on the way in and taken off again on the way out, so callers only
 * ever see their own code.
 */
public class InputLoadTransform {

    public static final String STATEMENT = "var inputs = inputLoad();";

    public String prepend(String body) {
        if (body == null || body.isBlank()) {
            return STATEMENT;
        }
        return STATEMENT + "\n" + body;
    }

    /**
     * Removes a leading load statement, if present. Everything else is returned as is.
     */
    public String strip(String code) {
        if (code.equals(STATEMENT)) {
            return "";
        }
        if (code.startsWith(STATEMENT + "\n")) {
            return code.substring(STATEMENT.length() + 1);
        }
        return code;
    }
}
