package com.taskflow.generator.codegen.naming;

/**
 * Strict policy: names must already be valid identifiers.
 */
public class ValidatingIdentifierPolicy implements IdentifierPolicy {

    @Override
    public String apply(String raw, IdentifierKind kind) {
        return IdentifierSanitizer.validate(raw, kind);
    }
}
