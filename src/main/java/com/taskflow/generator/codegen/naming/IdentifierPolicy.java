package com.taskflow.generator.codegen.naming;

/**
 * How caller-supplied names become identifiers. One policy is chosen per engine
 * instance: either names are silently cleaned up, or anything not already valid
 * is rejected.
 */
public interface IdentifierPolicy {

    String apply(String raw, IdentifierKind kind);

    static IdentifierPolicy sanitizing() {
        return new SanitizingIdentifierPolicy();
    }

    static IdentifierPolicy validating() {
        return new ValidatingIdentifierPolicy();
    }
}
