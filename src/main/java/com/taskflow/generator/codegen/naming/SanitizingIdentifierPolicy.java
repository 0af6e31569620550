package com.taskflow.generator.codegen.naming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient policy: every name is sanitized and changes are logged.
 */
public class SanitizingIdentifierPolicy implements IdentifierPolicy {

    private static final Logger log = LoggerFactory.getLogger(SanitizingIdentifierPolicy.class);

    @Override
    public String apply(String raw, IdentifierKind kind) {
        String clean = IdentifierSanitizer.sanitize(raw, kind);
        if (!clean.equals(raw)) {
            log.info("Auto-cleaned {}: '{}' -> '{}'", kind.getLabel(), raw, clean);
        }
        return clean;
    }
}
