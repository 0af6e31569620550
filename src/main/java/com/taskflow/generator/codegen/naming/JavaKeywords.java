package com.taskflow.generator.codegen.naming;

import java.util.Set;

/**
 * Words that cannot be used as generated identifiers: Java keywords, literals and
 * restricted identifiers.
 */
public final class JavaKeywords {

    private static final Set<String> RESERVED = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char",
            "class", "const", "continue", "default", "do", "double", "else", "enum",
            "extends", "final", "finally", "float", "for", "goto", "if", "implements",
            "import", "instanceof", "int", "interface", "long", "native", "new", "package",
            "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient",
            "try", "void", "volatile", "while",
            "true", "false", "null",
            "var", "yield", "record", "sealed", "permits", "_"
    );

    private JavaKeywords() {
        // Utility class
    }

    public static boolean isReserved(String word) {
        return word != null && RESERVED.contains(word);
    }
}
