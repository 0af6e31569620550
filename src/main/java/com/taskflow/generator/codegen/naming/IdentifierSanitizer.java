package com.taskflow.generator.codegen.naming;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.taskflow.generator.codegen.exception.ValidationException;

/**
 * Turns free-form names into identifiers that are legal in generated Java source.
 *
 * <p>Modules and segments become lower_snake_case, tasks become PascalCase. The
 * edge-case policy is applied in a fixed order: blank input, leading digit,
 * reserved word, then length.
 */
public final class IdentifierSanitizer {

    public static final int MAX_LENGTH = 50;

    private static final Pattern CASE_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern SEPARATOR_RUN = Pattern.compile("[\\s\\p{Punct}&&[^_]]+");
    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern REPEATED_UNDERSCORE = Pattern.compile("_{2,}");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");
    private static final Pattern WORD_SPLIT = Pattern.compile("[^A-Za-z0-9]+");
    private static final Pattern PASCAL_IDENTIFIER = Pattern.compile("[A-Z][A-Za-z0-9]*");
    private static final Pattern SNAKE_IDENTIFIER = Pattern.compile("[a-z0-9_]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private IdentifierSanitizer() {
        // Utility class
    }

    /**
     * Sanitizes a raw name for the given kind. Never fails.
     */
    public static String sanitize(String raw, IdentifierKind kind) {
        if (raw == null || raw.isBlank()) {
            return kind.getFallback();
        }
        String cleaned = kind == IdentifierKind.TASK ? toPascalCase(raw.strip()) : toSnakeCase(raw.strip());
        return applyEdgePolicy(cleaned, kind);
    }

    /**
     * Checks that a raw name is already a valid identifier of the given kind.
     *
     * @return the name, unchanged
     * @throws ValidationException listing every rule the name breaks
     */
    public static String validate(String raw, IdentifierKind kind) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException(capitalize(kind.getLabel()) + " name must not be blank");
        }
        List<String> errors = new ArrayList<>();
        String label = capitalize(kind.getLabel()) + " name '" + raw + "'";

        if (WHITESPACE.matcher(raw).find()) {
            errors.add(label + " must not contain whitespace");
        }
        if (kind == IdentifierKind.TASK) {
            if (!Character.isUpperCase(raw.charAt(0))) {
                errors.add(label + " must start with an uppercase letter");
            }
            if (!raw.chars().allMatch(c -> c < 128 && Character.isLetterOrDigit(c))) {
                errors.add(label + " may only contain letters and digits");
            }
        } else if (!SNAKE_IDENTIFIER.matcher(raw).matches()) {
            errors.add(label + " may only contain lowercase letters, digits and underscores");
        }
        if (Character.isDigit(raw.charAt(0))) {
            errors.add(label + " must not start with a digit");
        }
        if (isReserved(raw, kind)) {
            errors.add(label + " is a reserved word");
        }
        if (raw.length() > MAX_LENGTH) {
            errors.add(label + " is longer than " + MAX_LENGTH + " characters");
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return raw;
    }

    static String toSnakeCase(String name) {
        String result = CASE_BOUNDARY.matcher(name).replaceAll("$1_$2");
        result = SEPARATOR_RUN.matcher(result).replaceAll("_");
        result = DISALLOWED.matcher(result).replaceAll("");
        result = result.toLowerCase(Locale.ROOT);
        result = REPEATED_UNDERSCORE.matcher(result).replaceAll("_");
        return EDGE_UNDERSCORES.matcher(result).replaceAll("");
    }

    static String toPascalCase(String name) {
        if (PASCAL_IDENTIFIER.matcher(name).matches()) {
            return name;
        }
        String spaced = CASE_BOUNDARY.matcher(name).replaceAll("$1 $2");
        return Arrays.stream(WORD_SPLIT.split(spaced))
                .filter(word -> !word.isEmpty())
                .map(IdentifierSanitizer::capitalize)
                .collect(Collectors.joining(""));
    }

    private static String applyEdgePolicy(String name, IdentifierKind kind) {
        if (name.isEmpty()) {
            return kind.getFallback();
        }
        String result = name;
        if (Character.isDigit(result.charAt(0))) {
            result = kind.getDigitPrefix() + result;
        }
        if (isReserved(result, kind)) {
            result = result + kind.getReservedSuffix();
        }
        if (result.length() > MAX_LENGTH) {
            String suffix = kind.getReservedSuffix();
            result = result.substring(0, MAX_LENGTH - suffix.length()) + suffix;
        }
        return result;
    }

    private static boolean isReserved(String name, IdentifierKind kind) {
        String word = kind == IdentifierKind.TASK ? name.toLowerCase(Locale.ROOT) : name;
        return JavaKeywords.isReserved(word) || kind.getReservedNames().contains(word);
    }

    private static String capitalize(String word) {
        if (word.isEmpty()) return word;
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
