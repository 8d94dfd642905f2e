package com.shapecraft.generator.codegen.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Utility for consistent Java naming conventions.
 */
public class NamingUtil {

    private static final Set<String> KEYWORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "record", "var", "yield");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts order-row, order_row or orderRow to PascalCase.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("[-_\\s.]+"))
                .filter(part -> !part.isEmpty())
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal == null || pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase(Locale.ROOT) + pascal.substring(1);
    }

    /**
     * Converts name to SCREAMING_SNAKE_CASE for constants.
     */
    public static String toScreamingSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        // Handle camelCase or PascalCase
        String result = name.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        // Handle existing hyphens/underscores
        result = result.replaceAll("[-\\s]+", "_");
        return result.toUpperCase(Locale.ROOT);
    }

    /**
     * Appends an underscore to Java keywords so the name can be used as an identifier.
     */
    public static String safeIdentifier(String name) {
        return KEYWORDS.contains(name) ? name + "_" : name;
    }

    /**
     * Simple name of a fully qualified (possibly nested) type name.
     */
    public static String simpleName(String qualifiedName) {
        int lastDot = qualifiedName.lastIndexOf('.');
        String simple = lastDot < 0 ? qualifiedName : qualifiedName.substring(lastDot + 1);
        int dollar = simple.lastIndexOf('$');
        return dollar < 0 ? simple : simple.substring(dollar + 1);
    }

    /**
     * {@code baseName}, or {@code baseName} with the first free numeric suffix.
     */
    public static String disambiguate(String baseName, Set<String> usedNames) {
        if (!usedNames.contains(baseName)) {
            return baseName;
        }
        int suffix = 2;
        String candidate;
        do {
            candidate = baseName + suffix;
            suffix++;
        } while (usedNames.contains(candidate));
        return candidate;
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1);
    }
}
