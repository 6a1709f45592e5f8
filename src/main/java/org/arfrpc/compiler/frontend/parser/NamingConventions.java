package org.arfrpc.compiler.frontend.parser;

import java.util.regex.Pattern;

/**
 * Casing rules for declared names.
 */
public final class NamingConventions {

    private static final Pattern CAMEL_CASE = Pattern.compile("^[A-Z][a-zA-Z0-9]*$");
    private static final Pattern METHOD_CASE = Pattern.compile("^[a-zA-Z][a-zA-Z0-9]*$");
    private static final Pattern SNAKE_CASE = Pattern.compile("^[a-z][a-z0-9]*(_[a-z0-9]+)*$");
    private static final Pattern SCREAMING_SNAKE_CASE = Pattern.compile("^[A-Z][A-Z0-9]*(_[A-Z0-9]+)*$");

    private NamingConventions() {
        // Utility class
    }

    /** Structs, enums and services: {@code CamelCase}. */
    public static boolean isCamelCase(String name) {
        return CAMEL_CASE.matcher(name).matches();
    }

    /** Methods accept {@code CamelCase} and {@code camelCase}. */
    public static boolean isMethodCase(String name) {
        return METHOD_CASE.matcher(name).matches();
    }

    /** Fields, parameters, package components and import aliases: {@code snake_case}. */
    public static boolean isSnakeCase(String name) {
        return SNAKE_CASE.matcher(name).matches();
    }

    /** Enum options: {@code SCREAMING_SNAKE_CASE}. */
    public static boolean isScreamingSnakeCase(String name) {
        return SCREAMING_SNAKE_CASE.matcher(name).matches();
    }
}
