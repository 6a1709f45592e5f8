package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.Keywords;
import org.arfrpc.compiler.frontend.parser.NamingConventions;
import org.arfrpc.compiler.model.Token;

/**
 * Naming convention checks shared by the declaration handlers. A reserved word is reported
 * as such instead of as a casing violation.
 */
final class NamingRules {

    private NamingRules() {
        // Utility class
    }

    /**
     * Struct, enum and service names: CamelCase.
     */
    static void checkTypeName(String kind, Token name, DiagnosticsEngine diagnostics) {
        if (reserved(kind, name, diagnostics)) {
            return;
        }
        if (!NamingConventions.isCamelCase(name.text())) {
            diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                    capitalize(kind) + " name '" + name.text() + "' must be CamelCase", name);
        }
    }

    /**
     * Field, union and parameter names: snake_case.
     */
    static void checkSnakeName(String kind, Token name, DiagnosticsEngine diagnostics) {
        if (reserved(kind, name, diagnostics)) {
            return;
        }
        if (!NamingConventions.isSnakeCase(name.text())) {
            diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                    capitalize(kind) + " name '" + name.text() + "' must be snake_case", name);
        }
    }

    /**
     * Method names: camelCase or CamelCase.
     */
    static void checkMethodName(Token name, DiagnosticsEngine diagnostics) {
        if (reserved("method", name, diagnostics)) {
            return;
        }
        if (!NamingConventions.isMethodCase(name.text())) {
            diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                    "Method name '" + name.text() + "' must be camelCase or CamelCase", name);
        }
    }

    /**
     * Enum option names: SCREAMING_SNAKE_CASE. Reserved words are rejected by the parser.
     */
    static void checkOptionName(Token name, DiagnosticsEngine diagnostics) {
        if (!Keywords.isReserved(name.text()) && !NamingConventions.isScreamingSnakeCase(name.text())) {
            diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                    "Enum option name '" + name.text() + "' must be SCREAMING_SNAKE_CASE", name);
        }
    }

    private static boolean reserved(String kind, Token name, DiagnosticsEngine diagnostics) {
        if (Keywords.isReserved(name.text())) {
            diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                    "'" + name.text() + "' is a reserved word and cannot be used as a " + kind + " name", name);
            return true;
        }
        return false;
    }

    private static String capitalize(String kind) {
        return Character.toUpperCase(kind.charAt(0)) + kind.substring(1);
    }
}
