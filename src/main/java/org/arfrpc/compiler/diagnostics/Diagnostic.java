package org.arfrpc.compiler.diagnostics;

import org.arfrpc.compiler.model.SourcePosition;

/**
 * A single compiler diagnostic.
 *
 * @param kind     The error category.
 * @param message  The human-readable message.
 * @param fileName The file the diagnostic refers to.
 * @param line     The 1-based line, or 0 when unknown.
 * @param column   The 1-based column, or 0 when unknown.
 */
public record Diagnostic(Kind kind, String message, String fileName, int line, int column) {

    /**
     * Error taxonomy. Every kind is a hard failure; there is no warning tier.
     */
    public enum Kind {
        /** Lexical problem: unrecognized character, unterminated string, malformed number. */
        SYNTAX,
        /** Grammar violation detected by the parser. */
        PARSE,
        /** Undefined type, illegal map key, non-message RPC type. */
        RESOLUTION,
        /** Name clash, duplicates, naming conventions, streaming placement, cycles, divergence. */
        SEMANTIC,
        /** Unresolvable import target or duplicate import alias. */
        IMPORT
    }

    /**
     * Returns the location of this diagnostic.
     */
    public SourcePosition position() {
        return new SourcePosition(fileName, line, column);
    }

    /**
     * Renders this diagnostic as {@code path:line:column: message}.
     */
    public String render() {
        return fileName + ":" + line + ":" + column + ": " + message;
    }

    @Override
    public String toString() {
        return render();
    }
}
