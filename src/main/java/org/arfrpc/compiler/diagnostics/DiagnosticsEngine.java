package org.arfrpc.compiler.diagnostics;

import org.arfrpc.compiler.model.SourcePosition;
import org.arfrpc.compiler.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics reported by every stage of the compiler. Stages keep going after
 * reporting so that a single run surfaces as many problems as possible.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error at an explicit location.
     *
     * @param kind     The error category.
     * @param message  The message.
     * @param fileName The file the error belongs to.
     * @param line     The 1-based line.
     * @param column   The 1-based column.
     */
    public void reportError(Diagnostic.Kind kind, String message, String fileName, int line, int column) {
        diagnostics.add(new Diagnostic(kind, message, fileName, line, column));
    }

    /**
     * Reports an error at a source position.
     */
    public void reportError(Diagnostic.Kind kind, String message, SourcePosition position) {
        reportError(kind, message, position.fileName(), position.line(), position.column());
    }

    /**
     * Reports an error at the start of a token.
     */
    public void reportError(Diagnostic.Kind kind, String message, Token token) {
        reportError(kind, message, token.fileName(), token.line(), token.column());
    }

    /**
     * @return true if at least one error has been reported.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return the number of reported errors.
     */
    public int errorCount() {
        return diagnostics.size();
    }

    /**
     * @return an unmodifiable view of every reported diagnostic, in report order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return all diagnostics rendered as {@code path:line:column: message}, newline-joined.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::render).collect(Collectors.joining("\n"));
    }
}
