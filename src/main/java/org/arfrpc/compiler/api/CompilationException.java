package org.arfrpc.compiler.api;

import org.arfrpc.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a compilation fails. Carries every diagnostic of the failing phase; the
 * message is their newline-joined rendering.
 */
public class CompilationException extends Exception {

    private final CompilerPhase phase;
    private final List<Diagnostic> diagnostics;

    public CompilationException(CompilerPhase phase, List<Diagnostic> diagnostics) {
        super(diagnostics.stream().map(Diagnostic::render).collect(Collectors.joining("\n")));
        this.phase = phase;
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The phase that reported the errors.
     */
    public CompilerPhase getPhase() {
        return phase;
    }

    /**
     * @return The diagnostics, in report order.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
