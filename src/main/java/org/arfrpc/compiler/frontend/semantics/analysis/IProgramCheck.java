package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;

/**
 * A check over the whole program rather than a single node. Runs once per phase, after
 * every file has been traversed.
 */
public interface IProgramCheck {

    /**
     * @param symbolTable The fully populated symbol table.
     * @param diagnostics The engine for reporting errors.
     */
    void check(SymbolTable symbolTable, DiagnosticsEngine diagnostics);
}
