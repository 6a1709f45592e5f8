package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;

/**
 * Interface for symbol collection handlers.
 * Each collector registers declarations or import aliases into the symbol table before
 * any declaration is checked.
 */
public interface ISymbolCollector {
    /**
     * Collects symbols from a single AST node before its children are visited.
     * @param node The node to collect symbols from.
     * @param symbolTable The symbol table to register symbols in.
     * @param diagnostics The engine for reporting errors.
     */
    void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics);
}
