package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.Declaration;
import org.arfrpc.compiler.frontend.parser.ast.EnumNode;
import org.arfrpc.compiler.frontend.parser.ast.StructNode;
import org.arfrpc.compiler.frontend.semantics.Symbol;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;

/**
 * Defines structs, enums and services under their fully qualified names and reports
 * a second declaration of the same name anywhere in the program.
 */
public class DeclarationSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        Declaration declaration = (Declaration) node;
        String packageName = symbolTable.getCurrentModuleScope().packageName();
        String prefix = symbolTable.symbolOf(declaration.parentId()).map(Symbol::fqn).orElse(packageName);
        String name = declaration.name().text();
        String fqn = prefix.isEmpty() ? name : prefix + "." + name;

        Symbol symbol = new Symbol(fqn, typeOf(declaration), declaration, symbolTable.getCurrentModuleId(), packageName);
        symbolTable.define(symbol).ifPresent(existing -> diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                fqn + " is already defined at " + existing.position(), declaration.position()));
    }

    private static Symbol.Type typeOf(Declaration declaration) {
        if (declaration instanceof StructNode) {
            return Symbol.Type.STRUCT;
        }
        if (declaration instanceof EnumNode) {
            return Symbol.Type.ENUM;
        }
        return Symbol.Type.SERVICE;
    }
}
