package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.MethodNode;
import org.arfrpc.compiler.frontend.parser.ast.ServiceNode;
import org.arfrpc.compiler.frontend.semantics.Symbol;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;
import org.arfrpc.compiler.frontend.semantics.TypeSignature;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks reopened services. A method may be declared in several blocks of the same service,
 * in one file or across files, as long as every declaration has the signature of the first.
 */
public class ServiceConsistencyCheck implements IProgramCheck {

    @Override
    public void check(SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        TypeSignature signatures = new TypeSignature(symbolTable);
        for (Map.Entry<String, List<Symbol>> service : symbolTable.getServiceDeclarations().entrySet()) {
            Map<String, MethodNode> first = new HashMap<>();
            for (Symbol declaration : service.getValue()) {
                for (MethodNode method : ((ServiceNode) declaration.node()).methods()) {
                    MethodNode previous = first.putIfAbsent(method.name().text(), method);
                    if (previous == null) {
                        continue;
                    }
                    String expected = signatures.of(previous);
                    String actual = signatures.of(method);
                    if (!expected.equals(actual)) {
                        diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                                "Method " + service.getKey() + "." + method.name().text()
                                        + " is redeclared with signature " + actual
                                        + " but was declared at " + previous.position() + " as " + expected,
                                method.position());
                    }
                }
            }
        }
    }
}
