package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.ServiceNode;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;

public class ServiceAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        NamingRules.checkTypeName("service", ((ServiceNode) node).name(), diagnostics);
    }
}
