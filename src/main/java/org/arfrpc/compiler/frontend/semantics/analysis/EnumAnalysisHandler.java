package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.EnumNode;
import org.arfrpc.compiler.frontend.parser.ast.EnumOptionNode;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;

import java.util.HashMap;
import java.util.Map;

/**
 * Checks one enum: its name, that it has options, and that option names are unique.
 * Option values may repeat; a repeated value is an alias.
 */
public class EnumAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        EnumNode enumNode = (EnumNode) node;
        NamingRules.checkTypeName("enum", enumNode.name(), diagnostics);

        if (enumNode.options().isEmpty()) {
            diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                    "Enum " + enumNode.name().text() + " must have at least one member", enumNode.name());
            return;
        }

        Map<String, EnumOptionNode> names = new HashMap<>();
        for (EnumOptionNode option : enumNode.options()) {
            NamingRules.checkOptionName(option.name(), diagnostics);
            EnumOptionNode previous = names.putIfAbsent(option.name().text(), option);
            if (previous != null) {
                diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                        "Duplicate option '" + option.name().text() + "' in enum " + enumNode.name().text()
                                + ", first declared at " + previous.position(),
                        option.name());
            }
        }
    }
}
