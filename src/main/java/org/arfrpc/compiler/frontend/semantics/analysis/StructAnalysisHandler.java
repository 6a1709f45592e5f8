package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.Keywords;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.FieldNode;
import org.arfrpc.compiler.frontend.parser.ast.PlainFieldNode;
import org.arfrpc.compiler.frontend.parser.ast.StructNode;
import org.arfrpc.compiler.frontend.parser.ast.UnionFieldNode;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;
import org.arfrpc.compiler.model.Token;

import java.util.HashMap;
import java.util.Map;

/**
 * Checks one struct: its name, and that field names and field indices are unique.
 * Union names and union members share the struct's field namespace and index space.
 * Nested structs and enums are checked when the traversal reaches them.
 */
public class StructAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        StructNode struct = (StructNode) node;
        NamingRules.checkTypeName("struct", struct.name(), diagnostics);

        Map<String, Token> names = new HashMap<>();
        for (FieldNode field : struct.fields()) {
            if (field instanceof UnionFieldNode union) {
                NamingRules.checkSnakeName("union", union.name(), diagnostics);
                checkUniqueName(struct, union.name(), names, diagnostics);
                for (PlainFieldNode member : union.members()) {
                    checkFieldName(member.name(), diagnostics);
                    checkUniqueName(struct, member.name(), names, diagnostics);
                }
            } else {
                checkFieldName(field.name(), diagnostics);
                checkUniqueName(struct, field.name(), names, diagnostics);
            }
        }

        Map<Integer, PlainFieldNode> indices = new HashMap<>();
        for (PlainFieldNode field : struct.plainFields()) {
            PlainFieldNode previous = indices.putIfAbsent(field.index(), field);
            if (previous != null) {
                diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                        "Duplicate field index " + field.index() + " in struct " + struct.name().text()
                                + ": '" + field.name().text() + "' reuses the index of '"
                                + previous.name().text() + "' at " + previous.position(),
                        field.position());
            }
        }
    }

    private static void checkFieldName(Token name, DiagnosticsEngine diagnostics) {
        // reserved field names are rejected while parsing
        if (!Keywords.isReserved(name.text())) {
            NamingRules.checkSnakeName("field", name, diagnostics);
        }
    }

    private static void checkUniqueName(StructNode struct, Token name, Map<String, Token> names,
                                        DiagnosticsEngine diagnostics) {
        Token previous = names.putIfAbsent(name.text(), name);
        if (previous != null) {
            diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                    "Duplicate field '" + name.text() + "' in struct " + struct.name().text()
                            + ", first declared at " + previous.position(),
                    name);
        }
    }
}
