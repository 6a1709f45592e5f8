package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.config.CompilerOptions;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.PlainFieldNode;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;
import org.arfrpc.compiler.frontend.semantics.TypeResolver;

/**
 * Resolves the type of a struct field or union member, relative to the enclosing struct.
 */
public class FieldTypeAnalysisHandler implements IAnalysisHandler {

    private final TypeResolver resolver;
    private final CompilerOptions options;

    public FieldTypeAnalysisHandler(TypeResolver resolver, CompilerOptions options) {
        this.resolver = resolver;
        this.options = options;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        PlainFieldNode field = (PlainFieldNode) node;
        new TypeReferenceWalker(resolver, options.allowStructMapKeys(), diagnostics).walk(field.type());
    }
}
