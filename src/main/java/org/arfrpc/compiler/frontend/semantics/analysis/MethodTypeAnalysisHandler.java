package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.config.CompilerOptions;
import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.MethodNode;
import org.arfrpc.compiler.frontend.parser.ast.MethodParamNode;
import org.arfrpc.compiler.frontend.parser.ast.MethodReturnNode;
import org.arfrpc.compiler.frontend.parser.ast.types.StreamingTypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.TypeNode;
import org.arfrpc.compiler.frontend.parser.ast.types.UserTypeNode;
import org.arfrpc.compiler.frontend.semantics.Symbol;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;
import org.arfrpc.compiler.frontend.semantics.TypeResolver;

import java.util.Optional;

/**
 * Resolves the parameter and return types of a method. Each of them, once a stream marker
 * is removed, must name a struct.
 */
public class MethodTypeAnalysisHandler implements IAnalysisHandler {

    private final TypeResolver resolver;
    private final CompilerOptions options;

    public MethodTypeAnalysisHandler(TypeResolver resolver, CompilerOptions options) {
        this.resolver = resolver;
        this.options = options;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        MethodNode method = (MethodNode) node;
        TypeReferenceWalker walker = new TypeReferenceWalker(resolver, options.allowStructMapKeys(), diagnostics);
        for (MethodParamNode param : method.params()) {
            check(param.type(), walker, symbolTable, diagnostics);
        }
        for (MethodReturnNode ret : method.returns()) {
            check(ret.type(), walker, symbolTable, diagnostics);
        }
    }

    private static void check(TypeNode type, TypeReferenceWalker walker, SymbolTable symbolTable,
                              DiagnosticsEngine diagnostics) {
        walker.walk(type);
        TypeNode inner = type instanceof StreamingTypeNode streaming ? streaming.inner() : type;
        if (inner instanceof UserTypeNode user) {
            Optional<Symbol> target = symbolTable.resolutionOf(user.id());
            if (target.isEmpty() || target.get().type() == Symbol.Type.STRUCT) {
                return;
            }
        }
        diagnostics.reportError(Diagnostic.Kind.RESOLUTION,
                "Types used within methods are required to be user-defined structures. Cannot use "
                        + inner.describe(),
                inner.position());
    }
}
