package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.MethodNode;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;
import org.arfrpc.compiler.model.SourcePosition;
import org.arfrpc.compiler.model.Token;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Checks the shape of one method signature. Parameters and return values are checked
 * independently with the same rules:
 * <ul>
 *   <li>names are snake_case and unique;</li>
 *   <li>apart from the stream element, either all elements are named or none is;</li>
 *   <li>at most one element is a stream, and it is the last one.</li>
 * </ul>
 */
public class MethodAnalysisHandler implements IAnalysisHandler {

    private record Element(Token name, boolean stream, SourcePosition position) {
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        MethodNode method = (MethodNode) node;
        NamingRules.checkMethodName(method.name(), diagnostics);

        checkElements(method, "parameter",
                method.params().stream()
                        .map(p -> new Element(p.name(), p.stream(), p.position()))
                        .collect(Collectors.toList()),
                diagnostics);
        checkElements(method, "return value",
                method.returns().stream()
                        .map(r -> new Element(r.name(), r.stream(), r.position()))
                        .collect(Collectors.toList()),
                diagnostics);
    }

    private static void checkElements(MethodNode method, String kind, List<Element> elements,
                                      DiagnosticsEngine diagnostics) {
        String methodName = method.name().text();
        Map<String, Token> names = new HashMap<>();
        int named = 0;
        int unnamed = 0;
        for (Element element : elements) {
            if (element.name() != null) {
                NamingRules.checkSnakeName(kind, element.name(), diagnostics);
                Token previous = names.putIfAbsent(element.name().text(), element.name());
                if (previous != null) {
                    diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                            "Duplicate " + kind + " name '" + element.name().text() + "' in method " + methodName
                                    + ", first declared at " + previous.position(),
                            element.name());
                }
            }
            if (!element.stream()) {
                if (element.name() != null) {
                    named++;
                } else {
                    unnamed++;
                }
            }
        }
        if (named > 0 && unnamed > 0) {
            diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                    "Method " + methodName + " must name either all of its " + kind + "s or none of them",
                    method.name());
        }

        boolean seenStream = false;
        for (int i = 0; i < elements.size(); i++) {
            Element element = elements.get(i);
            if (!element.stream()) {
                continue;
            }
            if (seenStream) {
                diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                        "Method " + methodName + " can only have one stream " + kind, element.position());
            } else if (i != elements.size() - 1) {
                diagnostics.reportError(Diagnostic.Kind.SEMANTIC,
                        "The stream " + kind + " of method " + methodName + " must be the last " + kind,
                        element.position());
            }
            seenStream = true;
        }
    }
}
