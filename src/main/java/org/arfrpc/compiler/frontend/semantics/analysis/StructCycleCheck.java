package org.arfrpc.compiler.frontend.semantics.analysis;

import org.arfrpc.compiler.config.CompilerOptions.CycleDetection;
import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.PlainFieldNode;
import org.arfrpc.compiler.frontend.parser.ast.StructNode;
import org.arfrpc.compiler.frontend.parser.ast.types.UserTypeNode;
import org.arfrpc.compiler.frontend.semantics.Symbol;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reports structs that contain themselves through direct references. A field whose type is
 * a struct (not wrapped in optional, array or map) is a direct reference; wrapped references
 * may recurse freely.
 *
 * <p>{@link CycleDetection#FULL} finds every cycle by depth-first search and reports each
 * at the field closing it. {@link CycleDetection#DIRECT} only looks for self references and
 * cycles of two structs.</p>
 */
public class StructCycleCheck implements IProgramCheck {

    private record Edge(PlainFieldNode field, Symbol target) {
    }

    private enum Color { WHITE, GRAY, BLACK }

    private final CycleDetection mode;

    public StructCycleCheck(CycleDetection mode) {
        this.mode = mode;
    }

    @Override
    public void check(SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        Map<Symbol, List<Edge>> graph = buildGraph(symbolTable);
        if (mode == CycleDetection.FULL) {
            Map<Symbol, Color> colors = new HashMap<>();
            for (Symbol struct : graph.keySet()) {
                if (colors.getOrDefault(struct, Color.WHITE) == Color.WHITE) {
                    visit(struct, graph, colors, new ArrayList<>(), diagnostics);
                }
            }
        } else {
            checkDirect(graph, diagnostics);
        }
    }

    private static Map<Symbol, List<Edge>> buildGraph(SymbolTable symbolTable) {
        Map<Symbol, List<Edge>> graph = new LinkedHashMap<>();
        for (Symbol symbol : symbolTable.getAllSymbols()) {
            if (symbol.type() != Symbol.Type.STRUCT) {
                continue;
            }
            List<Edge> edges = new ArrayList<>();
            for (PlainFieldNode field : ((StructNode) symbol.node()).plainFields()) {
                if (field.type() instanceof UserTypeNode user) {
                    symbolTable.resolutionOf(user.id())
                            .filter(target -> target.type() == Symbol.Type.STRUCT)
                            .ifPresent(target -> edges.add(new Edge(field, target)));
                }
            }
            graph.put(symbol, edges);
        }
        return graph;
    }

    private void visit(Symbol struct, Map<Symbol, List<Edge>> graph, Map<Symbol, Color> colors,
                       List<Symbol> path, DiagnosticsEngine diagnostics) {
        colors.put(struct, Color.GRAY);
        path.add(struct);
        for (Edge edge : graph.getOrDefault(struct, List.of())) {
            Color color = colors.getOrDefault(edge.target(), Color.WHITE);
            if (color == Color.GRAY) {
                List<Symbol> cycle = new ArrayList<>(path.subList(path.indexOf(edge.target()), path.size()));
                report(struct, edge, cycle, diagnostics);
            } else if (color == Color.WHITE) {
                visit(edge.target(), graph, colors, path, diagnostics);
            }
        }
        path.remove(path.size() - 1);
        colors.put(struct, Color.BLACK);
    }

    private void checkDirect(Map<Symbol, List<Edge>> graph, DiagnosticsEngine diagnostics) {
        Set<Set<Symbol>> reported = new HashSet<>();
        for (Map.Entry<Symbol, List<Edge>> entry : graph.entrySet()) {
            Symbol struct = entry.getKey();
            for (Edge edge : entry.getValue()) {
                Symbol target = edge.target();
                if (target.equals(struct)) {
                    report(struct, edge, List.of(struct), diagnostics);
                    continue;
                }
                boolean back = graph.getOrDefault(target, List.of()).stream()
                        .anyMatch(e -> e.target().equals(struct));
                if (back && reported.add(Set.of(struct, target))) {
                    report(struct, edge, List.of(struct, target), diagnostics);
                }
            }
        }
    }

    private static void report(Symbol struct, Edge edge, List<Symbol> cycle, DiagnosticsEngine diagnostics) {
        String message;
        if (cycle.size() == 1) {
            message = struct.fqn() + " cannot reference itself as a type";
        } else {
            String chain = cycle.stream().map(Symbol::fqn).collect(Collectors.joining(" -> "));
            message = struct.fqn() + " cannot directly reference " + edge.target().fqn()
                    + ": cyclic reference " + chain + " -> " + cycle.get(0).fqn();
        }
        diagnostics.reportError(Diagnostic.Kind.SEMANTIC, message, edge.field().position());
    }
}
