package org.arfrpc.compiler.frontend.semantics;

import org.arfrpc.compiler.api.CompilerPhase;
import org.arfrpc.compiler.config.CompilerOptions;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.module.DependencyGraph;
import org.arfrpc.compiler.frontend.module.ModuleDescriptor;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.Declaration;
import org.arfrpc.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.arfrpc.compiler.frontend.semantics.analysis.IProgramCheck;
import org.arfrpc.compiler.frontend.semantics.analysis.ISymbolCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Validates the parsed program in three ordered phases and binds every type reference.
 *
 * <p>Each phase traverses every file, dispatching nodes to the handlers registered for that
 * phase, and then runs the phase's whole-program checks. A phase collects every error it
 * finds; the next phase only runs if it found none. While a declaration's members are
 * traversed the symbol table's scope is that declaration, so handlers can resolve names
 * relative to it.</p>
 */
public class SemanticAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private static final List<CompilerPhase> PHASES = List.of(
            CompilerPhase.DECLARATIONS, CompilerPhase.TYPE_RESOLUTION, CompilerPhase.CONSISTENCY);

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;
    private final DependencyGraph graph;
    private final AnalysisHandlerRegistry registry;

    /**
     * Constructs an analyzer over every file of a dependency graph.
     *
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param symbolTable The symbol table to populate.
     * @param graph       The loaded files.
     * @param options     The compiler options.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, SymbolTable symbolTable,
                            DependencyGraph graph, CompilerOptions options) {
        this.diagnostics = diagnostics;
        this.symbolTable = symbolTable;
        this.graph = graph;
        this.registry = AnalysisHandlerRegistry.initializeWithDefaults(symbolTable, options);
        setupModuleRelationships();
    }

    /**
     * Runs the phases in order, stopping after the first one that reports errors.
     *
     * @return The failing phase, or empty if the program is valid.
     */
    public Optional<CompilerPhase> analyze() {
        for (CompilerPhase phase : PHASES) {
            int before = diagnostics.errorCount();
            runPhase(phase);
            int reported = diagnostics.errorCount() - before;
            LOG.debug("Phase {} finished with {} error(s)", phase, reported);
            if (reported > 0) {
                return Optional.of(phase);
            }
        }
        return Optional.empty();
    }

    /**
     * Runs one phase regardless of earlier results.
     *
     * @param phase The phase to run.
     */
    public void runPhase(CompilerPhase phase) {
        if (phase == CompilerPhase.DECLARATIONS) {
            for (ModuleDescriptor module : graph.topologicalOrder()) {
                enterModule(module);
                collect(module.file().getChildren());
            }
        }
        for (ModuleDescriptor module : graph.topologicalOrder()) {
            enterModule(module);
            traverseAndAnalyze(phase, module.file().getChildren());
        }
        symbolTable.resetScope();
        for (IProgramCheck check : registry.programChecks(phase)) {
            check.check(symbolTable, diagnostics);
        }
    }

    private void enterModule(ModuleDescriptor module) {
        symbolTable.setCurrentModule(module.id());
        symbolTable.resetScope();
    }

    private void collect(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            Optional<ISymbolCollector> collector = registry.resolveCollector(node.getClass());
            collector.ifPresent(c -> c.collect(node, symbolTable, diagnostics));
            boolean scoped = enterDeclarationScope(node);
            collect(node.getChildren());
            if (scoped) {
                symbolTable.leaveScope();
            }
        }
    }

    private void traverseAndAnalyze(CompilerPhase phase, List<AstNode> nodes) {
        for (AstNode node : nodes) {
            Optional<IAnalysisHandler> handler = registry.resolveHandler(phase, node.getClass());
            handler.ifPresent(h -> h.analyze(node, symbolTable, diagnostics));
            boolean scoped = enterDeclarationScope(node);
            traverseAndAnalyze(phase, node.getChildren());
            if (scoped) {
                symbolTable.leaveScope();
            }
        }
    }

    private boolean enterDeclarationScope(AstNode node) {
        if (node instanceof Declaration declaration) {
            Optional<Symbol> symbol = symbolTable.symbolOf(declaration.id());
            symbol.ifPresent(symbolTable::enterScope);
            return symbol.isPresent();
        }
        return false;
    }

    /**
     * Registers every file and where each of its imports points.
     */
    private void setupModuleRelationships() {
        for (ModuleDescriptor module : graph.topologicalOrder()) {
            ModuleScope scope = symbolTable.registerModule(module.id(), module.file());
            for (ModuleDescriptor.ImportDecl imp : module.imports()) {
                scope.importTargets().put(imp.node(), imp.resolvedId());
            }
        }
        symbolTable.setCurrentModule(graph.entry());
    }
}
