package org.arfrpc.compiler.frontend.semantics;

import org.arfrpc.compiler.api.CompilerPhase;
import org.arfrpc.compiler.config.CompilerOptions;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.EnumNode;
import org.arfrpc.compiler.frontend.parser.ast.ImportNode;
import org.arfrpc.compiler.frontend.parser.ast.MethodNode;
import org.arfrpc.compiler.frontend.parser.ast.PlainFieldNode;
import org.arfrpc.compiler.frontend.parser.ast.ServiceNode;
import org.arfrpc.compiler.frontend.parser.ast.StructNode;
import org.arfrpc.compiler.frontend.semantics.analysis.DeclarationSymbolCollector;
import org.arfrpc.compiler.frontend.semantics.analysis.EnumAnalysisHandler;
import org.arfrpc.compiler.frontend.semantics.analysis.FieldTypeAnalysisHandler;
import org.arfrpc.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.arfrpc.compiler.frontend.semantics.analysis.IProgramCheck;
import org.arfrpc.compiler.frontend.semantics.analysis.ISymbolCollector;
import org.arfrpc.compiler.frontend.semantics.analysis.ImportSymbolCollector;
import org.arfrpc.compiler.frontend.semantics.analysis.MethodAnalysisHandler;
import org.arfrpc.compiler.frontend.semantics.analysis.MethodTypeAnalysisHandler;
import org.arfrpc.compiler.frontend.semantics.analysis.ServiceAnalysisHandler;
import org.arfrpc.compiler.frontend.semantics.analysis.ServiceConsistencyCheck;
import org.arfrpc.compiler.frontend.semantics.analysis.StructAnalysisHandler;
import org.arfrpc.compiler.frontend.semantics.analysis.StructCycleCheck;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to analysis handlers per phase, and to the symbol
 * collectors that run before the declaration checks. Whole-program checks are registered
 * per phase as well.
 */
public final class AnalysisHandlerRegistry {

    private final Map<CompilerPhase, Map<Class<? extends AstNode>, IAnalysisHandler>> handlers =
            new EnumMap<>(CompilerPhase.class);
    private final Map<Class<? extends AstNode>, ISymbolCollector> collectors = new HashMap<>();
    private final Map<CompilerPhase, List<IProgramCheck>> programChecks = new EnumMap<>(CompilerPhase.class);

    /**
     * Registers an analysis handler for the given AST node class.
     *
     * @param phase    The phase the handler runs in.
     * @param nodeType The concrete AST node class.
     * @param handler  The handler instance.
     * @param <T>      Concrete AST type parameter.
     */
    public <T extends AstNode> void register(CompilerPhase phase, Class<T> nodeType, IAnalysisHandler handler) {
        handlers.computeIfAbsent(phase, p -> new HashMap<>()).put(nodeType, handler);
    }

    /**
     * Registers a symbol collector for the given AST node class.
     *
     * @param nodeType  The concrete AST node class.
     * @param collector The collector instance.
     * @param <T>       Concrete AST type parameter.
     */
    public <T extends AstNode> void registerCollector(Class<T> nodeType, ISymbolCollector collector) {
        collectors.put(nodeType, collector);
    }

    /**
     * Registers a whole-program check, run after the phase's traversal.
     */
    public void registerProgramCheck(CompilerPhase phase, IProgramCheck check) {
        programChecks.computeIfAbsent(phase, p -> new ArrayList<>()).add(check);
    }

    /**
     * Resolves the handler for the given node class in a phase.
     *
     * @param phase    The phase being run.
     * @param nodeType The AST node class to look up.
     * @return Optional handler if registered.
     */
    public Optional<IAnalysisHandler> resolveHandler(CompilerPhase phase, Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(handlers.getOrDefault(phase, Map.of()).get(nodeType));
    }

    /**
     * Resolves the collector for the given node class.
     *
     * @param nodeType The AST node class to look up.
     * @return Optional collector if registered.
     */
    public Optional<ISymbolCollector> resolveCollector(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(collectors.get(nodeType));
    }

    public List<IProgramCheck> programChecks(CompilerPhase phase) {
        return programChecks.getOrDefault(phase, List.of());
    }

    /**
     * Creates a registry pre-populated with the default collectors, handlers and checks.
     *
     * @param symbolTable The symbol table used by resolving handlers.
     * @param options     The compiler options.
     * @return A fully initialized registry.
     */
    public static AnalysisHandlerRegistry initializeWithDefaults(SymbolTable symbolTable, CompilerOptions options) {
        AnalysisHandlerRegistry registry = new AnalysisHandlerRegistry();

        DeclarationSymbolCollector declarations = new DeclarationSymbolCollector();
        registry.registerCollector(ImportNode.class, new ImportSymbolCollector());
        registry.registerCollector(StructNode.class, declarations);
        registry.registerCollector(EnumNode.class, declarations);
        registry.registerCollector(ServiceNode.class, declarations);

        registry.register(CompilerPhase.DECLARATIONS, StructNode.class, new StructAnalysisHandler());
        registry.register(CompilerPhase.DECLARATIONS, EnumNode.class, new EnumAnalysisHandler());
        registry.register(CompilerPhase.DECLARATIONS, ServiceNode.class, new ServiceAnalysisHandler());
        registry.register(CompilerPhase.DECLARATIONS, MethodNode.class, new MethodAnalysisHandler());

        TypeResolver resolver = new TypeResolver(symbolTable);
        registry.register(CompilerPhase.TYPE_RESOLUTION, PlainFieldNode.class,
                new FieldTypeAnalysisHandler(resolver, options));
        registry.register(CompilerPhase.TYPE_RESOLUTION, MethodNode.class,
                new MethodTypeAnalysisHandler(resolver, options));

        registry.registerProgramCheck(CompilerPhase.CONSISTENCY, new ServiceConsistencyCheck());
        registry.registerProgramCheck(CompilerPhase.CONSISTENCY, new StructCycleCheck(options.cycleDetection()));

        return registry;
    }
}
