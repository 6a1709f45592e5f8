package org.arfrpc.compiler;

import org.arfrpc.compiler.api.CompilationException;
import org.arfrpc.compiler.api.CompiledTree;
import org.arfrpc.compiler.api.CompilerPhase;
import org.arfrpc.compiler.config.CompilerOptions;
import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.io.FileSystemSourceLoader;
import org.arfrpc.compiler.frontend.io.SourceLoadException;
import org.arfrpc.compiler.frontend.io.SourceLoader;
import org.arfrpc.compiler.frontend.module.DependencyGraph;
import org.arfrpc.compiler.frontend.module.DependencyScanner;
import org.arfrpc.compiler.frontend.module.ModuleDescriptor;
import org.arfrpc.compiler.frontend.parser.ast.NodeIdAllocator;
import org.arfrpc.compiler.frontend.semantics.SemanticAnalyzer;
import org.arfrpc.compiler.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point of the IDL front-end. Loads an entry file and everything it imports, then
 * validates the program and binds every type reference.
 *
 * <p>Compilation runs in the stages of {@link CompilerPhase}. Each stage reports every
 * problem it finds; the first stage with errors ends the compilation with a
 * {@link CompilationException} carrying them.</p>
 */
public class Compiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final SourceLoader loader;
    private final CompilerOptions options;

    /**
     * Creates a compiler reading sources from the file system.
     *
     * @param options The compiler options.
     */
    public Compiler(CompilerOptions options) {
        this(new FileSystemSourceLoader(options.fileExtension()), options);
    }

    /**
     * @param loader  Supplies source text for the entry file and imports.
     * @param options The compiler options.
     */
    public Compiler(SourceLoader loader, CompilerOptions options) {
        this.loader = loader;
        this.options = options;
    }

    /**
     * Compiles the program rooted at an entry file.
     *
     * @param entryPath The path of the entry file.
     * @return The validated tree.
     * @throws CompilationException If any stage reports errors.
     */
    public CompiledTree compile(String entryPath) throws CompilationException {
        SourceLoader.LoadResult entry;
        try {
            entry = loader.load(loader.normalize(entryPath));
        } catch (SourceLoadException e) {
            throw loadFailure(entryPath, e);
        }
        return compile(entry);
    }

    /**
     * Compiles source text given directly. Imports are still loaded through the loader,
     * relative to {@code path}.
     *
     * @param path    The logical path of the source.
     * @param content The source text.
     * @return The validated tree.
     * @throws CompilationException If any stage reports errors.
     */
    public CompiledTree compileSource(String path, String content) throws CompilationException {
        String logicalName;
        try {
            logicalName = loader.normalize(path);
        } catch (SourceLoadException e) {
            throw loadFailure(path, e);
        }
        return compile(new SourceLoader.LoadResult(SourceLoader.normalizeLineEndings(content), logicalName));
    }

    private CompiledTree compile(SourceLoader.LoadResult entry) throws CompilationException {
        LOG.info("Compiling {}", entry.logicalName());
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        DependencyGraph graph = new DependencyScanner(loader, diagnostics, new NodeIdAllocator()).scan(entry);
        LOG.debug("Loaded {} file(s)", graph.topologicalOrder().size());
        if (diagnostics.hasErrors()) {
            throw fail(CompilerPhase.LOADING, diagnostics);
        }

        SymbolTable symbolTable = new SymbolTable();
        Optional<CompilerPhase> failed = new SemanticAnalyzer(diagnostics, symbolTable, graph, options).analyze();
        if (failed.isPresent()) {
            throw fail(failed.get(), diagnostics);
        }

        CompiledTree tree = new CompiledTree(entry.logicalName(),
                graph.topologicalOrder().stream().map(ModuleDescriptor::file).collect(Collectors.toList()),
                symbolTable);
        LOG.info("Compiled {}: {} package(s)", entry.logicalName(), tree.packages().size());
        return tree;
    }

    private static CompilationException loadFailure(String path, SourceLoadException e) {
        return new CompilationException(CompilerPhase.LOADING,
                List.of(new Diagnostic(Diagnostic.Kind.IMPORT, e.getMessage(), path, 1, 1)));
    }

    private CompilationException fail(CompilerPhase phase, DiagnosticsEngine diagnostics) {
        LOG.debug("Compilation failed in phase {} with {} error(s)", phase, diagnostics.errorCount());
        return new CompilationException(phase, diagnostics.getDiagnostics());
    }
}
