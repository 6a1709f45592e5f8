package org.arfrpc.compiler.frontend.module;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.io.SourceLoadException;
import org.arfrpc.compiler.frontend.io.SourceLoader;
import org.arfrpc.compiler.frontend.lexer.Lexer;
import org.arfrpc.compiler.frontend.parser.Parser;
import org.arfrpc.compiler.frontend.parser.ast.FileNode;
import org.arfrpc.compiler.frontend.parser.ast.ImportNode;
import org.arfrpc.compiler.frontend.parser.ast.NodeIdAllocator;
import org.arfrpc.compiler.frontend.semantics.ModuleId;
import org.arfrpc.compiler.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the entry file and, depth first, every file it transitively imports. Each file is
 * lexed and parsed exactly once.
 *
 * <p>A path that is already parsed or currently being parsed is skipped, so diamond-shaped
 * import graphs load each file once and import cycles terminate without error. Files that
 * cannot be loaded are reported as {@link Diagnostic.Kind#IMPORT} errors at the import
 * declaration.</p>
 */
public final class DependencyScanner {

    private static final Logger LOG = LoggerFactory.getLogger(DependencyScanner.class);

    private final SourceLoader loader;
    private final DiagnosticsEngine diagnostics;
    private final NodeIdAllocator ids;
    private final Map<ModuleId, ModuleDescriptor> descriptors = new LinkedHashMap<>();
    private final Set<ModuleId> visiting = new HashSet<>();

    public DependencyScanner(SourceLoader loader, DiagnosticsEngine diagnostics, NodeIdAllocator ids) {
        this.loader = loader;
        this.diagnostics = diagnostics;
        this.ids = ids;
    }

    /**
     * Scans the entry file and all its transitive imports.
     *
     * @param entry The already loaded entry file.
     * @return A dependency graph with files in topological order.
     */
    public DependencyGraph scan(SourceLoader.LoadResult entry) {
        ModuleId entryId = new ModuleId(entry.logicalName());
        scanModule(entryId, entry.content());
        return new DependencyGraph(entryId, List.copyOf(descriptors.values()));
    }

    private void scanModule(ModuleId moduleId, String content) {
        if (descriptors.containsKey(moduleId) || visiting.contains(moduleId)) return;
        visiting.add(moduleId);

        LOG.debug("Parsing {}", moduleId);
        int errorsBefore = diagnostics.errorCount();
        List<Token> tokens = new Lexer(content, moduleId.path(), diagnostics).scanTokens();
        FileNode file = new Parser(tokens, moduleId.path(), diagnostics, ids).parse();
        if (diagnostics.errorCount() > errorsBefore) {
            LOG.debug("{} produced {} syntax error(s)", moduleId, diagnostics.errorCount() - errorsBefore);
        }

        List<ModuleDescriptor.ImportDecl> imports = new ArrayList<>();
        for (ImportNode importNode : file.imports()) {
            ModuleId importId;
            try {
                String resolvedPath = loader.resolveImport(moduleId.path(), importNode.pathValue());
                importId = new ModuleId(resolvedPath);
                if (!descriptors.containsKey(importId) && !visiting.contains(importId)) {
                    SourceLoader.LoadResult loaded = loader.load(resolvedPath);
                    scanModule(importId, loaded.content());
                } else {
                    LOG.trace("{} already loaded, skipping", importId);
                }
            } catch (SourceLoadException e) {
                diagnostics.reportError(Diagnostic.Kind.IMPORT,
                        "Cannot import \"" + importNode.pathValue() + "\": " + e.getMessage(),
                        importNode.position());
                continue;
            }
            imports.add(new ModuleDescriptor.ImportDecl(importNode, importId));
        }

        descriptors.put(moduleId, new ModuleDescriptor(moduleId, moduleId.path(), file, imports));
        visiting.remove(moduleId);
    }
}
