package org.arfrpc.compiler.frontend.semantics;

import org.arfrpc.compiler.frontend.parser.ast.FileNode;
import org.arfrpc.compiler.frontend.parser.ast.ImportNode;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Holds per-file data in the module-aware symbol table: the parsed file, where each of its
 * imports points, and the aliases those imports introduce.
 */
public final class ModuleScope {

    private final ModuleId moduleId;
    private final FileNode file;
    private final Map<ImportNode, ModuleId> importTargets = new HashMap<>();
    private final Map<String, ImportBinding> aliases = new LinkedHashMap<>();

    public ModuleScope(ModuleId moduleId, FileNode file) {
        this.moduleId = moduleId;
        this.file = file;
    }

    public ModuleId moduleId() {
        return moduleId;
    }

    public FileNode file() {
        return file;
    }

    public String packageName() {
        return file.packageName();
    }

    /**
     * @return The first dotted component of this file's package.
     */
    public String firstPackageComponent() {
        String name = packageName();
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    /**
     * Import declaration to the file it loads. Filled from the dependency graph.
     */
    public Map<ImportNode, ModuleId> importTargets() {
        return importTargets;
    }

    /**
     * Alias to import binding. Filled during declaration collection.
     */
    public Map<String, ImportBinding> aliases() {
        return aliases;
    }

    public Optional<ImportBinding> alias(String name) {
        return Optional.ofNullable(aliases.get(name));
    }
}
