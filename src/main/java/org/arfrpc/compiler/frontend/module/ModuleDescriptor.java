package org.arfrpc.compiler.frontend.module;

import org.arfrpc.compiler.frontend.parser.ast.FileNode;
import org.arfrpc.compiler.frontend.parser.ast.ImportNode;
import org.arfrpc.compiler.frontend.semantics.ModuleId;

import java.util.List;

/**
 * Per-file metadata from the dependency scan.
 *
 * @param id         The unique identity of this file.
 * @param sourcePath The normalized path.
 * @param file       The parsed syntax tree.
 * @param imports    The file's imports with their resolved targets.
 */
public record ModuleDescriptor(
        ModuleId id,
        String sourcePath,
        FileNode file,
        List<ImportDecl> imports
) {

    /**
     * An import declaration found during dependency scanning.
     *
     * @param node       The import as parsed.
     * @param resolvedId The identity of the imported file.
     */
    public record ImportDecl(ImportNode node, ModuleId resolvedId) {
    }

    /**
     * @return The declared package name of this file.
     */
    public String packageName() {
        return file.packageName();
    }
}
