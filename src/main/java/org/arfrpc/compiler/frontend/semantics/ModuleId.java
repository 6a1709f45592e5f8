package org.arfrpc.compiler.frontend.semantics;

/**
 * Identifies a source file by its normalized path.
 * Used as a map key in the module-aware symbol table.
 *
 * @param path The normalized path that uniquely identifies a file.
 */
public record ModuleId(String path) {

    @Override
    public String toString() {
        return path;
    }
}
