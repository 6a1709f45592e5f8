package org.arfrpc.compiler.frontend.io;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Supplies source text to the compiler and maps import literals to loadable paths.
 * The compiler never touches the file system directly; everything goes through this seam.
 */
public interface SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The canonical name used for deduplication and diagnostics.
     */
    record LoadResult(String content, String logicalName) {}

    /**
     * Loads a source unit.
     *
     * @param path A normalized path as produced by {@link #normalize(String)} or
     *             {@link #resolveImport(String, String)}.
     * @return The loaded content.
     * @throws SourceLoadException If the path is missing, a directory, or unreadable.
     */
    LoadResult load(String path) throws SourceLoadException;

    /**
     * @return The extension appended to import literals that lack it, e.g. {@code .arf}.
     */
    String fileExtension();

    /**
     * Maps an import literal to the path of the imported file: the extension is appended
     * when missing and the literal is resolved against the importing file's directory.
     *
     * @param importingPath The normalized path of the file containing the import.
     * @param literal       The import literal as written, e.g. {@code "sub/pkg"}.
     * @return The normalized path of the imported file.
     * @throws SourceLoadException If the literal does not form a valid path.
     */
    default String resolveImport(String importingPath, String literal) throws SourceLoadException {
        String withExtension = literal.endsWith(fileExtension()) ? literal : literal + fileExtension();
        Path parent = toPath(importingPath).getParent();
        Path resolved = parent == null ? toPath(withExtension) : parent.resolve(toPath(withExtension));
        return normalize(resolved.toString());
    }

    /**
     * Normalizes a path so that the same file always yields the same string.
     *
     * @throws SourceLoadException If {@code path} is not a valid path on this platform.
     */
    default String normalize(String path) throws SourceLoadException {
        return toPath(path).normalize().toString().replace('\\', '/');
    }

    /**
     * Converts a string to a {@link Path}, reporting an unrepresentable one as a load failure.
     */
    static Path toPath(String path) throws SourceLoadException {
        try {
            return Path.of(path);
        } catch (InvalidPathException e) {
            throw SourceLoadException.invalidPath(path, e);
        }
    }

    /**
     * Normalizes line endings to {@code \n}.
     */
    static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
