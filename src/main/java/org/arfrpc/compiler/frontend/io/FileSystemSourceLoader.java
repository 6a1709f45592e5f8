package org.arfrpc.compiler.frontend.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads source units from the local file system as UTF-8 text.
 */
public final class FileSystemSourceLoader implements SourceLoader {

    private final String fileExtension;

    /**
     * @param fileExtension The extension appended to import literals lacking it.
     */
    public FileSystemSourceLoader(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    @Override
    public LoadResult load(String path) throws SourceLoadException {
        Path resolvedPath = SourceLoader.toPath(path);
        if (!Files.exists(resolvedPath)) {
            throw SourceLoadException.notFound(path);
        }
        if (Files.isDirectory(resolvedPath)) {
            throw SourceLoadException.directory(path);
        }
        if (!Files.isReadable(resolvedPath)) {
            throw SourceLoadException.unreadable(path, null);
        }
        try {
            String content = SourceLoader.normalizeLineEndings(Files.readString(resolvedPath, StandardCharsets.UTF_8));
            return new LoadResult(content, normalize(path));
        } catch (IOException e) {
            throw SourceLoadException.unreadable(path, e);
        }
    }

    @Override
    public String fileExtension() {
        return fileExtension;
    }
}
