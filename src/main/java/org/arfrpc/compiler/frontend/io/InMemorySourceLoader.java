package org.arfrpc.compiler.frontend.io;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Serves source units from memory. Lets callers compile text that never lived on disk and
 * keeps tests independent of the file system.
 */
public final class InMemorySourceLoader implements SourceLoader {

    private final Map<String, String> sources = new LinkedHashMap<>();
    private final String fileExtension;

    public InMemorySourceLoader(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    /**
     * Adds or replaces a source unit.
     *
     * @param path    The path, normalized on insertion.
     * @param content The source text.
     * @return This loader, for chaining.
     * @throws IllegalArgumentException If {@code path} is not a valid path.
     */
    public InMemorySourceLoader add(String path, String content) {
        try {
            sources.put(normalize(path), SourceLoader.normalizeLineEndings(content));
        } catch (SourceLoadException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        return this;
    }

    @Override
    public LoadResult load(String path) throws SourceLoadException {
        String key = normalize(path);
        String content = sources.get(key);
        if (content != null) {
            return new LoadResult(content, key);
        }
        String prefix = key + "/";
        if (sources.keySet().stream().anyMatch(p -> p.startsWith(prefix))) {
            throw SourceLoadException.directory(key);
        }
        throw SourceLoadException.notFound(key);
    }

    @Override
    public String fileExtension() {
        return fileExtension;
    }

    public Set<String> paths() {
        return sources.keySet();
    }
}
