package com.polygen.core.imports;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serves schema files from an in-memory map, keyed by normalized path.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * InMemorySourceReader reader = new InMemorySourceReader()
 *     .add("main.poly", "import \"player.poly\";")
 *     .add("player.poly", "table Player { id: u32 primary_key; }");
 * ResolutionResult result = new ImportResolver(reader).resolve(Path.of("main.poly"));
 * }</pre>
 */
public class InMemorySourceReader implements SchemaSourceReader {

    private final Map<Path, String> files = new LinkedHashMap<>();

    /**
     * Registers a file.
     *
     * @param path file path
     * @param content file contents
     * @return this reader
     */
    public InMemorySourceReader add(String path, String content) {
        files.put(Path.of(path).normalize(), content);
        return this;
    }

    @Override
    public boolean exists(Path path) {
        return files.containsKey(path.normalize());
    }

    @Override
    public String read(Path path) throws IOException {
        String content = files.get(path.normalize());
        if (content == null) {
            throw new NoSuchFileException(path.toString());
        }
        return content;
    }
}
