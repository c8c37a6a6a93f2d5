package com.polygen.core.imports;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Source of schema file contents.
 *
 * <p>All file access of the compiler goes through this interface, so callers decide
 * where schema text comes from (filesystem, classpath, memory).
 */
public interface SchemaSourceReader {

    /**
     * Checks whether a schema file exists.
     *
     * @param path normalized path
     * @return true if {@link #read(Path)} can be called
     */
    boolean exists(Path path);

    /**
     * Reads a schema file as UTF-8 text.
     *
     * @param path normalized path
     * @return file contents
     * @throws IOException if the file cannot be read
     */
    String read(Path path) throws IOException;
}
