package com.polygen.core.diagnostic;

import java.util.Objects;

/**
 * Position of a construct in a schema source file.
 *
 * <p>Lines and columns are 1-based.
 *
 * @param file path of the source file as it was resolved
 * @param line line number
 * @param column column number
 */
public record SourceLocation(
    String file,
    int line,
    int column
) {
    /**
     * Compact constructor with validation.
     */
    public SourceLocation {
        Objects.requireNonNull(file, "file must not be null");
        if (line < 1) {
            line = 1;
        }
        if (column < 1) {
            column = 1;
        }
    }

    /**
     * Location pointing at the start of a file.
     *
     * @param file source file
     * @return location at line 1, column 1
     */
    public static SourceLocation startOf(String file) {
        return new SourceLocation(file, 1, 1);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
