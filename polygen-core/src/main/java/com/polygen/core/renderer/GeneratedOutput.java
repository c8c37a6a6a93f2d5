package com.polygen.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * All files produced by one compilation, in generator and artifact order.
 *
 * @param files generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
