package com.polygen.cli;

import com.polygen.core.config.ConfigLoader;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Config file lookup shared by the commands.
 */
final class ConfigSupport {

    private ConfigSupport() {
        // Utility class
    }

    /**
     * Nearest {@code polygen.yaml} above the working directory, or the default name in
     * the working directory when there is none.
     */
    static Path locate() {
        return ConfigLoader.find(Paths.get("")).orElse(Paths.get(ConfigLoader.DEFAULT_FILE_NAME));
    }
}
