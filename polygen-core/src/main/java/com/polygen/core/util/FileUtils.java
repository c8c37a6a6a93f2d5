package com.polygen.core.util;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final String GLOB_CHARACTERS = "*?[{";

    private FileUtils() {
        // Utility class
    }

    /**
     * Lists the regular files of one directory whose names match a glob. Subdirectories
     * are not searched.
     *
     * @param directory directory to list
     * @param fileNameGlob glob matched against file names
     * @return matching paths, unsorted
     * @throws IOException if the directory cannot be listed
     */
    public static List<Path> listFiles(Path directory, String fileNameGlob) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, fileNameGlob)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        }
        return files;
    }

    /**
     * Checks whether a path string contains glob metacharacters.
     *
     * @param pattern path or pattern
     * @return true if the string is a glob
     */
    public static boolean isGlob(String pattern) {
        return pattern.chars().anyMatch(c -> GLOB_CHARACTERS.indexOf(c) >= 0);
    }

    /**
     * Sorts paths by their string form, ignoring case.
     *
     * @param paths paths to sort
     * @return new sorted list
     */
    public static List<Path> sortIgnoreCase(List<Path> paths) {
        return paths.stream()
            .sorted(Comparator.comparing((Path p) -> p.toString().replace('\\', '/').toLowerCase(Locale.ROOT))
                .thenComparing(Path::toString))
            .toList();
    }

    /**
     * Deletes the contents of a directory, keeping the directory itself.
     *
     * @param directory directory to empty; ignored if it does not exist
     * @throws IOException if a file cannot be deleted
     */
    public static void deleteContents(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> paths = Files.walk(directory)) {
            entries = paths
                .filter(path -> !path.equals(directory))
                .sorted(Comparator.reverseOrder())
                .toList();
        }
        for (Path entry : entries) {
            Files.delete(entry);
        }
    }

    /**
     * Returns the file extension without the dot, lower-cased.
     *
     * @param path file path
     * @return extension or empty string
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
