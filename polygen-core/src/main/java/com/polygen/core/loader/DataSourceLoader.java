package com.polygen.core.loader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.polygen.core.ir.DataSourceSpec;
import com.polygen.core.ir.DataSourceType;
import com.polygen.core.ir.FieldIr;
import com.polygen.core.ir.TableIr;
import com.polygen.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Loads the rows behind a {@code @load(type: "Map", path: ...)} table.
 *
 * <p>The path is relative to the base directory and names a single file, a directory
 * (every CSV and JSON file directly inside it) or a glob on the file name
 * ({@code ../data/players_*.csv}). A path that matches no file is an error. Matching
 * files are read in case-insensitive path order and their rows concatenated. CSV files need a
 * header row; JSON files hold an array of objects. A primary-key value seen in two files
 * fails the whole load with a {@link DuplicateKeyException}. Numeric keys compare by
 * value, so {@code 7}, {@code "7"} and {@code 7.0} are the same key.
 */
public class DataSourceLoader {

    private static final Logger log = LoggerFactory.getLogger(DataSourceLoader.class);
    private static final Set<String> DATA_EXTENSIONS = Set.of("csv", "json");
    private static final Pattern NUMBER = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?");

    private final CsvMapper csvMapper = new CsvMapper();
    private final ObjectMapper jsonMapper = new ObjectMapper();

    /**
     * Loads all rows of a Map data source.
     *
     * @param spec interpreted {@code @load} annotation
     * @param baseDir directory the path is relative to
     * @param keyField primary-key column, or null to skip the uniqueness check
     * @return rows in file then row order
     * @throws DuplicateKeyException if two files contribute the same key
     * @throws DataLoadException if the source cannot be read
     */
    public List<DataRow> load(DataSourceSpec spec, Path baseDir, String keyField) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(baseDir, "baseDir must not be null");
        if (spec.type() != DataSourceType.MAP) {
            throw new IllegalArgumentException("Only Map data sources can be loaded from files, got " + spec.type().schemaName());
        }
        if (spec.path() == null) {
            throw new IllegalArgumentException("Map data source has no path");
        }

        Path base = baseDir.toAbsolutePath().normalize();
        List<Path> files = resolveFiles(base, spec.path());
        log.info("Loading {} file(s) for {}", files.size(), spec.path());

        List<DataRow> rows = new ArrayList<>();
        Map<String, String> keyOwners = new HashMap<>();
        for (Path file : files) {
            String relative = base.relativize(file).toString().replace('\\', '/');
            List<Map<String, Object>> fileRows = readFile(file);
            log.debug("Read {} rows from {}", fileRows.size(), relative);

            for (Map<String, Object> values : fileRows) {
                if (keyField != null) {
                    Object keyValue = values.get(keyField);
                    if (keyValue == null) {
                        throw new DataLoadException("Row without key '" + keyField + "' in file: '" + relative + "'");
                    }
                    String key = normalizeKey(keyValue);
                    String owner = keyOwners.putIfAbsent(key, relative);
                    if (owner != null && !owner.equals(relative)) {
                        throw new DuplicateKeyException(key, owner, relative);
                    }
                    if (owner != null) {
                        throw new DataLoadException("Duplicate key '" + key + "' in file: '" + relative + "'");
                    }
                }
                rows.add(new DataRow(values, relative));
            }
        }
        return rows;
    }

    /**
     * Loads the {@code @load} source of a table. The path is relative to the schema file
     * declaring the table, and the table's primary key is the uniqueness key.
     *
     * @param table table with a Map {@code @load} annotation
     * @return rows in file then row order
     * @throws IllegalArgumentException if the table has no {@code @load} source
     */
    public List<DataRow> load(TableIr table) {
        Objects.requireNonNull(table, "table must not be null");
        DataSourceSpec spec = table.options().load();
        if (spec == null) {
            throw new IllegalArgumentException("Table '" + table.fqn() + "' has no @load source");
        }
        Path baseDir = Path.of(table.location().file()).toAbsolutePath().getParent();
        String keyField = table.primaryKey().map(FieldIr::name).orElse(null);
        log.debug("Loading table {} from {} (key: {})", table.fqn(), spec.path(), keyField);
        return load(spec, baseDir, keyField);
    }

    private List<Path> resolveFiles(Path baseDir, String path) {
        try {
            if (FileUtils.isGlob(path)) {
                int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
                Path directory = baseDir.resolve(slash < 0 ? "" : path.substring(0, slash)).normalize();
                if (!Files.isDirectory(directory)) {
                    throw new DataLoadException("No data files match '" + path + "': directory not found: " + directory);
                }
                return requireMatches(FileUtils.listFiles(directory, path.substring(slash + 1)), path, directory);
            }

            Path target = baseDir.resolve(path).normalize();
            if (path.endsWith("/") || path.endsWith("\\") || Files.isDirectory(target)) {
                if (!Files.isDirectory(target)) {
                    throw new DataLoadException("Data directory not found: " + target);
                }
                List<Path> files = FileUtils.listFiles(target, "*").stream()
                    .filter(file -> DATA_EXTENSIONS.contains(FileUtils.getExtension(file)))
                    .toList();
                return requireMatches(files, path, target);
            }
            if (!Files.isRegularFile(target)) {
                throw new DataLoadException("Data file not found: " + target);
            }
            return List.of(target);
        } catch (IOException e) {
            throw new DataLoadException("Failed to list data files for '" + path + "' under " + baseDir, e);
        }
    }

    private static List<Path> requireMatches(List<Path> files, String path, Path directory) {
        if (files.isEmpty()) {
            throw new DataLoadException("No data files match '" + path + "' in " + directory);
        }
        return FileUtils.sortIgnoreCase(files);
    }

    static String normalizeKey(Object value) {
        String text = String.valueOf(value).trim();
        if ((value instanceof Number || value instanceof String) && NUMBER.matcher(text).matches()) {
            return new BigDecimal(text).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    private List<Map<String, Object>> readFile(Path file) {
        String extension = FileUtils.getExtension(file);
        try {
            return switch (extension) {
                case "csv" -> readCsv(file);
                case "json" -> jsonMapper.readValue(file.toFile(), new TypeReference<List<Map<String, Object>>>() { });
                default -> throw new DataLoadException("Unsupported data file type: " + file);
            };
        } catch (IOException e) {
            throw new DataLoadException("Failed to read data file: " + file + ": " + e.getMessage(), e);
        }
    }

    private List<Map<String, Object>> readCsv(Path file) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, Object>> rows = new ArrayList<>();
        try (MappingIterator<Map<String, Object>> iterator = csvMapper
                .readerFor(new TypeReference<Map<String, Object>>() { })
                .with(schema)
                .readValues(file.toFile())) {
            while (iterator.hasNext()) {
                rows.add(iterator.next());
            }
        }
        return rows;
    }
}
