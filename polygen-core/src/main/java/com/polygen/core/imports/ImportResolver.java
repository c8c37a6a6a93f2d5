package com.polygen.core.imports;

import com.polygen.core.ast.FileImport;
import com.polygen.core.ast.SchemaAstBuilder;
import com.polygen.core.ast.SchemaFile;
import com.polygen.core.diagnostic.Diagnostic;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.diagnostic.SourceLocation;
import com.polygen.core.parser.SchemaParser;
import com.polygen.core.parser.SchemaSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Discovers every file reachable from an entry schema through {@code import "path";}
 * statements and merges them into one {@link MergedSchema}.
 *
 * <p>Files are visited breadth-first and each is read and parsed at most once. Import
 * paths are resolved against the importing file's directory and normalized. The
 * resolver keeps going after a syntax error so that all broken files are reported in
 * one run. Any import cycle, a self import included, is reported once as a
 * {@link DiagnosticKind#CIRCULAR_IMPORT}.
 *
 * <p>If any diagnostic is reported, the result carries no merged schema.
 */
public class ImportResolver {

    private static final Logger log = LoggerFactory.getLogger(ImportResolver.class);

    private final SchemaSourceReader reader;
    private final SchemaParser parser;
    private final SchemaAstBuilder astBuilder;
    private final NamespaceMerger merger;

    public ImportResolver(SchemaSourceReader reader) {
        this(reader, new SchemaParser(), new SchemaAstBuilder(), new NamespaceMerger());
    }

    public ImportResolver(SchemaSourceReader reader, SchemaParser parser, SchemaAstBuilder astBuilder,
                          NamespaceMerger merger) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.astBuilder = Objects.requireNonNull(astBuilder, "astBuilder must not be null");
        this.merger = Objects.requireNonNull(merger, "merger must not be null");
    }

    /**
     * Resolves the import graph rooted at {@code entry}.
     *
     * @param entry entry schema file
     * @return merged schema or diagnostics
     */
    public ResolutionResult resolve(Path entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        Path root = entry.normalize();
        List<Diagnostic> diagnostics = new ArrayList<>();

        if (!reader.exists(root)) {
            diagnostics.add(Diagnostic.of(DiagnosticKind.IMPORT_NOT_FOUND,
                "Schema file not found: " + root, SourceLocation.startOf(root.toString())));
            return new ResolutionResult(null, diagnostics);
        }

        Map<Path, SchemaFile> files = new LinkedHashMap<>();
        Map<Path, List<ImportEdge>> graph = new LinkedHashMap<>();
        Set<Path> discovered = new LinkedHashSet<>();
        Deque<Path> queue = new ArrayDeque<>();
        discovered.add(root);
        queue.add(root);

        while (!queue.isEmpty()) {
            Path current = queue.poll();
            SchemaFile schemaFile = load(current, diagnostics);
            List<ImportEdge> edges = new ArrayList<>();
            graph.put(current, edges);
            if (schemaFile == null) {
                continue;
            }
            files.put(current, schemaFile);

            for (FileImport fileImport : schemaFile.imports()) {
                Path target = resolveImport(current, fileImport.path());
                if (!reader.exists(target)) {
                    diagnostics.add(Diagnostic.of(DiagnosticKind.IMPORT_NOT_FOUND,
                        "Imported file not found: " + target, fileImport.location()));
                    continue;
                }
                edges.add(new ImportEdge(target, fileImport.location()));
                if (discovered.add(target)) {
                    queue.add(target);
                }
            }
        }
        log.debug("Discovered {} schema files from {}", discovered.size(), root);

        diagnostics.addAll(findCycles(root, graph));

        if (!diagnostics.isEmpty()) {
            return new ResolutionResult(null, diagnostics);
        }

        List<Diagnostic> mergeDiagnostics = new ArrayList<>();
        MergedSchema merged = merger.merge(List.copyOf(files.values()), mergeDiagnostics);
        if (!mergeDiagnostics.isEmpty()) {
            return new ResolutionResult(null, mergeDiagnostics);
        }
        log.info("Resolved {} schema files", files.size());
        return new ResolutionResult(merged, List.of());
    }

    private SchemaFile load(Path path, List<Diagnostic> diagnostics) {
        String text;
        try {
            text = reader.read(path);
        } catch (IOException e) {
            log.debug("Failed to read {}", path, e);
            diagnostics.add(Diagnostic.of(DiagnosticKind.IMPORT_NOT_FOUND,
                "Cannot read schema file " + path + ": " + e.getMessage(), SourceLocation.startOf(path.toString())));
            return null;
        }

        try {
            return astBuilder.build(parser.parse(path.toString(), text));
        } catch (SchemaSyntaxException e) {
            log.debug("Syntax error in {}: {}", path, e.getMessage());
            diagnostics.add(e.toDiagnostic());
            return null;
        }
    }

    private Path resolveImport(Path importer, String importPath) {
        Path parent = importer.getParent();
        Path target = parent != null ? parent.resolve(importPath) : Path.of(importPath);
        return target.normalize();
    }

    /**
     * Depth-first search over the import graph. Each distinct cycle is reported once,
     * at the import that closes it.
     */
    private List<Diagnostic> findCycles(Path root, Map<Path, List<ImportEdge>> graph) {
        List<Diagnostic> cycles = new ArrayList<>();
        Set<List<Path>> reported = new HashSet<>();
        Map<Path, VisitState> states = new HashMap<>();
        Deque<Path> stack = new ArrayDeque<>();

        visit(root, graph, states, stack, reported, cycles);
        for (Path path : graph.keySet()) {
            visit(path, graph, states, stack, reported, cycles);
        }
        return cycles;
    }

    private void visit(Path path, Map<Path, List<ImportEdge>> graph, Map<Path, VisitState> states,
                       Deque<Path> stack, Set<List<Path>> reported, List<Diagnostic> cycles) {
        if (states.containsKey(path)) {
            return;
        }
        states.put(path, VisitState.IN_PROGRESS);
        stack.addLast(path);

        for (ImportEdge edge : graph.getOrDefault(path, List.of())) {
            VisitState state = states.get(edge.target());
            if (state == VisitState.IN_PROGRESS) {
                List<Path> chain = cycleChain(stack, edge.target());
                if (reported.add(canonical(chain))) {
                    String rendered = chain.stream().map(Path::toString).collect(Collectors.joining(" -> "))
                        + " -> " + edge.target();
                    cycles.add(Diagnostic.of(DiagnosticKind.CIRCULAR_IMPORT,
                        "Circular import: " + rendered, edge.location()));
                }
            } else if (state == null) {
                visit(edge.target(), graph, states, stack, reported, cycles);
            }
        }

        stack.removeLast();
        states.put(path, VisitState.DONE);
    }

    private List<Path> cycleChain(Deque<Path> stack, Path start) {
        List<Path> chain = new ArrayList<>();
        boolean inCycle = false;
        for (Path path : stack) {
            if (path.equals(start)) {
                inCycle = true;
            }
            if (inCycle) {
                chain.add(path);
            }
        }
        return chain;
    }

    /** Rotation of the cycle that starts at its smallest path. */
    private List<Path> canonical(List<Path> chain) {
        int start = 0;
        for (int i = 1; i < chain.size(); i++) {
            if (chain.get(i).toString().compareTo(chain.get(start).toString()) < 0) {
                start = i;
            }
        }
        List<Path> rotated = new ArrayList<>(chain.size());
        for (int i = 0; i < chain.size(); i++) {
            rotated.add(chain.get((start + i) % chain.size()));
        }
        return rotated;
    }

    private enum VisitState { IN_PROGRESS, DONE }

    private record ImportEdge(Path target, SourceLocation location) {
    }
}
