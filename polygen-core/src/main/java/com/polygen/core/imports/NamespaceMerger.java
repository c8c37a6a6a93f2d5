package com.polygen.core.imports;

import com.polygen.core.ast.Annotation;
import com.polygen.core.ast.Definition;
import com.polygen.core.ast.NamespaceDef;
import com.polygen.core.ast.NamespaceImport;
import com.polygen.core.ast.SchemaFile;
import com.polygen.core.diagnostic.Diagnostic;
import com.polygen.core.diagnostic.DiagnosticKind;
import com.polygen.core.diagnostic.SourceLocation;
import com.polygen.core.util.NamingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces per-file ASTs into a single namespace tree keyed by FQN.
 *
 * <p>Namespace blocks with the same FQN are unioned; their members are concatenated in
 * file-visitation order. A type FQN declared in two different files is reported as a
 * {@link DiagnosticKind#DUPLICATE_DEFINITION} naming both locations and the second
 * declaration is dropped. Duplicates within one file are left to the validator.
 */
public class NamespaceMerger {

    private static final Logger log = LoggerFactory.getLogger(NamespaceMerger.class);

    /**
     * Merges files in the given order.
     *
     * @param files per-file ASTs in visitation order
     * @param diagnostics sink for cross-file duplicate definitions
     * @return merged schema
     */
    public MergedSchema merge(List<SchemaFile> files, List<Diagnostic> diagnostics) {
        Map<String, Accumulator> namespaces = new LinkedHashMap<>();
        Map<String, Definition> declaredTypes = new HashMap<>();
        namespaces.put("", new Accumulator(""));

        for (SchemaFile file : files) {
            for (Definition definition : file.definitions()) {
                add(namespaces, declaredTypes, "", definition, diagnostics);
            }
        }

        List<MergedNamespace> merged = namespaces.values().stream()
            .map(Accumulator::toNamespace)
            .toList();
        log.debug("Merged {} files into {} namespaces", files.size(), merged.size());
        return new MergedSchema(merged, files);
    }

    private void add(Map<String, Accumulator> namespaces, Map<String, Definition> declaredTypes,
                     String namespaceFqn, Definition definition, List<Diagnostic> diagnostics) {
        if (definition instanceof NamespaceDef namespace) {
            String fqn = NamingUtils.qualify(namespaceFqn, namespace.name());
            Accumulator accumulator = namespaces.computeIfAbsent(fqn, Accumulator::new);
            accumulator.annotations.addAll(namespace.annotations());
            accumulator.imports.addAll(namespace.imports());
            accumulator.declarations.add(namespace.location());
            if (accumulator.doc == null) {
                accumulator.doc = namespace.doc();
            }
            for (Definition member : namespace.members()) {
                add(namespaces, declaredTypes, fqn, member, diagnostics);
            }
            return;
        }

        String fqn = NamingUtils.qualify(namespaceFqn, definition.name());
        Definition existing = declaredTypes.get(fqn);
        if (existing != null && !existing.location().file().equals(definition.location().file())) {
            diagnostics.add(Diagnostic.of(
                DiagnosticKind.DUPLICATE_DEFINITION,
                "'" + fqn + "' is already defined in " + existing.location().file(),
                definition.location(),
                existing.location()));
            return;
        }
        declaredTypes.putIfAbsent(fqn, definition);
        namespaces.get(namespaceFqn).types.add(definition);
    }

    private static final class Accumulator {
        private final String fqn;
        private final List<Annotation> annotations = new ArrayList<>();
        private final List<NamespaceImport> imports = new ArrayList<>();
        private final List<Definition> types = new ArrayList<>();
        private final List<SourceLocation> declarations = new ArrayList<>();
        private String doc;

        Accumulator(String fqn) {
            this.fqn = fqn;
        }

        MergedNamespace toNamespace() {
            return new MergedNamespace(fqn, annotations, imports, types, doc, declarations);
        }
    }
}
