package com.polygen.core.imports;

import com.polygen.core.ast.Definition;
import com.polygen.core.ast.SchemaAstBuilder;
import com.polygen.core.ast.SchemaFile;
import com.polygen.core.diagnostic.Diagnostic;
import com.polygen.core.parser.SchemaParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link NamespaceMerger}.
 */
class NamespaceMergerTest {

    private final NamespaceMerger merger = new NamespaceMerger();

    private static SchemaFile file(String path, String text) {
        return new SchemaAstBuilder().build(new SchemaParser().parse(path, text));
    }

    private static Map<String, Set<String>> typesByNamespace(MergedSchema schema) {
        Map<String, Set<String>> result = new TreeMap<>();
        for (MergedNamespace namespace : schema.namespaces()) {
            result.put(namespace.fqn(), namespace.types().stream().map(Definition::name).collect(Collectors.toSet()));
        }
        return result;
    }

    @Test
    void merge_combinesNamespaceSplitAcrossFiles() {
        SchemaFile a = file("a.poly", "namespace game { table Player { id: u32 primary_key; } }");
        SchemaFile b = file("b.poly", "namespace game { table Guild { id: u32 primary_key; } }");
        List<Diagnostic> diagnostics = new ArrayList<>();

        MergedSchema merged = merger.merge(List.of(a, b), diagnostics);

        assertThat(diagnostics).isEmpty();
        MergedNamespace game = merged.namespace("game").orElseThrow();
        assertThat(game.types()).extracting(Definition::name).containsExactly("Player", "Guild");
        assertThat(game.declarations()).hasSize(2);
    }

    @Test
    void merge_isIndependentOfFileOrder() {
        SchemaFile a = file("a.poly", """
            namespace game { table Player { id: u32 primary_key; } }
            namespace game.item { enum Rarity { Common, Rare } }
            """);
        SchemaFile b = file("b.poly", """
            namespace game { table Guild { id: u32 primary_key; } }
            namespace shop { table Offer { id: u32 primary_key; } }
            """);

        MergedSchema forward = merger.merge(List.of(a, b), new ArrayList<>());
        MergedSchema backward = merger.merge(List.of(b, a), new ArrayList<>());

        assertThat(typesByNamespace(forward)).isEqualTo(typesByNamespace(backward));
    }

    @Test
    void merge_nestedNamespaceDeclarations_useDottedFqn() {
        SchemaFile a = file("a.poly", "namespace game { namespace item { table Item { id: u32 primary_key; } } }");

        MergedSchema merged = merger.merge(List.of(a), new ArrayList<>());

        assertThat(merged.namespace("game.item")).hasValueSatisfying(ns ->
            assertThat(ns.types()).extracting(Definition::name).containsExactly("Item"));
    }

    @Test
    void merge_sameFileDuplicate_isLeftForValidator() {
        SchemaFile a = file("a.poly", """
            table Item { id: u32 primary_key; }
            table Item { id: u32 primary_key; }
            """);
        List<Diagnostic> diagnostics = new ArrayList<>();

        MergedSchema merged = merger.merge(List.of(a), diagnostics);

        assertThat(diagnostics).isEmpty();
        assertThat(merged.namespace("").orElseThrow().types()).hasSize(2);
    }
}
