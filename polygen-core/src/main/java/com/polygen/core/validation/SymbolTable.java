package com.polygen.core.validation;

import com.polygen.core.ast.Definition;
import com.polygen.core.ast.FieldContainer;
import com.polygen.core.ast.FieldDef;
import com.polygen.core.ast.NamespaceImport;
import com.polygen.core.ast.TypeExpr;
import com.polygen.core.imports.MergedNamespace;
import com.polygen.core.imports.MergedSchema;
import com.polygen.core.util.NamingUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Index of every type in a merged schema, with scope-aware name resolution.
 *
 * <p>Named types are addressable by FQN; nested types are qualified by their owner
 * ({@code game.Player.Status}). Inline types are recorded under their synthetic FQN
 * {@code <owner>.<field>} but can never be referenced by name.
 *
 * <p>A relative name is resolved by trying, in order: each enclosing type from the
 * innermost outwards, the enclosing namespace and each of its ancestors up to the
 * root (where the name is taken as an FQN), then the namespace imports.
 */
public final class SymbolTable {

    private final Map<String, TypeSite> addressable = new LinkedHashMap<>();
    private final Map<String, TypeSite> byFqn = new LinkedHashMap<>();
    private final List<TypeSite> sites = new ArrayList<>();

    private SymbolTable() {
    }

    /**
     * Indexes all types of a merged schema. When a name is declared twice, the first
     * declaration wins; the duplicate is reported by validation.
     *
     * @param merged merged schema
     * @return symbol table
     */
    public static SymbolTable build(MergedSchema merged) {
        SymbolTable table = new SymbolTable();
        for (MergedNamespace namespace : merged.namespaces()) {
            Scope scope = new Scope(namespace.fqn(), List.of(), namespace.imports());
            for (Definition definition : namespace.types()) {
                String fqn = NamingUtils.qualify(namespace.fqn(), definition.name());
                table.register(definition, fqn, namespace.fqn(), null, TypeSite.SiteKind.NAMESPACE_LEVEL, scope);
            }
        }
        return table;
    }

    private void register(Definition definition, String fqn, String namespaceFqn, String ownerFqn,
                          TypeSite.SiteKind siteKind, Scope enclosingScope) {
        TypeSite site = new TypeSite(fqn, definition, namespaceFqn, ownerFqn, siteKind, enclosingScope.enter(fqn));
        sites.add(site);
        byFqn.putIfAbsent(fqn, site);
        if (siteKind != TypeSite.SiteKind.INLINE) {
            addressable.putIfAbsent(fqn, site);
        }

        if (definition instanceof FieldContainer container) {
            for (FieldDef field : container.fields()) {
                inlineDefinition(field).ifPresent(inline -> register(
                    inline, NamingUtils.qualify(fqn, field.name()), namespaceFqn, fqn,
                    TypeSite.SiteKind.INLINE, site.innerScope()));
            }
            for (Definition nested : container.nestedTypes()) {
                register(nested, NamingUtils.qualify(fqn, nested.name()), namespaceFqn, fqn,
                    TypeSite.SiteKind.NESTED, site.innerScope());
            }
        }
    }

    private static Optional<Definition> inlineDefinition(FieldDef field) {
        if (field.type() instanceof TypeExpr.InlineEmbed inlineEmbed) {
            return Optional.of(inlineEmbed.definition());
        }
        if (field.type() instanceof TypeExpr.InlineEnum inlineEnum) {
            return Optional.of(inlineEnum.definition());
        }
        return Optional.empty();
    }

    /**
     * All type sites in declaration order, including inline types.
     *
     * @return unmodifiable list of sites
     */
    public List<TypeSite> sites() {
        return Collections.unmodifiableList(sites);
    }

    /**
     * Looks up a site by exact FQN, including synthetic inline FQNs.
     *
     * @param fqn fully qualified name
     * @return site or empty
     */
    public Optional<TypeSite> lookup(String fqn) {
        return Optional.ofNullable(byFqn.get(fqn));
    }

    /**
     * Resolves a possibly-relative type path from a scope.
     *
     * @param path dotted path as written
     * @param scope lookup scope
     * @return resolved site or empty
     */
    public Optional<TypeSite> resolve(String path, Scope scope) {
        for (String enclosing : scope.enclosingTypes()) {
            TypeSite hit = addressable.get(NamingUtils.qualify(enclosing, path));
            if (hit != null) {
                return Optional.of(hit);
            }
        }

        String namespace = scope.namespaceFqn();
        while (true) {
            TypeSite hit = addressable.get(NamingUtils.qualify(namespace, path));
            if (hit != null) {
                return Optional.of(hit);
            }
            if (namespace.isEmpty()) {
                break;
            }
            namespace = NamingUtils.parentOf(namespace);
        }

        for (NamespaceImport namespaceImport : scope.imports()) {
            String candidate = importedName(namespaceImport, path);
            TypeSite hit = candidate != null ? addressable.get(candidate) : null;
            if (hit != null) {
                return Optional.of(hit);
            }
        }
        return Optional.empty();
    }

    private static String importedName(NamespaceImport namespaceImport, String path) {
        if (namespaceImport.wildcard()) {
            return NamingUtils.qualify(namespaceImport.path(), path);
        }
        String importedSimpleName = NamingUtils.simpleName(namespaceImport.path());
        int dot = path.indexOf('.');
        String head = dot < 0 ? path : path.substring(0, dot);
        if (!head.equals(importedSimpleName)) {
            return null;
        }
        return namespaceImport.path() + path.substring(head.length());
    }

    /**
     * Resolves the declared type of a field that lives in {@code owner}.
     *
     * @param field field to resolve
     * @param owner site of the table or embed declaring the field
     * @return site of the referenced or inline type; empty for primitives and unresolved names
     */
    public Optional<TypeSite> resolveFieldType(FieldDef field, TypeSite owner) {
        return switch (field.type().kind()) {
            case PRIMITIVE -> Optional.empty();
            case NAMED -> resolve(((TypeExpr.Named) field.type()).path(), owner.innerScope());
            case INLINE_EMBED, INLINE_ENUM -> lookup(NamingUtils.qualify(owner.fqn(), field.name()));
        };
    }

    /**
     * Resolves the table referenced by a foreign key declared in {@code owner}.
     *
     * @param tablePath table path as written
     * @param owner site declaring the foreign key
     * @return site of the referenced type, which may not be a table
     */
    public Optional<TypeSite> resolveForeignKeyTarget(String tablePath, TypeSite owner) {
        return resolve(tablePath, owner.innerScope());
    }
}
