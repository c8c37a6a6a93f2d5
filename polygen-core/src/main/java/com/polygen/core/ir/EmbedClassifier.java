package com.polygen.core.ir;

import com.polygen.core.validation.SymbolTable;
import com.polygen.core.validation.TypeSite;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assigns every embed its {@link EmbedKind} in one pass over the merged schema.
 *
 * <p>The classification depends only on where the embed is declared, never on which
 * tables use it or in which file they live.
 */
public class EmbedClassifier {

    /**
     * Classifies all embeds of the schema.
     *
     * @param symbols symbol table of the merged schema
     * @return embed kind by FQN, in declaration order
     */
    public Map<String, EmbedKind> classify(SymbolTable symbols) {
        Map<String, EmbedKind> kinds = new LinkedHashMap<>();
        for (TypeSite site : symbols.sites()) {
            if (site.isEmbed()) {
                kinds.putIfAbsent(site.fqn(), classify(site));
            }
        }
        return kinds;
    }

    public EmbedKind classify(TypeSite site) {
        return switch (site.siteKind()) {
            case NAMESPACE_LEVEL -> EmbedKind.REUSABLE;
            case NESTED -> EmbedKind.NESTED_NAMED;
            case INLINE -> EmbedKind.INLINE;
        };
    }
}
