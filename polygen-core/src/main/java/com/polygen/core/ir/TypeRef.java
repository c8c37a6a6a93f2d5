package com.polygen.core.ir;

import com.polygen.core.ast.Cardinality;
import com.polygen.core.ast.PrimitiveType;

import java.util.Objects;

/**
 * Fully resolved type of a field.
 *
 * @param kind primitive, enum, embed or table
 * @param fqn FQN of the referenced definition (synthetic for inline types); null for primitives
 * @param primitive primitive type; null unless {@code kind == PRIMITIVE}
 * @param modifier scalar, optional or array
 * @param embedKind classification of the referenced embed; null unless {@code kind == EMBED}
 */
public record TypeRef(
    TypeRefKind kind,
    String fqn,
    PrimitiveType primitive,
    Cardinality modifier,
    EmbedKind embedKind
) {
    /**
     * Compact constructor with validation.
     */
    public TypeRef {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(modifier, "modifier must not be null");
        if (kind == TypeRefKind.PRIMITIVE) {
            Objects.requireNonNull(primitive, "primitive must not be null");
        } else {
            Objects.requireNonNull(fqn, "fqn must not be null");
        }
        if (kind == TypeRefKind.EMBED) {
            Objects.requireNonNull(embedKind, "embedKind must not be null");
        }
    }

    public static TypeRef primitive(PrimitiveType primitive, Cardinality modifier) {
        return new TypeRef(TypeRefKind.PRIMITIVE, null, primitive, modifier, null);
    }

    public static TypeRef enumType(String fqn, Cardinality modifier) {
        return new TypeRef(TypeRefKind.ENUM, fqn, null, modifier, null);
    }

    public static TypeRef embed(String fqn, EmbedKind embedKind, Cardinality modifier) {
        return new TypeRef(TypeRefKind.EMBED, fqn, null, modifier, embedKind);
    }

    public static TypeRef table(String fqn, Cardinality modifier) {
        return new TypeRef(TypeRefKind.TABLE, fqn, null, modifier, null);
    }

    /**
     * Type name without cardinality: the primitive keyword or the simple name of the
     * referenced definition.
     *
     * @return display name
     */
    public String baseName() {
        if (kind == TypeRefKind.PRIMITIVE) {
            return primitive.keyword();
        }
        int dot = fqn.lastIndexOf('.');
        return dot < 0 ? fqn : fqn.substring(dot + 1);
    }

    @Override
    public String toString() {
        return baseName() + modifier.suffix();
    }
}
