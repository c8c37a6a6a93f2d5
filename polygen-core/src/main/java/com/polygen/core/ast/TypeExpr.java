package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;

import java.util.Objects;

/**
 * Declared type of a field, before resolution.
 */
public sealed interface TypeExpr {

    enum Kind { PRIMITIVE, NAMED, INLINE_EMBED, INLINE_ENUM }

    Kind kind();

    /**
     * Type as it would be written in the schema, without cardinality.
     *
     * @return display text
     */
    String displayName();

    record Primitive(PrimitiveType type) implements TypeExpr {
        public Primitive {
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.PRIMITIVE;
        }

        @Override
        public String displayName() {
            return type.keyword();
        }
    }

    /**
     * Reference to a definition by possibly-relative dotted path.
     *
     * @param path path as written
     * @param location source position
     */
    record Named(String path, SourceLocation location) implements TypeExpr {
        public Named {
            Objects.requireNonNull(path, "path must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.NAMED;
        }

        @Override
        public String displayName() {
            return path;
        }
    }

    record InlineEmbed(EmbedDef definition) implements TypeExpr {
        public InlineEmbed {
            Objects.requireNonNull(definition, "definition must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.INLINE_EMBED;
        }

        @Override
        public String displayName() {
            return definition.name();
        }
    }

    record InlineEnum(EnumDef definition) implements TypeExpr {
        public InlineEnum {
            Objects.requireNonNull(definition, "definition must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.INLINE_ENUM;
        }

        @Override
        public String displayName() {
            return definition.name();
        }
    }
}
