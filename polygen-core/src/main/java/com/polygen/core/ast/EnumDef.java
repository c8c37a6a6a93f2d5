package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An enum declaration, named or anonymous.
 *
 * @param name declared or synthesized name
 * @param annotations enum annotations
 * @param variants variants in declaration order
 * @param anonymous true for inline enums
 * @param doc doc comment or null
 * @param location source position
 */
public record EnumDef(
    String name,
    List<Annotation> annotations,
    List<EnumVariant> variants,
    boolean anonymous,
    String doc,
    SourceLocation location
) implements Definition {

    public EnumDef {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(location, "location must not be null");
        annotations = annotations != null ? List.copyOf(annotations) : List.of();
        variants = variants != null ? List.copyOf(variants) : List.of();
    }

    public Optional<EnumVariant> variant(String variantName) {
        return variants.stream()
            .filter(v -> v.name().equals(variantName))
            .findFirst();
    }

    @Override
    public DefinitionKind definitionKind() {
        return DefinitionKind.ENUM;
    }
}
