package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;

import java.util.List;

/**
 * A named declaration: namespace, table, enum or embed.
 */
public sealed interface Definition permits NamespaceDef, TableDef, EnumDef, EmbedDef {

    String name();

    List<Annotation> annotations();

    /**
     * Doc comment text collected from {@code ///} lines, or null.
     *
     * @return doc text or null
     */
    String doc();

    SourceLocation location();

    DefinitionKind definitionKind();
}
