package com.polygen.core.ast;

public enum DefinitionKind {
    NAMESPACE("namespace"),
    TABLE("table"),
    ENUM("enum"),
    EMBED("embed");

    private final String keyword;

    DefinitionKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
