package com.polygen.core.ast;

public enum LiteralKind {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    IDENTIFIER
}
