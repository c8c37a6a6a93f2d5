package com.polygen.core.ir;

public enum TypeRefKind {
    PRIMITIVE,
    ENUM,
    EMBED,
    TABLE
}
