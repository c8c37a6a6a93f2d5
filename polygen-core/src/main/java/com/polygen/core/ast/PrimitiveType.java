package com.polygen.core.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Built-in scalar types of the schema language.
 */
public enum PrimitiveType {
    STRING("string", Category.TEXT, 0),
    BOOL("bool", Category.BOOLEAN, 1),
    BYTES("bytes", Category.BINARY, 0),
    I8("i8", Category.SIGNED_INTEGER, 1),
    I16("i16", Category.SIGNED_INTEGER, 2),
    I32("i32", Category.SIGNED_INTEGER, 4),
    I64("i64", Category.SIGNED_INTEGER, 8),
    U8("u8", Category.UNSIGNED_INTEGER, 1),
    U16("u16", Category.UNSIGNED_INTEGER, 2),
    U32("u32", Category.UNSIGNED_INTEGER, 4),
    U64("u64", Category.UNSIGNED_INTEGER, 8),
    F32("f32", Category.FLOAT, 4),
    F64("f64", Category.FLOAT, 8),
    TIMESTAMP("timestamp", Category.TIMESTAMP, 8);

    private enum Category { TEXT, BOOLEAN, BINARY, SIGNED_INTEGER, UNSIGNED_INTEGER, FLOAT, TIMESTAMP }

    private final String keyword;
    private final Category category;
    private final int byteWidth;

    PrimitiveType(String keyword, Category category, int byteWidth) {
        this.keyword = keyword;
        this.category = category;
        this.byteWidth = byteWidth;
    }

    /**
     * Looks up a primitive by its schema keyword.
     *
     * @param keyword keyword such as {@code u32}
     * @return matching primitive, or empty if the keyword is not a primitive
     */
    public static Optional<PrimitiveType> fromKeyword(String keyword) {
        return Arrays.stream(values())
            .filter(p -> p.keyword.equals(keyword))
            .findFirst();
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Encoded width in bytes on the wire; 0 for length-prefixed types.
     *
     * @return fixed width or 0
     */
    public int byteWidth() {
        return byteWidth;
    }

    public boolean isInteger() {
        return category == Category.SIGNED_INTEGER || category == Category.UNSIGNED_INTEGER;
    }

    public boolean isUnsigned() {
        return category == Category.UNSIGNED_INTEGER;
    }

    public boolean isFloat() {
        return category == Category.FLOAT;
    }

    public boolean isNumeric() {
        return isInteger() || isFloat();
    }

    public boolean isText() {
        return category == Category.TEXT;
    }

    public boolean isBinary() {
        return category == Category.BINARY;
    }

    public boolean isBoolean() {
        return category == Category.BOOLEAN;
    }

    public boolean isTimestamp() {
        return category == Category.TIMESTAMP;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
