package com.polygen.core.ir;

/**
 * Classification of an embed by its declaration site.
 */
public enum EmbedKind {
    /** Declared at namespace scope; may be used by any table. */
    REUSABLE,
    /** Named and declared inside a table or embed body. */
    NESTED_NAMED,
    /** Declared anonymously as a field's type; never emitted as a standalone unit. */
    INLINE
}
