package com.polygen.core.ir;

import java.util.Objects;

/**
 * Same-table ordering relation from {@code @link_rows}: rows sharing
 * {@code partitionBy} are chained through {@code linkWith}.
 *
 * @param partitionBy field grouping the rows
 * @param linkWith field pointing at the next row in the group
 */
public record LinkRows(
    String partitionBy,
    String linkWith
) {
    public LinkRows {
        Objects.requireNonNull(partitionBy, "partitionBy must not be null");
        Objects.requireNonNull(linkWith, "linkWith must not be null");
    }
}
