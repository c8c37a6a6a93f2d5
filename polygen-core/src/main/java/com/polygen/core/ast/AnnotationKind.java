package com.polygen.core.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Annotations the compiler interprets, with their required parameters.
 *
 * <p>Any other annotation name is kept on the AST and IR but has no effect.
 */
public enum AnnotationKind {
    TAGGABLE("taggable", 0),
    LINK_ROWS("link_rows", 2, "partition_by", "link_with"),
    LOAD("load", 1, "type", "path"),
    SAVE("save", 1, "type", "path"),
    CACHE("cache", 1, "strategy"),
    READONLY("readonly", 0),
    SOFT_DELETE("soft_delete", 1, "field"),
    RENAMED_FROM("renamed_from", 1, "name"),
    DATASOURCE("datasource", 1, "name"),
    INDEX("index", 0),
    OUTPUT("output", 1, "path");

    private final String annotationName;
    private final List<String> parameters;
    private final int requiredCount;

    AnnotationKind(String annotationName, int requiredCount, String... parameters) {
        this.annotationName = annotationName;
        this.requiredCount = requiredCount;
        this.parameters = List.of(parameters);
    }

    public static Optional<AnnotationKind> fromName(String name) {
        return Arrays.stream(values())
            .filter(kind -> kind.annotationName.equals(name))
            .findFirst();
    }

    public String annotationName() {
        return annotationName;
    }

    /**
     * Parameter names in positional order. Positional arguments fill the parameters not
     * given by name, in this order.
     *
     * @return parameter names
     */
    public List<String> parameters() {
        return parameters;
    }

    /**
     * Parameter names that must be supplied, by name or by position.
     *
     * @return leading entries of {@link #parameters()}
     */
    public List<String> requiredParameters() {
        return parameters.subList(0, requiredCount);
    }
}
