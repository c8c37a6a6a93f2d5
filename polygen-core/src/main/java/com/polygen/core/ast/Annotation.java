package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An {@code @name(args...)} annotation.
 *
 * @param name annotation name
 * @param arguments arguments in source order
 * @param location source position of the {@code @}
 */
public record Annotation(
    String name,
    List<AnnotationArgument> arguments,
    SourceLocation location
) {
    /**
     * Compact constructor with validation.
     */
    public Annotation {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(location, "location must not be null");
        arguments = arguments != null ? List.copyOf(arguments) : List.of();
    }

    /**
     * Interpreted kind, if the name is recognized.
     *
     * @return annotation kind or empty
     */
    public Optional<AnnotationKind> kind() {
        return AnnotationKind.fromName(name);
    }

    public List<Literal> positionalArguments() {
        return arguments.stream()
            .filter(AnnotationArgument::isPositional)
            .map(AnnotationArgument::value)
            .toList();
    }

    public Optional<Literal> namedArgument(String key) {
        return arguments.stream()
            .filter(arg -> key.equals(arg.key()))
            .map(AnnotationArgument::value)
            .findFirst();
    }

    /**
     * Binds arguments to parameters. Named arguments bind first; positional arguments
     * then fill the remaining parameters in order. Surplus positional arguments are
     * left unbound.
     *
     * @param parameters parameter names in positional order
     * @return bound values keyed by parameter name, in parameter order
     */
    public Map<String, Literal> resolveParameters(List<String> parameters) {
        Map<String, Literal> bound = new HashMap<>();
        for (String parameter : parameters) {
            namedArgument(parameter).ifPresent(value -> bound.put(parameter, value));
        }
        Iterator<Literal> positional = positionalArguments().iterator();
        for (String parameter : parameters) {
            if (!positional.hasNext()) {
                break;
            }
            if (!bound.containsKey(parameter)) {
                bound.put(parameter, positional.next());
            }
        }

        Map<String, Literal> ordered = new LinkedHashMap<>();
        for (String parameter : parameters) {
            if (bound.containsKey(parameter)) {
                ordered.put(parameter, bound.get(parameter));
            }
        }
        return ordered;
    }

    /**
     * Value of one parameter of a recognized annotation, given by name or by position.
     * Unrecognized annotations only bind named arguments.
     *
     * @param key parameter name
     * @return argument value or empty
     */
    public Optional<Literal> parameter(String key) {
        return kind()
            .map(kind -> Optional.ofNullable(resolveParameters(kind.parameters()).get(key)))
            .orElseGet(() -> namedArgument(key));
    }
}
