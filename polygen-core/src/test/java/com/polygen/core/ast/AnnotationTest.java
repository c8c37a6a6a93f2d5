package com.polygen.core.ast;

import com.polygen.core.diagnostic.SourceLocation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link Annotation} argument binding.
 */
class AnnotationTest {

    private static final SourceLocation HERE = SourceLocation.startOf("main.poly");

    private static AnnotationArgument named(String key, String value) {
        return new AnnotationArgument(key, new Literal(LiteralKind.IDENTIFIER, value, HERE));
    }

    private static AnnotationArgument positional(String value) {
        return new AnnotationArgument(null, new Literal(LiteralKind.STRING, value, HERE));
    }

    @Test
    void resolveParameters_fillsParametersNotGivenByNameInOrder() {
        Annotation annotation = new Annotation("link_rows",
            List.of(positional("next_id"), named("partition_by", "group_id")), HERE);

        Map<String, Literal> bound = annotation.resolveParameters(List.of("partition_by", "link_with"));

        assertThat(bound).containsOnlyKeys("partition_by", "link_with");
        assertThat(bound.get("partition_by").text()).isEqualTo("group_id");
        assertThat(bound.get("link_with").text()).isEqualTo("next_id");
    }

    @Test
    void resolveParameters_withSurplusPositional_leavesItUnbound() {
        Annotation annotation = new Annotation("cache", List.of(positional("lru"), positional("extra")), HERE);

        Map<String, Literal> bound = annotation.resolveParameters(List.of("strategy"));

        assertThat(bound).containsOnlyKeys("strategy");
        assertThat(bound.get("strategy").text()).isEqualTo("lru");
    }

    @Test
    void parameter_ofRecognizedAnnotation_usesItsParameterOrder() {
        Annotation annotation = new Annotation("load",
            List.of(named("type", "Map"), positional("players.csv")), HERE);

        assertThat(annotation.parameter("path"))
            .hasValueSatisfying(value -> assertThat(value.text()).isEqualTo("players.csv"));
    }

    @Test
    void parameter_ofUnrecognizedAnnotation_onlyBindsNamedArguments() {
        Annotation annotation = new Annotation("custom", List.of(positional("value")), HERE);

        assertThat(annotation.parameter("value")).isEmpty();
    }
}
