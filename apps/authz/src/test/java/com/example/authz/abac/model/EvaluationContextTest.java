package com.example.authz.abac.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EvaluationContext")
class EvaluationContextTest {

    @Test
    @DisplayName("should always expose a subject namespace")
    void shouldAlwaysExposeSubject() {
        EvaluationContext context = EvaluationContext.of(null, null, null);

        assertThat(context.hasNamespace(EvaluationContext.SUBJECT)).isTrue();
        assertThat(context.hasNamespace(EvaluationContext.RESOURCE)).isFalse();
        assertThat(context.hasNamespace(EvaluationContext.CONTEXT)).isFalse();
    }

    @Test
    @DisplayName("should resolve typed values by dotted path")
    void shouldResolveTypedValues() {
        EvaluationContext context = EvaluationContext.of(
                Map.of("userId", "u1", "age", 30, "verified", true, "roles", List.of("owner")),
                Map.of("owner", Map.of("id", "u1")),
                null);

        assertThat(context.resolve("subject.userId")).isEqualTo(new AttributeValue.Text("u1"));
        assertThat(context.resolve("subject.age")).isEqualTo(new AttributeValue.Numeric(30));
        assertThat(context.resolve("subject.verified")).isEqualTo(new AttributeValue.Bool(true));
        assertThat(context.resolve("subject.roles")).isInstanceOf(AttributeValue.ListValue.class);
        assertThat(context.resolve("resource.owner.id")).isEqualTo(new AttributeValue.Text("u1"));
    }

    @Test
    @DisplayName("should resolve missing keys and non-map intermediates to NULL")
    void shouldResolveMissingToNull() {
        EvaluationContext context = EvaluationContext.ofSubject(Map.of("userId", "u1"));

        assertThat(context.resolve("subject.missing").isNull()).isTrue();
        assertThat(context.resolve("subject.userId.length").isNull()).isTrue();
        assertThat(context.resolve("resource.id").isNull()).isTrue();
        assertThat(context.resolve("").isNull()).isTrue();
        assertThat(context.resolve(null).isNull()).isTrue();
    }
}
