package com.example.authz.abac.engine;

import com.example.authz.abac.condition.ConditionEvaluator;
import com.example.authz.abac.condition.ConditionNode;
import com.example.authz.abac.condition.ConditionParser;
import com.example.authz.abac.model.AbacEvaluationResult;
import com.example.authz.abac.model.AbacPolicy;
import com.example.authz.abac.model.EvaluationContext;
import com.example.authz.abac.model.PolicyEffect;
import com.example.authz.observability.metrics.AuthzMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.example.authz.util.AbacPolicyTestBuilder.aDenyPolicy;
import static com.example.authz.util.AbacPolicyTestBuilder.aPolicy;
import static com.example.authz.util.AbacPolicyTestBuilder.anAllowPolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("PolicyDecisionEngine")
class PolicyDecisionEngineTest {

    private static final String MATCH_ALL = "{\"and\": []}";
    private static final String MATCH_NONE = "{\"or\": []}";

    private SimpleMeterRegistry registry;
    private AuthzMetrics metrics;
    private ConditionCache cache;
    private PolicyDecisionEngine engine;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AuthzMetrics(registry);
        cache = new ConditionCache(
                new ConditionParser(new ObjectMapper()), metrics, 100, Duration.ofMinutes(1));
        engine = new PolicyDecisionEngine(cache, new ConditionEvaluator(), metrics);
        context = EvaluationContext.ofSubject(Map.of("userId", "u1", "status", "active"));
    }

    @Nested
    @DisplayName("combining")
    class Combining {

        @Test
        @DisplayName("should deny when a DENY policy matches regardless of order")
        void denyShouldOverrideAllow() {
            AbacPolicy allow = anAllowPolicy("allow-all", MATCH_ALL);
            AbacPolicy deny = aDenyPolicy("deny-all", MATCH_ALL);

            AbacEvaluationResult allowFirst = engine.evaluate(List.of(allow, deny), context);
            AbacEvaluationResult denyFirst = engine.evaluate(List.of(deny, allow), context);

            assertThat(allowFirst.decision()).isEqualTo(PolicyEffect.DENY);
            assertThat(allowFirst.reason()).isEqualTo("Access denied by ABAC policy");
            assertThat(allowFirst.matchedPolicyNames()).containsExactly("allow-all", "deny-all");
            assertThat(denyFirst.decision()).isEqualTo(PolicyEffect.DENY);
            assertThat(denyFirst.matchedPolicyNames()).containsExactly("deny-all", "allow-all");
        }

        @Test
        @DisplayName("should allow when only ALLOW policies match")
        void shouldAllow() {
            AbacEvaluationResult result = engine.evaluate(List.of(
                    anAllowPolicy("allow-active", "{\"eq\": {\"subject.status\": \"active\"}}"),
                    aDenyPolicy("deny-suspended", "{\"eq\": {\"subject.status\": \"suspended\"}}")), context);

            assertThat(result.isAllowed()).isTrue();
            assertThat(result.reason()).isEqualTo("Access allowed by ABAC policy");
            assertThat(result.matchedPolicyNames()).containsExactly("allow-active");
        }

        @Test
        @DisplayName("should return no decision when nothing matches")
        void shouldReturnNoDecision() {
            AbacEvaluationResult result = engine.evaluate(List.of(
                    anAllowPolicy("never-allow", MATCH_NONE),
                    aDenyPolicy("never-deny", MATCH_NONE)), context);

            assertThat(result.decision()).isNull();
            assertThat(result.matchedPolicies()).isEmpty();
            assertThat(result.reason()).isEqualTo("No matching ABAC policies");
        }

        @Test
        @DisplayName("should return no decision for an empty policy set")
        void shouldHandleEmptyPolicySet() {
            assertThat(engine.evaluate(List.of(), context)).isEqualTo(AbacEvaluationResult.noMatch());
        }
    }

    @Nested
    @DisplayName("isolation")
    class Isolation {

        @Test
        @DisplayName("should skip inactive policies")
        void shouldSkipInactive() {
            AbacPolicy inactiveDeny = aPolicy()
                    .withName("inactive-deny")
                    .withEffect(PolicyEffect.DENY)
                    .withCondition(MATCH_ALL)
                    .inactive()
                    .build();

            AbacEvaluationResult result = engine.evaluate(List.of(inactiveDeny), context);

            assertThat(result.decision()).isNull();
            assertThat(result.matchedPolicies()).isEmpty();
        }

        @Test
        @DisplayName("should treat a malformed policy as a non-match and keep evaluating")
        void shouldIsolateMalformedPolicy() {
            AbacEvaluationResult result = engine.evaluate(List.of(
                    aDenyPolicy("broken-deny", "{\"eq\": "),
                    anAllowPolicy("allow-all", MATCH_ALL)), context);

            assertThat(result.isAllowed()).isTrue();
            assertThat(result.matchedPolicyNames()).containsExactly("allow-all");
            assertThat(registry.counter("abac.policy.errors").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should treat a policy that throws during evaluation as a non-match and keep evaluating")
        void shouldIsolateEvaluationFailure() {
            ConditionEvaluator failingEvaluator = mock(ConditionEvaluator.class);
            when(failingEvaluator.evaluate(any(ConditionNode.class), any(EvaluationContext.class)))
                    .thenThrow(new IllegalStateException("attribute lookup failed"))
                    .thenReturn(true);
            PolicyDecisionEngine isolatingEngine = new PolicyDecisionEngine(cache, failingEvaluator, metrics);

            AbacEvaluationResult result = isolatingEngine.evaluate(List.of(
                    aDenyPolicy("failing-deny", MATCH_ALL),
                    anAllowPolicy("allow-all", MATCH_ALL)), context);

            assertThat(result.isAllowed()).isTrue();
            assertThat(result.matchedPolicyNames()).containsExactly("allow-all");
            assertThat(registry.counter("abac.policy.errors").count()).isEqualTo(1.0);
            verify(failingEvaluator, times(2)).evaluate(any(ConditionNode.class), any(EvaluationContext.class));
        }

        @Test
        @DisplayName("should not let a malformed sub-tree be inverted by not")
        void shouldNotInvertMalformedSubtree() {
            AbacEvaluationResult result = engine.evaluate(List.of(
                    aDenyPolicy("inverted-garbage", "{\"not\": {\"unknown\": {}}}")), context);

            assertThat(result.decision()).isNull();
        }
    }

    @Test
    @DisplayName("should record decision metrics")
    void shouldRecordDecisionMetrics() {
        engine.evaluate(List.of(anAllowPolicy("allow-all", MATCH_ALL)), context);
        engine.evaluate(List.of(), context);

        assertThat(registry.counter("abac.decision", "result", "allowed").count()).isEqualTo(1.0);
        assertThat(registry.counter("abac.decision", "result", "none").count()).isEqualTo(1.0);
    }
}
