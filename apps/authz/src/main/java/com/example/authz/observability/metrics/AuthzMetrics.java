package com.example.authz.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Authorization metrics.
 * Uses bounded tag values to prevent high-cardinality metric explosion.
 */
@Component
public class AuthzMetrics {

    private static final String TAG_UNKNOWN = "unknown";
    private static final int MAX_TAG_LENGTH = 50;

    private final MeterRegistry registry;

    private final Counter abacDecisionAllowed;
    private final Counter abacDecisionDenied;
    private final Counter abacDecisionNone;
    private final Counter abacPolicyErrors;
    private final Counter conditionCacheHit;
    private final Counter conditionCacheMiss;

    public AuthzMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.abacDecisionAllowed = Counter.builder("abac.decision")
                .tag("result", "allowed")
                .description("ABAC evaluations resolved to ALLOW")
                .register(registry);

        this.abacDecisionDenied = Counter.builder("abac.decision")
                .tag("result", "denied")
                .description("ABAC evaluations resolved to DENY")
                .register(registry);

        this.abacDecisionNone = Counter.builder("abac.decision")
                .tag("result", "none")
                .description("ABAC evaluations with no matching policy")
                .register(registry);

        this.abacPolicyErrors = Counter.builder("abac.policy.errors")
                .description("Policies skipped because their evaluation failed")
                .register(registry);

        this.conditionCacheHit = Counter.builder("abac.condition.cache")
                .tag("result", "hit")
                .description("Parsed condition cache hits")
                .register(registry);

        this.conditionCacheMiss = Counter.builder("abac.condition.cache")
                .tag("result", "miss")
                .description("Parsed condition cache misses")
                .register(registry);
    }

    public void recordAbacDecision(@Nullable Boolean allowed) {
        if (allowed == null) {
            abacDecisionNone.increment();
        } else if (allowed) {
            abacDecisionAllowed.increment();
        } else {
            abacDecisionDenied.increment();
        }
    }

    public void recordPolicyError() {
        abacPolicyErrors.increment();
    }

    public void recordConditionCacheHit() {
        conditionCacheHit.increment();
    }

    public void recordConditionCacheMiss() {
        conditionCacheMiss.increment();
    }

    public void recordAuthorizationCheck(boolean allowed, @Nullable String principalType) {
        registry.counter("authz.check",
                Tags.of("outcome", allowed ? "allowed" : "denied",
                        "principal_type", sanitizeTag(principalType)))
                .increment();
    }

    private String sanitizeTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return TAG_UNKNOWN;
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_-]", "_");
        if (sanitized.length() > MAX_TAG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_TAG_LENGTH);
        }
        return sanitized.isBlank() ? TAG_UNKNOWN : sanitized;
    }
}
