package com.example.authz.abac.config;

import com.example.authz.abac.model.AbacPolicy;
import com.example.authz.abac.model.PolicyEffect;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for ABAC evaluation and the configuration-backed policy store.
 *
 * @param strictNumericComparison treat missing/non-numeric operands of gt/gte/lt/lte as a non-match
 *                                instead of coercing them to 0
 * @param conditionCache          parsed condition cache sizing
 * @param policies                policies served by the in-memory store
 */
@ConfigurationProperties(prefix = "abac")
public record AbacPolicyProperties(
        boolean strictNumericComparison,
        ConditionCacheProperties conditionCache,
        List<PolicyDefinition> policies
) {

    public AbacPolicyProperties {
        if (conditionCache == null) conditionCache = new ConditionCacheProperties(0, null);
        if (policies == null) policies = List.of();
    }

    public record ConditionCacheProperties(long maxSize, Duration ttl) {
        public ConditionCacheProperties {
            if (maxSize <= 0) maxSize = 1000;
            if (ttl == null) ttl = Duration.ofMinutes(10);
        }
    }

    public record PolicyDefinition(
            String id,
            String name,
            PolicyEffect effect,
            String condition,
            Boolean active,
            long version
    ) {
        public PolicyDefinition {
            if (active == null) active = true;
        }

        public AbacPolicy toPolicy() {
            return AbacPolicy.builder()
                    .id(id)
                    .name(name)
                    .effect(effect)
                    .condition(condition)
                    .active(active)
                    .version(version)
                    .build();
        }
    }
}
