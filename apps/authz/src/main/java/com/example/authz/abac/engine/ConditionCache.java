package com.example.authz.abac.engine;

import com.example.authz.abac.condition.ConditionNode;
import com.example.authz.abac.condition.ConditionParser;
import com.example.authz.abac.event.PolicyChangedEvent;
import com.example.authz.abac.model.AbacPolicy;
import com.example.authz.common.util.StringSanitizer;
import com.example.authz.observability.metrics.AuthzMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.lang.NonNull;

import java.time.Duration;
import java.util.Objects;

/**
 * Caffeine cache of parsed condition trees.
 *
 * <p>Entries are keyed by policy name, version and condition text, so an edited policy never
 * reuses a stale tree even before its {@link PolicyChangedEvent} arrives.
 */
@Slf4j
public class ConditionCache {

    private final Cache<CacheKey, ConditionNode> cache;
    private final ConditionParser parser;
    private final AuthzMetrics metrics;

    public ConditionCache(ConditionParser parser, AuthzMetrics metrics, long maxSize, Duration ttl) {
        this.parser = parser;
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .build();

        log.info("Condition cache initialized: maxSize={}, ttl={}", maxSize, ttl);
    }

    @NonNull
    public ConditionNode get(@NonNull AbacPolicy policy) {
        CacheKey key = CacheKey.of(policy);
        ConditionNode cached = cache.getIfPresent(key);
        if (cached != null) {
            metrics.recordConditionCacheHit();
            return cached;
        }

        metrics.recordConditionCacheMiss();
        return cache.get(key, k -> parser.parse(policy.condition()));
    }

    @EventListener
    public void onPolicyChanged(PolicyChangedEvent event) {
        if (event.affectsAll()) {
            invalidateAll();
        } else {
            invalidate(event.policyName());
        }
    }

    public void invalidate(@NonNull String policyName) {
        cache.asMap().keySet().removeIf(key -> key.policyName().equals(policyName));
        log.debug("Evicted parsed conditions for policy {}", StringSanitizer.forLog(policyName));
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Evicted all parsed conditions");
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    record CacheKey(String policyName, long version, String condition) {
        static CacheKey of(AbacPolicy policy) {
            return new CacheKey(
                    Objects.requireNonNullElse(policy.name(), ""),
                    policy.version(),
                    Objects.requireNonNullElse(policy.condition(), ""));
        }
    }
}
