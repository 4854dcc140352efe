package com.example.authz.abac.config;

import com.example.authz.abac.condition.ConditionEvaluator;
import com.example.authz.abac.condition.ConditionParser;
import com.example.authz.abac.engine.ConditionCache;
import com.example.authz.observability.metrics.AuthzMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the condition evaluator and parsed-condition cache from {@code abac.*} settings.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AbacPolicyProperties.class)
public class AbacPolicyConfig {

    @Bean
    public ConditionEvaluator conditionEvaluator(AbacPolicyProperties properties) {
        if (properties.strictNumericComparison()) {
            log.info("ABAC strict numeric comparison enabled");
        }
        return new ConditionEvaluator(properties.strictNumericComparison());
    }

    @Bean
    public ConditionCache conditionCache(ConditionParser parser, AuthzMetrics metrics,
                                         AbacPolicyProperties properties) {
        AbacPolicyProperties.ConditionCacheProperties cache = properties.conditionCache();
        return new ConditionCache(parser, metrics, cache.maxSize(), cache.ttl());
    }
}
