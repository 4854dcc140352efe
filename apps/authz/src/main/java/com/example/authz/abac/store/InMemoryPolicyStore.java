package com.example.authz.abac.store;

import com.example.authz.abac.config.AbacPolicyProperties;
import com.example.authz.abac.model.AbacPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Policy store backed by the {@code abac.policies} configuration list.
 * Default store when {@code abac.store} is not set.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "abac.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryPolicyStore implements PolicyStore {

    private final List<AbacPolicy> policies;

    @Autowired
    public InMemoryPolicyStore(AbacPolicyProperties properties) {
        this(properties.policies().stream()
                .map(AbacPolicyProperties.PolicyDefinition::toPolicy)
                .toList());
    }

    public InMemoryPolicyStore(List<AbacPolicy> policies) {
        this.policies = List.copyOf(policies);

        log.info("Loaded {} ABAC policies from configuration ({} active)",
                this.policies.size(), this.policies.stream().filter(AbacPolicy::active).count());
        this.policies.forEach(p -> log.debug("  - {} ({}, active={})", p.name(), p.effect(), p.active()));
    }

    @Override
    public Flux<AbacPolicy> findActivePolicies() {
        return Flux.fromIterable(policies)
                .filter(AbacPolicy::active);
    }
}
