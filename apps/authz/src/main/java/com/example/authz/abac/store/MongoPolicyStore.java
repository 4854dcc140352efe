package com.example.authz.abac.store;

import com.example.authz.abac.model.AbacPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Policy store backed by the {@code abac_policies} MongoDB collection.
 * Enabled with {@code abac.store=mongo}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "abac.store", havingValue = "mongo")
public class MongoPolicyStore implements PolicyStore {

    private final AbacPolicyRepository repository;

    @Override
    public Flux<AbacPolicy> findActivePolicies() {
        return repository.findByActiveTrueOrderByNameAsc()
                .map(AbacPolicyDoc::toPolicy)
                .onErrorMap(e -> !(e instanceof PolicyStoreException), e -> {
                    log.error("Failed to load ABAC policies from MongoDB: {}", e.getMessage());
                    return new PolicyStoreException("Failed to load ABAC policies", e);
                });
    }
}
