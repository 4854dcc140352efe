package com.example.authz.abac.store;

import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import reactor.core.publisher.Flux;

/**
 * Reactive MongoDB repository for ABAC policies.
 */
public interface AbacPolicyRepository extends ReactiveMongoRepository<AbacPolicyDoc, String> {

    /**
     * Active policies ordered by name, so evaluation order is stable between reads.
     */
    Flux<AbacPolicyDoc> findByActiveTrueOrderByNameAsc();
}
