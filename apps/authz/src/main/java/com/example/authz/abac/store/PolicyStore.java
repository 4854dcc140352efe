package com.example.authz.abac.store;

import com.example.authz.abac.model.AbacPolicy;
import reactor.core.publisher.Flux;

/**
 * Read-only source of ABAC policies.
 *
 * <p>Implementations emit a consistent snapshot per subscription. A failure to read policies is
 * signalled as {@link PolicyStoreException}, never as an empty flux.
 */
public interface PolicyStore {

    /**
     * Active policies in a stable order.
     */
    Flux<AbacPolicy> findActivePolicies();
}
