package com.example.authz.abac.service;

import com.example.authz.abac.engine.PolicyDecisionEngine;
import com.example.authz.abac.model.AbacEvaluationResult;
import com.example.authz.abac.model.EvaluationContext;
import com.example.authz.abac.store.PolicyStore;
import com.example.authz.abac.store.PolicyStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Entry point for ABAC evaluation.
 * Reads the active policy snapshot once per request and delegates to {@link PolicyDecisionEngine}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AbacEvaluationService {

    private final PolicyStore policyStore;
    private final PolicyDecisionEngine decisionEngine;

    /**
     * Evaluate all active policies.
     *
     * @param subjectAttributes  caller attributes, exposed as {@code subject.*}
     * @param resourceAttributes target attributes, exposed as {@code resource.*}; may be null
     * @param contextAttributes  environment attributes, exposed as {@code context.*}; may be null
     * @return the combined decision; errors with {@link PolicyStoreException} when policies cannot be read
     */
    @NonNull
    public Mono<AbacEvaluationResult> evaluatePolicies(
            @Nullable Map<String, ?> subjectAttributes,
            @Nullable Map<String, ?> resourceAttributes,
            @Nullable Map<String, ?> contextAttributes) {

        return Mono.fromCallable(() -> EvaluationContext.of(subjectAttributes, resourceAttributes, contextAttributes))
                .flatMap(context -> policyStore.findActivePolicies()
                        .collectList()
                        .onErrorMap(e -> !(e instanceof PolicyStoreException),
                                e -> new PolicyStoreException("Failed to load ABAC policies", e))
                        .map(policies -> decisionEngine.evaluate(policies, context)))
                .doOnError(PolicyStoreException.class,
                        e -> log.error("ABAC evaluation aborted: {}", e.getMessage()));
    }

    @NonNull
    public Mono<AbacEvaluationResult> evaluatePolicies(@Nullable Map<String, ?> subjectAttributes) {
        return evaluatePolicies(subjectAttributes, null, null);
    }
}
