package com.example.authz.authz.model.request;

/**
 * @param policyName policy to evict, or {@code null} to evict every parsed condition
 */
public record ConditionCacheEvictRequest(
        String policyName
) {}
