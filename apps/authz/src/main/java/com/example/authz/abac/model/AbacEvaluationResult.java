package com.example.authz.abac.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Outcome of evaluating all active ABAC policies for one request.
 *
 * @param decision        ALLOW, DENY, or {@code null} when no policy matched (ABAC offers no opinion)
 * @param matchedPolicies every policy whose condition matched, in store order
 * @param reason          short summary for audit logs and admin tooling, never for untrusted clients
 */
public record AbacEvaluationResult(
        @Nullable PolicyEffect decision,
        List<AbacPolicy> matchedPolicies,
        String reason
) {
    public static final String REASON_DENY = "Access denied by ABAC policy";
    public static final String REASON_ALLOW = "Access allowed by ABAC policy";
    public static final String REASON_NO_MATCH = "No matching ABAC policies";

    public AbacEvaluationResult {
        matchedPolicies = matchedPolicies != null ? List.copyOf(matchedPolicies) : List.of();
    }

    public static AbacEvaluationResult noMatch() {
        return new AbacEvaluationResult(null, List.of(), REASON_NO_MATCH);
    }

    public boolean isDenied() {
        return decision == PolicyEffect.DENY;
    }

    public boolean isAllowed() {
        return decision == PolicyEffect.ALLOW;
    }

    public boolean hasDecision() {
        return decision != null;
    }

    public List<String> matchedPolicyNames() {
        return matchedPolicies.stream().map(AbacPolicy::name).toList();
    }
}
