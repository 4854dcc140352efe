package com.example.authz.authz.service;

import java.util.List;

/**
 * Outcome of a permission check. The reason and matched policy names are for audit logs only.
 */
public record AuthorizationResult(
        boolean allowed,
        String reason,
        List<String> matchedPolicies
) {
    public AuthorizationResult {
        matchedPolicies = matchedPolicies != null ? List.copyOf(matchedPolicies) : List.of();
    }

    public static AuthorizationResult allow(String reason) {
        return new AuthorizationResult(true, reason, List.of());
    }

    public static AuthorizationResult deny(String reason) {
        return new AuthorizationResult(false, reason, List.of());
    }

    public static AuthorizationResult allow(String reason, List<String> matchedPolicies) {
        return new AuthorizationResult(true, reason, matchedPolicies);
    }

    public static AuthorizationResult deny(String reason, List<String> matchedPolicies) {
        return new AuthorizationResult(false, reason, matchedPolicies);
    }
}
