package com.example.authz.authz.model.response;

import com.example.authz.abac.model.AbacEvaluationResult;

import java.util.List;

public record AbacEvaluateResponse(
        String decision,
        List<String> matchedPolicies,
        String reason
) {
    public static AbacEvaluateResponse from(AbacEvaluationResult result) {
        return new AbacEvaluateResponse(
                result.hasDecision() ? result.decision().name() : null,
                result.matchedPolicyNames(),
                result.reason()
        );
    }
}
