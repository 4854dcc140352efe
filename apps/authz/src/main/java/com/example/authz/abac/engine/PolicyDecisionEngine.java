package com.example.authz.abac.engine;

import com.example.authz.abac.condition.ConditionEvaluator;
import com.example.authz.abac.condition.ConditionNode;
import com.example.authz.abac.model.AbacEvaluationResult;
import com.example.authz.abac.model.AbacPolicy;
import com.example.authz.abac.model.EvaluationContext;
import com.example.authz.abac.model.PolicyEffect;
import com.example.authz.common.util.StringSanitizer;
import com.example.authz.observability.metrics.AuthzMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * ABAC decision engine - evaluates a policy snapshot against one evaluation context.
 *
 * <p>Combining algorithm: deny-overrides
 * - Every active policy is evaluated, in store order
 * - Any matching DENY policy makes the result DENY
 * - Otherwise any matching ALLOW policy makes the result ALLOW
 * - If nothing matches, there is no decision
 *
 * <p>A policy that fails to parse or throws during evaluation is logged and treated as a non-match;
 * it never aborts evaluation of the remaining policies.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PolicyDecisionEngine {

    private final ConditionCache conditionCache;
    private final ConditionEvaluator conditionEvaluator;
    private final AuthzMetrics metrics;

    @NonNull
    public AbacEvaluationResult evaluate(@NonNull List<AbacPolicy> policies, @NonNull EvaluationContext context) {
        List<AbacPolicy> matched = new ArrayList<>();
        boolean denied = false;
        boolean allowed = false;

        for (AbacPolicy policy : policies) {
            if (!policy.active()) {
                continue;
            }
            if (!matches(policy, context)) {
                continue;
            }

            matched.add(policy);
            if (policy.isDeny()) {
                denied = true;
            } else if (policy.isAllow()) {
                allowed = true;
            }
        }

        AbacEvaluationResult result;
        if (denied) {
            result = new AbacEvaluationResult(PolicyEffect.DENY, matched, AbacEvaluationResult.REASON_DENY);
        } else if (allowed) {
            result = new AbacEvaluationResult(PolicyEffect.ALLOW, matched, AbacEvaluationResult.REASON_ALLOW);
        } else {
            result = new AbacEvaluationResult(null, matched, AbacEvaluationResult.REASON_NO_MATCH);
        }

        metrics.recordAbacDecision(result.hasDecision() ? result.isAllowed() : null);
        log.debug("ABAC evaluation: decision={}, matched={}", result.decision(), result.matchedPolicyNames());
        return result;
    }

    private boolean matches(AbacPolicy policy, EvaluationContext context) {
        try {
            ConditionNode condition = conditionCache.get(policy);
            if (condition instanceof ConditionNode.Never never) {
                log.warn("Skipping ABAC policy {}: {}", StringSanitizer.forLog(policy.name()), never.reason());
                metrics.recordPolicyError();
                return false;
            }
            return conditionEvaluator.evaluate(condition, context);
        } catch (RuntimeException e) {
            // condition text stays out of the log
            log.error("Error evaluating ABAC policy {}: {}",
                    StringSanitizer.forLog(policy.name()), e.getClass().getSimpleName());
            metrics.recordPolicyError();
            return false;
        }
    }
}
