package com.example.authz.authz.audit;

import com.example.authz.authz.service.AuthorizationRequest;
import com.example.authz.authz.service.AuthorizationResult;
import com.example.authz.security.principal.Principal;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for authorization decisions.
 */
public record AuthzAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,

        // Decision
        Outcome outcome,
        String reason,
        List<String> matchedPolicies,

        // Principal
        String principalType,
        String userId,
        String serviceId,

        // Request
        String permission,
        String resourceType,
        String resourceId
) {
    public enum Outcome {
        ALLOW, DENY, ERROR
    }

    public static AuthzAuditEvent from(Principal principal, AuthorizationRequest request, AuthorizationResult result) {
        return new AuthzAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                result.allowed() ? Outcome.ALLOW : Outcome.DENY,
                result.reason(),
                result.matchedPolicies(),
                principal.principalType().name(),
                principal.userId(),
                principal.serviceId(),
                request.permission(),
                request.resourceType(),
                request.resourceId()
        );
    }

    public static AuthzAuditEvent error(Principal principal, AuthorizationRequest request, String errorReason) {
        return new AuthzAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                Outcome.ERROR,
                errorReason,
                List.of(),
                principal.principalType().name(),
                principal.userId(),
                principal.serviceId(),
                request.permission(),
                request.resourceType(),
                request.resourceId()
        );
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "authz_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("outcome", outcome.name()),
                Map.entry("reason", reason != null ? reason : ""),
                Map.entry("matched_policies", matchedPolicies != null ? matchedPolicies : List.of()),
                Map.entry("principal_type", principalType != null ? principalType : ""),
                Map.entry("user_id", userId != null ? userId : ""),
                Map.entry("service_id", serviceId != null ? serviceId : ""),
                Map.entry("permission", permission != null ? permission : ""),
                Map.entry("resource_type", resourceType != null ? resourceType : ""),
                Map.entry("resource_id", resourceId != null ? resourceId : "")
        );
    }
}
