package com.example.authz.authz.audit;

import com.example.authz.authz.service.AuthorizationRequest;
import com.example.authz.authz.service.AuthorizationResult;
import com.example.authz.common.util.StringSanitizer;
import com.example.authz.security.principal.Principal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

/**
 * Service for publishing authorization audit events in structured JSON format.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.authz.audit.enabled", havingValue = "true", matchIfMissing = true)
public class AuthzAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private final ObjectMapper objectMapper;

    public void logDecision(
            @NonNull Principal principal,
            @NonNull AuthorizationRequest request,
            @NonNull AuthorizationResult result) {

        logEvent(AuthzAuditEvent.from(principal, request, result));
    }

    public void logError(
            @NonNull Principal principal,
            @NonNull AuthorizationRequest request,
            @NonNull String errorReason) {

        logEvent(AuthzAuditEvent.error(principal, request, errorReason));
    }

    private void logEvent(@NonNull AuthzAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logByOutcome(AuthzAuditEvent.Outcome outcome, String json) {
        switch (outcome) {
            case ALLOW -> AUDIT_LOG.info(json);
            case DENY -> AUDIT_LOG.warn(json);
            case ERROR -> AUDIT_LOG.error(json);
        }
    }

    private void logFallback(@NonNull AuthzAuditEvent event) {
        AUDIT_LOG.warn("AuthZ {} - type={}, user={}, service={}, permission={}, resource={}/{}, reason={}",
                event.outcome(),
                event.principalType(),
                StringSanitizer.forLog(event.userId()),
                StringSanitizer.forLog(event.serviceId()),
                StringSanitizer.forLog(event.permission()),
                StringSanitizer.forLog(event.resourceType()),
                StringSanitizer.forLog(event.resourceId()),
                StringSanitizer.forLog(event.reason()));
    }
}
