package com.example.authz.authz.service;

import com.example.authz.abac.model.AbacEvaluationResult;
import com.example.authz.abac.service.AbacEvaluationService;
import com.example.authz.abac.store.PolicyStoreException;
import com.example.authz.authz.audit.AuthzAuditService;
import com.example.authz.common.util.StringSanitizer;
import com.example.authz.config.AbacCombiningMode;
import com.example.authz.config.AuthzProperties;
import com.example.authz.observability.metrics.AuthzMetrics;
import com.example.authz.security.exception.AuthenticationRequiredException;
import com.example.authz.security.exception.AuthorizationDeniedException;
import com.example.authz.security.principal.CombinedPrincipal;
import com.example.authz.security.principal.Principal;
import com.example.authz.security.principal.ServicePrincipal;
import com.example.authz.security.principal.UserPrincipal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Authorizes users, services and services acting on behalf of users against one permission vocabulary.
 *
 * <ul>
 *   <li>User: the permission must be in the user's RBAC-resolved permissions</li>
 *   <li>Service: a direct grant must match the permission and, for scoped grants, the resource scope</li>
 *   <li>Service with user: both checks must pass</li>
 * </ul>
 *
 * <p>ABAC policies are layered on each checked principal according to {@link AbacCombiningMode};
 * a matching DENY policy always wins. If policies cannot be loaded the check fails closed.
 */
@Slf4j
@Service
public class AuthorizationService {

    static final String REASON_ABAC_ALLOWED = "Access granted: RBAC allowed, ABAC allowed";
    static final String REASON_NO_POLICY_MATCHED = "Access granted: RBAC allowed, no policies matched";
    static final String REASON_ABAC_DENIED = "Access denied: ABAC policy explicitly denies access";
    static final String REASON_ABAC_GRANTED = "Access granted: ABAC allowed";
    static final String REASON_POLICIES_UNAVAILABLE = "Access denied: ABAC policies unavailable";

    private final AbacEvaluationService abacEvaluationService;
    private final AuthzProperties properties;
    private final AuthzMetrics metrics;
    private final ObjectProvider<AuthzAuditService> auditService;

    public AuthorizationService(
            AbacEvaluationService abacEvaluationService,
            AuthzProperties properties,
            AuthzMetrics metrics,
            ObjectProvider<AuthzAuditService> auditService) {
        this.abacEvaluationService = abacEvaluationService;
        this.properties = properties;
        this.metrics = metrics;
        this.auditService = auditService;

        log.info("Authorization service initialized: abacEnabled={}, combiningMode={}",
                properties.abacEnabled(), properties.combiningMode());
    }

    /**
     * Require a permission. Completes empty when allowed.
     *
     * @throws AuthenticationRequiredException (as error signal) when there is no principal
     * @throws AuthorizationDeniedException    (as error signal) when the permission is denied
     */
    @NonNull
    public Mono<Void> authorize(@Nullable Principal principal, @NonNull String permission) {
        return authorize(principal, AuthorizationRequest.of(permission));
    }

    @NonNull
    public Mono<Void> authorize(@Nullable Principal principal, @NonNull AuthorizationRequest request) {
        return check(principal, request)
                .flatMap(result -> {
                    if (result.allowed()) {
                        return Mono.empty();
                    }
                    String message = principal.displayName() + " lacks permission '" + request.permission() + "'";
                    log.warn("Authorization denied: {}: {}", StringSanitizer.forLog(message, 256), result.reason());
                    return Mono.error(new AuthorizationDeniedException(message, request.permission(), result.reason()));
                });
    }

    /**
     * Evaluate a permission check without raising on denial.
     */
    @NonNull
    public Mono<AuthorizationResult> check(@Nullable Principal principal, @NonNull AuthorizationRequest request) {
        if (principal == null) {
            return Mono.error(new AuthenticationRequiredException("Authentication required"));
        }

        Mono<AuthorizationResult> decision;
        if (principal instanceof CombinedPrincipal combined) {
            decision = checkCombined(combined, request);
        } else if (principal instanceof ServicePrincipal service) {
            decision = checkService(service, request);
        } else {
            decision = checkUser((UserPrincipal) principal, request);
        }

        return decision
                .onErrorResume(PolicyStoreException.class, e -> {
                    log.error("ABAC unavailable, denying {} for {}",
                            StringSanitizer.forLog(request.permission()),
                            StringSanitizer.forLog(principal.displayName(), 256));
                    auditService.ifAvailable(audit -> audit.logError(principal, request, e.getMessage()));
                    return Mono.just(AuthorizationResult.deny(REASON_POLICIES_UNAVAILABLE));
                })
                .doOnNext(result -> {
                    metrics.recordAuthorizationCheck(result.allowed(), principal.principalType().name());
                    auditService.ifAvailable(audit -> audit.logDecision(principal, request, result));
                });
    }

    private Mono<AuthorizationResult> checkUser(UserPrincipal user, AuthorizationRequest request) {
        boolean granted = user.hasPermission(request.permission());
        String flatReason = granted
                ? "User has permission '" + request.permission() + "'"
                : "User does not have permission '" + request.permission() + "'";
        return applyAbac(user, granted, flatReason, request);
    }

    private Mono<AuthorizationResult> checkService(ServicePrincipal service, AuthorizationRequest request) {
        boolean granted = service.hasPermission(request.permission(), request.resourceScope());
        String flatReason = granted
                ? "Service has permission '" + request.permission() + "'"
                : "Service does not have permission '" + request.permission() + "'";
        return applyAbac(service, granted, flatReason, request);
    }

    private Mono<AuthorizationResult> checkCombined(CombinedPrincipal combined, AuthorizationRequest request) {
        return Mono.zip(
                        checkService(combined.servicePrincipal(), request),
                        checkUser(combined.userPrincipal(), request))
                .map(results -> {
                    AuthorizationResult serviceResult = results.getT1();
                    AuthorizationResult userResult = results.getT2();
                    if (!serviceResult.allowed()) {
                        return AuthorizationResult.deny(
                                "Service permission denied: " + serviceResult.reason(),
                                serviceResult.matchedPolicies());
                    }
                    if (!userResult.allowed()) {
                        return AuthorizationResult.deny(
                                "User permission denied: " + userResult.reason(),
                                userResult.matchedPolicies());
                    }
                    return AuthorizationResult.allow(
                            "Both service and user have permission '" + request.permission() + "'",
                            userResult.matchedPolicies());
                });
    }

    private Mono<AuthorizationResult> applyAbac(
            Principal principal, boolean flatGranted, String flatReason, AuthorizationRequest request) {

        if (!properties.abacEnabled()) {
            return Mono.just(new AuthorizationResult(flatGranted, flatReason, null));
        }

        boolean vetoOnly = properties.combiningMode() == AbacCombiningMode.VETO_ONLY;
        if (vetoOnly && !flatGranted) {
            return Mono.just(AuthorizationResult.deny(flatReason));
        }

        return abacEvaluationService.evaluatePolicies(
                        subjectAttributes(principal, request),
                        resourceAttributes(request),
                        request.contextAttributes().isEmpty() ? null : request.contextAttributes())
                .map(abac -> combine(flatGranted, flatReason, abac));
    }

    private static AuthorizationResult combine(boolean flatGranted, String flatReason, AbacEvaluationResult abac) {
        if (abac.isDenied()) {
            return AuthorizationResult.deny(REASON_ABAC_DENIED, abac.matchedPolicyNames());
        }
        if (abac.isAllowed()) {
            return AuthorizationResult.allow(
                    flatGranted ? REASON_ABAC_ALLOWED : REASON_ABAC_GRANTED, abac.matchedPolicyNames());
        }
        return flatGranted
                ? AuthorizationResult.allow(REASON_NO_POLICY_MATCHED)
                : AuthorizationResult.deny(flatReason);
    }

    private static Map<String, Object> subjectAttributes(Principal principal, AuthorizationRequest request) {
        Map<String, Object> subject = new HashMap<>();
        subject.put("principalType", principal.principalType().name());
        if (principal instanceof UserPrincipal user) {
            subject.put("userId", user.userId());
            subject.put("permissions", user.permissions());
        } else if (principal instanceof ServicePrincipal service) {
            subject.put("serviceId", service.serviceId());
            subject.put("permissions", service.grants().stream()
                    .map(grant -> grant.permission())
                    .distinct()
                    .toList());
        }
        subject.putAll(request.subjectAttributes());
        return subject;
    }

    @Nullable
    private static Map<String, Object> resourceAttributes(AuthorizationRequest request) {
        Map<String, Object> resource = new HashMap<>();
        if (request.resourceType() != null) {
            resource.put("type", request.resourceType());
        }
        if (request.resourceId() != null) {
            resource.put("id", request.resourceId());
        }
        resource.putAll(request.resourceAttributes());
        return resource.isEmpty() ? null : resource;
    }
}
