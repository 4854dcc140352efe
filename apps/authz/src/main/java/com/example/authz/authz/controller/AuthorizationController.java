package com.example.authz.authz.controller;

import com.example.authz.abac.event.PolicyChangedEvent;
import com.example.authz.abac.service.AbacEvaluationService;
import com.example.authz.authz.annotation.RequiresPermission;
import com.example.authz.authz.model.request.AbacEvaluateRequest;
import com.example.authz.authz.model.request.ConditionCacheEvictRequest;
import com.example.authz.authz.model.request.PermissionCheckRequest;
import com.example.authz.authz.model.response.AbacEvaluateResponse;
import com.example.authz.authz.model.response.PermissionCheckResponse;
import com.example.authz.authz.service.AuthorizationRequest;
import com.example.authz.authz.service.AuthorizationService;
import com.example.authz.common.util.StringSanitizer;
import com.example.authz.security.context.PrincipalContextHolder;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/authz")
@RequiredArgsConstructor
public class AuthorizationController {

    public static final String PERMISSION_ABAC_EVALUATE = "security:abac:evaluate";
    public static final String PERMISSION_ABAC_MANAGE = "security:abac:manage";

    private final AuthorizationService authorizationService;
    private final AbacEvaluationService abacEvaluationService;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Lets the caller check one of its own permissions. Only the outcome is returned; the reason
     * stays in the audit log.
     */
    @PostMapping("/check")
    public Mono<PermissionCheckResponse> checkPermission(@Valid @RequestBody PermissionCheckRequest request) {
        log.debug("POST /check - permission: {}", StringSanitizer.forLog(request.permission()));

        AuthorizationRequest authzRequest = AuthorizationRequest.builder()
                .permission(request.permission())
                .resourceType(request.resourceType())
                .resourceId(request.resourceId())
                .resourceScope(request.resourceScope())
                .resourceAttributes(request.resourceAttributes())
                .contextAttributes(request.contextAttributes())
                .build();

        return PrincipalContextHolder.getPrincipal()
                .flatMap(principal -> authorizationService.check(principal, authzRequest))
                .map(result -> new PermissionCheckResponse(request.permission(), result.allowed()));
    }

    @PostMapping("/abac/evaluate")
    @RequiresPermission(value = PERMISSION_ABAC_EVALUATE, resourceType = "abac_policy")
    public Mono<AbacEvaluateResponse> evaluate(@RequestBody AbacEvaluateRequest request) {
        log.debug("POST /abac/evaluate");
        return abacEvaluationService.evaluatePolicies(request.subject(), request.resource(), request.context())
                .map(AbacEvaluateResponse::from);
    }

    @PostMapping("/abac/cache/evict")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @RequiresPermission(value = PERMISSION_ABAC_MANAGE, resourceType = "abac_policy")
    public Mono<Void> evictConditionCache(@RequestBody(required = false) ConditionCacheEvictRequest request) {
        PolicyChangedEvent event = request == null || request.policyName() == null || request.policyName().isBlank()
                ? PolicyChangedEvent.all()
                : PolicyChangedEvent.of(request.policyName());

        log.info("POST /abac/cache/evict - policy: {}",
                event.affectsAll() ? "*" : StringSanitizer.forLog(event.policyName()));
        return Mono.fromRunnable(() -> eventPublisher.publishEvent(event));
    }
}
