package com.example.authz.authz.service;

import com.example.authz.abac.model.AbacEvaluationResult;
import com.example.authz.abac.model.PolicyEffect;
import com.example.authz.abac.service.AbacEvaluationService;
import com.example.authz.abac.store.PolicyStoreException;
import com.example.authz.authz.audit.AuthzAuditService;
import com.example.authz.config.AbacCombiningMode;
import com.example.authz.config.AuthzProperties;
import com.example.authz.observability.metrics.AuthzMetrics;
import com.example.authz.security.exception.AuthenticationRequiredException;
import com.example.authz.security.exception.AuthorizationDeniedException;
import com.example.authz.security.principal.CombinedPrincipal;
import com.example.authz.security.principal.JwtPrincipalDecoder;
import com.example.authz.security.principal.Principal;
import com.example.authz.security.principal.ServicePermissionGrant;
import com.example.authz.security.principal.ServicePrincipal;
import com.example.authz.security.principal.UserPrincipal;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.authz.util.AbacPolicyTestBuilder.aDenyPolicy;
import static com.example.authz.util.AbacPolicyTestBuilder.anAllowPolicy;
import static com.example.authz.util.TokenClaimsTestBuilder.aServiceToken;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthorizationService")
class AuthorizationServiceTest {

    private static final String PERMISSION = "security:group:save";

    private static final AbacEvaluationResult ABAC_ALLOW = new AbacEvaluationResult(
            PolicyEffect.ALLOW, List.of(anAllowPolicy("allow-owner", "{\"and\": []}")),
            AbacEvaluationResult.REASON_ALLOW);
    private static final AbacEvaluationResult ABAC_DENY = new AbacEvaluationResult(
            PolicyEffect.DENY, List.of(aDenyPolicy("deny-suspended", "{\"and\": []}")),
            AbacEvaluationResult.REASON_DENY);

    @Mock
    private AbacEvaluationService abacEvaluationService;

    @Mock
    private ObjectProvider<AuthzAuditService> auditService;

    private SimpleMeterRegistry registry;
    private AuthorizationService service;

    private final UserPrincipal permittedUser = new UserPrincipal("user-1", Set.of(PERMISSION), Map.of());
    private final UserPrincipal unprivilegedUser = new UserPrincipal("user-2", Set.of("security:group:view"), Map.of());

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = serviceWith(new AuthzProperties(true, AbacCombiningMode.VETO_ONLY));
    }

    private AuthorizationService serviceWith(AuthzProperties properties) {
        return new AuthorizationService(abacEvaluationService, properties, new AuthzMetrics(registry), auditService);
    }

    private void givenAbac(AbacEvaluationResult result) {
        when(abacEvaluationService.evaluatePolicies(any(), any(), any())).thenReturn(Mono.just(result));
    }

    @Test
    @DisplayName("should require authentication when there is no principal")
    void shouldRequirePrincipal() {
        StepVerifier.create(service.authorize(null, PERMISSION))
                .expectError(AuthenticationRequiredException.class)
                .verify();

        verifyNoInteractions(abacEvaluationService);
    }

    @Nested
    @DisplayName("user principals")
    class UserPrincipals {

        @Test
        @DisplayName("should allow a granted permission when no policy matches")
        void shouldAllowWithoutPolicies() {
            givenAbac(AbacEvaluationResult.noMatch());

            StepVerifier.create(service.check(permittedUser, AuthorizationRequest.of(PERMISSION)))
                    .assertNext(result -> {
                        assertThat(result.allowed()).isTrue();
                        assertThat(result.reason()).isEqualTo("Access granted: RBAC allowed, no policies matched");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should allow when an ABAC ALLOW policy matches")
        void shouldAllowWithAbacAllow() {
            givenAbac(ABAC_ALLOW);

            StepVerifier.create(service.check(permittedUser, AuthorizationRequest.of(PERMISSION)))
                    .assertNext(result -> {
                        assertThat(result.allowed()).isTrue();
                        assertThat(result.reason()).isEqualTo("Access granted: RBAC allowed, ABAC allowed");
                        assertThat(result.matchedPolicies()).containsExactly("allow-owner");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny a missing permission without consulting ABAC")
        void shouldDenyMissingPermission() {
            StepVerifier.create(service.check(unprivilegedUser, AuthorizationRequest.of(PERMISSION)))
                    .assertNext(result -> {
                        assertThat(result.allowed()).isFalse();
                        assertThat(result.reason()).isEqualTo("User does not have permission '" + PERMISSION + "'");
                    })
                    .verifyComplete();

            verifyNoInteractions(abacEvaluationService);
        }

        @Test
        @DisplayName("should let an ABAC DENY policy veto a granted permission")
        void shouldVetoWithAbacDeny() {
            givenAbac(ABAC_DENY);

            StepVerifier.create(service.check(permittedUser, AuthorizationRequest.of(PERMISSION)))
                    .assertNext(result -> {
                        assertThat(result.allowed()).isFalse();
                        assertThat(result.reason()).isEqualTo("Access denied: ABAC policy explicitly denies access");
                        assertThat(result.matchedPolicies()).containsExactly("deny-suspended");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should raise AuthorizationDeniedException naming user and permission")
        void shouldRaiseDenied() {
            StepVerifier.create(service.authorize(unprivilegedUser, PERMISSION))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(AuthorizationDeniedException.class)
                            .hasMessage("User user-2 lacks permission '" + PERMISSION + "'"))
                    .verify();
        }

        @Test
        @DisplayName("should complete empty when authorized")
        void shouldCompleteWhenAuthorized() {
            givenAbac(AbacEvaluationResult.noMatch());

            StepVerifier.create(service.authorize(permittedUser, PERMISSION))
                    .verifyComplete();

            assertThat(registry.counter("authz.check", "outcome", "allowed", "principal_type", "user").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should pass principal and request attributes to ABAC")
        @SuppressWarnings("unchecked")
        void shouldBuildAbacAttributes() {
            givenAbac(AbacEvaluationResult.noMatch());
            AuthorizationRequest request = AuthorizationRequest.builder()
                    .permission(PERMISSION)
                    .resourceType("group")
                    .resourceId("g-42")
                    .subjectAttributes(Map.of("roles", List.of("owner")))
                    .contextAttributes(Map.of("channel", "web"))
                    .build();

            StepVerifier.create(service.check(permittedUser, request))
                    .expectNextCount(1)
                    .verifyComplete();

            ArgumentCaptor<Map<String, Object>> subject = ArgumentCaptor.forClass(Map.class);
            ArgumentCaptor<Map<String, Object>> resource = ArgumentCaptor.forClass(Map.class);
            ArgumentCaptor<Map<String, Object>> context = ArgumentCaptor.forClass(Map.class);
            verify(abacEvaluationService).evaluatePolicies(subject.capture(), resource.capture(), context.capture());

            assertThat(subject.getValue())
                    .containsEntry("userId", "user-1")
                    .containsEntry("principalType", "USER")
                    .containsEntry("roles", List.of("owner"))
                    .containsKey("permissions");
            assertThat(resource.getValue())
                    .containsEntry("type", "group")
                    .containsEntry("id", "g-42");
            assertThat(context.getValue()).containsEntry("channel", "web");
        }
    }

    @Nested
    @DisplayName("service principals")
    class ServicePrincipals {

        @Test
        @DisplayName("should allow a global grant")
        void shouldAllowGlobalGrant() {
            givenAbac(AbacEvaluationResult.noMatch());
            ServicePrincipal billing = new ServicePrincipal("billing",
                    Set.of(ServicePermissionGrant.global(PERMISSION)), Map.of());

            StepVerifier.create(service.check(billing, AuthorizationRequest.of(PERMISSION)))
                    .assertNext(result -> assertThat(result.allowed()).isTrue())
                    .verifyComplete();
        }

        @Test
        @DisplayName("should only allow a scoped grant inside its resource scope")
        void shouldEnforceScopedGrant() {
            givenAbac(AbacEvaluationResult.noMatch());
            ServicePrincipal billing = new ServicePrincipal("billing",
                    Set.of(ServicePermissionGrant.scoped(PERMISSION, "tenants/acme/**")), Map.of());

            AuthorizationRequest inScope = AuthorizationRequest.builder()
                    .permission(PERMISSION).resourceScope("tenants/acme/groups/1").build();
            AuthorizationRequest outOfScope = AuthorizationRequest.builder()
                    .permission(PERMISSION).resourceScope("tenants/globex/groups/1").build();

            StepVerifier.create(service.check(billing, inScope))
                    .assertNext(result -> assertThat(result.allowed()).isTrue())
                    .verifyComplete();
            StepVerifier.create(service.check(billing, outOfScope))
                    .assertNext(result -> {
                        assertThat(result.allowed()).isFalse();
                        assertThat(result.reason()).isEqualTo("Service does not have permission '" + PERMISSION + "'");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should raise AuthorizationDeniedException naming the service")
        void shouldRaiseDenied() {
            ServicePrincipal billing = new ServicePrincipal("billing", Set.of(), Map.of());

            StepVerifier.create(service.authorize(billing, PERMISSION))
                    .expectErrorMessage("Service billing lacks permission '" + PERMISSION + "'")
                    .verify();
        }
    }

    @Nested
    @DisplayName("combined principals")
    class CombinedPrincipals {

        private CombinedPrincipal combined(Set<ServicePermissionGrant> grants, Set<String> userPermissions) {
            return new CombinedPrincipal("billing", "user-1", grants, userPermissions, Map.of());
        }

        @Test
        @DisplayName("should allow when both service and user hold the permission")
        void shouldAllowWhenBothPermitted() {
            givenAbac(AbacEvaluationResult.noMatch());

            StepVerifier.create(service.check(
                            combined(Set.of(ServicePermissionGrant.global(PERMISSION)), Set.of(PERMISSION)),
                            AuthorizationRequest.of(PERMISSION)))
                    .assertNext(result -> {
                        assertThat(result.allowed()).isTrue();
                        assertThat(result.reason()).isEqualTo("Both service and user have permission '" + PERMISSION + "'");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny when the service lacks the permission")
        void shouldDenyWhenServiceLacksPermission() {
            givenAbac(AbacEvaluationResult.noMatch());

            StepVerifier.create(service.check(combined(Set.of(), Set.of(PERMISSION)), AuthorizationRequest.of(PERMISSION)))
                    .assertNext(result -> {
                        assertThat(result.allowed()).isFalse();
                        assertThat(result.reason()).startsWith("Service permission denied: ");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should deny when the user lacks the permission")
        void shouldDenyWhenUserLacksPermission() {
            givenAbac(AbacEvaluationResult.noMatch());

            StepVerifier.create(service.check(
                            combined(Set.of(ServicePermissionGrant.global(PERMISSION)), Set.of()),
                            AuthorizationRequest.of(PERMISSION)))
                    .assertNext(result -> {
                        assertThat(result.allowed()).isFalse();
                        assertThat(result.reason()).startsWith("User permission denied: ");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should not let service grants act for a propagated user that carries no permissions")
        void shouldDenyPropagatedUserWithoutPermissions() {
            givenAbac(AbacEvaluationResult.noMatch());
            Principal principal = new JwtPrincipalDecoder().fromClaims(aServiceToken("svc-1")
                    .withPermissions("security:group:delete")
                    .withClaim("user_id", "user-1")
                    .build());

            StepVerifier.create(service.check(principal, AuthorizationRequest.of("security:group:delete")))
                    .assertNext(result -> {
                        assertThat(result.allowed()).isFalse();
                        assertThat(result.reason()).isEqualTo(
                                "User permission denied: User does not have permission 'security:group:delete'");
                    })
                    .verifyComplete();
            assertThat(principal.userId()).isEqualTo("user-1");
        }

        @Test
        @DisplayName("should raise AuthorizationDeniedException naming service and user")
        void shouldRaiseDenied() {
            StepVerifier.create(service.authorize(combined(Set.of(), Set.of()), PERMISSION))
                    .expectErrorMessage("Service billing (with user user-1) lacks permission '" + PERMISSION + "'")
                    .verify();
        }
    }

    @Nested
    @DisplayName("combining modes")
    class CombiningModes {

        @Test
        @DisplayName("grant-and-veto should let ABAC ALLOW grant a missing permission")
        void grantAndVetoShouldGrant() {
            service = serviceWith(new AuthzProperties(true, AbacCombiningMode.GRANT_AND_VETO));
            givenAbac(ABAC_ALLOW);

            StepVerifier.create(service.check(unprivilegedUser, AuthorizationRequest.of(PERMISSION)))
                    .assertNext(result -> {
                        assertThat(result.allowed()).isTrue();
                        assertThat(result.reason()).isEqualTo("Access granted: ABAC allowed");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("grant-and-veto should fall back to the flat check when no policy matches")
        void grantAndVetoShouldFallBack() {
            service = serviceWith(new AuthzProperties(true, AbacCombiningMode.GRANT_AND_VETO));
            givenAbac(AbacEvaluationResult.noMatch());

            StepVerifier.create(service.check(unprivilegedUser, AuthorizationRequest.of(PERMISSION)))
                    .assertNext(result -> assertThat(result.allowed()).isFalse())
                    .verifyComplete();
        }

        @Test
        @DisplayName("disabled ABAC should use the flat check only")
        void disabledAbacShouldUseFlatCheck() {
            service = serviceWith(new AuthzProperties(false, null));

            StepVerifier.create(service.check(permittedUser, AuthorizationRequest.of(PERMISSION)))
                    .assertNext(result -> assertThat(result.allowed()).isTrue())
                    .verifyComplete();

            verifyNoInteractions(abacEvaluationService);
        }
    }

    @Test
    @DisplayName("should fail closed when ABAC policies cannot be loaded")
    void shouldFailClosedOnStoreFailure() {
        when(abacEvaluationService.evaluatePolicies(any(), any(), any()))
                .thenReturn(Mono.error(new PolicyStoreException("Failed to load ABAC policies", new IllegalStateException())));

        StepVerifier.create(service.check(permittedUser, AuthorizationRequest.of(PERMISSION)))
                .assertNext(result -> {
                    assertThat(result.allowed()).isFalse();
                    assertThat(result.reason()).isEqualTo("Access denied: ABAC policies unavailable");
                })
                .verifyComplete();
    }
}
