package com.example.authz.security.principal;

import org.springframework.lang.NonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Service acting on behalf of a user. Both the service grants and the user permissions are
 * required; access needs both sides to pass.
 *
 * @param serviceId       calling service
 * @param userId          propagated user ({@code user_id} claim)
 * @param serviceGrants   permissions granted to the service
 * @param userPermissions permissions of the propagated user ({@code user_permissions} claim)
 * @param claims          raw token claims
 */
public record CombinedPrincipal(
        @NonNull String serviceId,
        @NonNull String userId,
        @NonNull Set<ServicePermissionGrant> serviceGrants,
        @NonNull Set<String> userPermissions,
        @NonNull Map<String, Object> claims
) implements Principal {

    public CombinedPrincipal {
        Objects.requireNonNull(serviceId, "serviceId");
        Objects.requireNonNull(userId, "userId");
        serviceGrants = serviceGrants != null ? Set.copyOf(serviceGrants) : Set.of();
        userPermissions = userPermissions != null ? Set.copyOf(userPermissions) : Set.of();
        claims = claims != null ? Collections.unmodifiableMap(new LinkedHashMap<>(claims)) : Map.of();
    }

    @Override
    public PrincipalType principalType() {
        return PrincipalType.SERVICE;
    }

    public ServicePrincipal servicePrincipal() {
        return new ServicePrincipal(serviceId, serviceGrants, claims);
    }

    public UserPrincipal userPrincipal() {
        return new UserPrincipal(userId, userPermissions, claims);
    }

    @Override
    public String displayName() {
        return "Service " + serviceId + " (with user " + userId + ")";
    }
}
