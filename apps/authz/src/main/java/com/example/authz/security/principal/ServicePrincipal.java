package com.example.authz.security.principal;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Service authenticated with a service token and no propagated user.
 *
 * @param serviceId service identifier ({@code sub} claim)
 * @param grants    permissions granted directly to the service
 * @param claims    raw token claims
 */
public record ServicePrincipal(
        @NonNull String serviceId,
        @NonNull Set<ServicePermissionGrant> grants,
        @NonNull Map<String, Object> claims
) implements Principal {

    public ServicePrincipal {
        Objects.requireNonNull(serviceId, "serviceId");
        grants = grants != null ? Set.copyOf(grants) : Set.of();
        claims = claims != null ? Collections.unmodifiableMap(new LinkedHashMap<>(claims)) : Map.of();
    }

    @Override
    public PrincipalType principalType() {
        return PrincipalType.SERVICE;
    }

    public boolean hasPermission(@NonNull String permission, @Nullable String resourceScope) {
        return grants.stream().anyMatch(grant -> grant.grants(permission, resourceScope));
    }

    @Override
    public String displayName() {
        return "Service " + serviceId;
    }
}
