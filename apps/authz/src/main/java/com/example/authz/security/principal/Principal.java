package com.example.authz.security.principal;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Authenticated caller, decoded from a validated token.
 *
 * <p>Three shapes share one permission vocabulary:
 * <ul>
 *   <li>{@link UserPrincipal} - end user with RBAC-resolved permissions</li>
 *   <li>{@link ServicePrincipal} - service with direct, optionally scoped grants</li>
 *   <li>{@link CombinedPrincipal} - service acting on behalf of a propagated user; both must be permitted</li>
 * </ul>
 */
public sealed interface Principal permits UserPrincipal, ServicePrincipal, CombinedPrincipal {

    /**
     * Exchange attribute key for storing the principal.
     */
    String EXCHANGE_ATTRIBUTE = "AUTHZ_PRINCIPAL";

    @NonNull
    PrincipalType principalType();

    @Nullable
    default String userId() {
        return null;
    }

    @Nullable
    default String serviceId() {
        return null;
    }

    /**
     * Raw token claims, for audit and attribute lookups.
     */
    @NonNull
    Map<String, Object> claims();

    /**
     * Identifier used in log lines and exception messages.
     */
    @NonNull
    String displayName();
}
