package com.example.authz.security.principal;

import org.springframework.lang.NonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * End user authenticated with an access token.
 *
 * @param userId      user identifier ({@code sub} claim)
 * @param permissions permissions resolved from the user's roles when the token was issued
 * @param claims      raw token claims
 */
public record UserPrincipal(
        @NonNull String userId,
        @NonNull Set<String> permissions,
        @NonNull Map<String, Object> claims
) implements Principal {

    public UserPrincipal {
        Objects.requireNonNull(userId, "userId");
        permissions = permissions != null ? Set.copyOf(permissions) : Set.of();
        claims = claims != null ? Collections.unmodifiableMap(new LinkedHashMap<>(claims)) : Map.of();
    }

    @Override
    public PrincipalType principalType() {
        return PrincipalType.USER;
    }

    public boolean hasPermission(@NonNull String permission) {
        return permissions.contains(permission);
    }

    @Override
    public String displayName() {
        return "User " + userId;
    }
}
