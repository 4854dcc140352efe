package com.example.authz.security.principal;

import com.example.authz.common.util.StringSanitizer;
import com.example.authz.security.exception.AuthenticationRequiredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps validated token claims to a {@link Principal}.
 *
 * <p>Claims:
 * <ul>
 *   <li>{@code type} - {@code access} (user) or {@code service}; anything else is rejected</li>
 *   <li>{@code sub} - user id or service id</li>
 *   <li>{@code permissions} - user permissions, or global service grants</li>
 *   <li>{@code scoped_permissions} - service grants limited to a resource pattern</li>
 *   <li>{@code user_id} + {@code user_permissions} - user propagated through a service token; a
 *       missing {@code user_permissions} claim means the user holds no permissions</li>
 * </ul>
 */
@Slf4j
@Component
public class JwtPrincipalDecoder {

    public static final String CLAIM_TYPE = "type";
    public static final String CLAIM_SUBJECT = "sub";
    public static final String CLAIM_PERMISSIONS = "permissions";
    public static final String CLAIM_SCOPED_PERMISSIONS = "scoped_permissions";
    public static final String CLAIM_USER_ID = "user_id";
    public static final String CLAIM_USER_PERMISSIONS = "user_permissions";

    public static final String TYPE_ACCESS = "access";
    public static final String TYPE_SERVICE = "service";

    private static final String SCOPED_PERMISSION = "permission";
    private static final String SCOPED_RESOURCE_PATTERN = "resource_pattern";

    @NonNull
    public Principal fromClaims(@NonNull Map<String, Object> claims) {
        String type = stringClaim(claims, CLAIM_TYPE);
        if (TYPE_SERVICE.equals(type)) {
            return servicePrincipal(claims);
        }
        if (TYPE_ACCESS.equals(type)) {
            return userPrincipal(claims);
        }
        log.debug("Rejected token with type {}", StringSanitizer.forLog(type));
        throw new AuthenticationRequiredException("Invalid or expired access token");
    }

    private Principal userPrincipal(Map<String, Object> claims) {
        String userId = stringClaim(claims, CLAIM_SUBJECT);
        if (!StringSanitizer.isValidSafeId(userId)) {
            throw new AuthenticationRequiredException("Invalid access token: missing user ID");
        }
        return new UserPrincipal(userId, permissions(claims.get(CLAIM_PERMISSIONS)), claims);
    }

    private Principal servicePrincipal(Map<String, Object> claims) {
        String serviceId = stringClaim(claims, CLAIM_SUBJECT);
        if (!StringSanitizer.isValidSafeId(serviceId)) {
            throw new AuthenticationRequiredException("Invalid service token: missing service ID");
        }

        Set<ServicePermissionGrant> grants = new LinkedHashSet<>();
        permissions(claims.get(CLAIM_PERMISSIONS)).forEach(p -> grants.add(ServicePermissionGrant.global(p)));
        grants.addAll(scopedGrants(claims.get(CLAIM_SCOPED_PERMISSIONS)));

        String userId = stringClaim(claims, CLAIM_USER_ID);
        Object userPermissions = claims.get(CLAIM_USER_PERMISSIONS);
        if (userId == null) {
            return new ServicePrincipal(serviceId, grants, claims);
        }
        if (!StringSanitizer.isValidSafeId(userId)) {
            throw new AuthenticationRequiredException("Invalid service token: malformed user ID");
        }
        if (!(userPermissions instanceof Collection<?>)) {
            // propagated user with no permissions: the user side of every check fails
            log.debug("Service token for {} carries user_id without user_permissions",
                    StringSanitizer.forLog(serviceId));
        }
        return new CombinedPrincipal(serviceId, userId, grants, permissions(userPermissions), claims);
    }

    private static Set<String> permissions(@Nullable Object claim) {
        Set<String> permissions = new LinkedHashSet<>();
        if (claim instanceof Collection<?> values) {
            values.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .filter(p -> !p.isBlank())
                    .forEach(permissions::add);
        } else if (claim != null) {
            log.warn("Ignoring permissions claim of type {}", claim.getClass().getSimpleName());
        }
        return permissions;
    }

    private static Set<ServicePermissionGrant> scopedGrants(@Nullable Object claim) {
        Set<ServicePermissionGrant> grants = new LinkedHashSet<>();
        if (!(claim instanceof Collection<?> values)) {
            return grants;
        }
        for (Object value : values) {
            if (!(value instanceof Map<?, ?> entry)) {
                continue;
            }
            Object permission = entry.get(SCOPED_PERMISSION);
            Object pattern = entry.get(SCOPED_RESOURCE_PATTERN);
            if (permission == null || permission.toString().isBlank()) {
                continue;
            }
            grants.add(pattern != null
                    ? ServicePermissionGrant.scoped(permission.toString(), pattern.toString())
                    : ServicePermissionGrant.global(permission.toString()));
        }
        return grants;
    }

    @Nullable
    private static String stringClaim(Map<String, Object> claims, String name) {
        Object value = claims.get(name);
        return value != null ? value.toString() : null;
    }
}
