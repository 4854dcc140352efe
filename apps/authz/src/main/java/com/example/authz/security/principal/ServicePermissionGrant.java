package com.example.authz.security.principal;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;

import java.util.Objects;

/**
 * Permission granted directly to a service.
 *
 * @param permission      permission key, matched case-sensitively
 * @param resourcePattern Ant-style pattern limiting the grant to matching resource scopes
 *                        (e.g. {@code tenants/acme/**}); {@code null} for a global grant
 */
public record ServicePermissionGrant(@NonNull String permission, @Nullable String resourcePattern) {

    private static final PathMatcher PATH_MATCHER = new AntPathMatcher();

    public ServicePermissionGrant {
        Objects.requireNonNull(permission, "permission");
    }

    public static ServicePermissionGrant global(@NonNull String permission) {
        return new ServicePermissionGrant(permission, null);
    }

    public static ServicePermissionGrant scoped(@NonNull String permission, @NonNull String resourcePattern) {
        return new ServicePermissionGrant(permission, resourcePattern);
    }

    public boolean isGlobal() {
        return resourcePattern == null;
    }

    /**
     * A global grant matches any scope. A scoped grant only matches a request that names a
     * resource scope matching its pattern.
     */
    public boolean grants(@NonNull String requestedPermission, @Nullable String resourceScope) {
        if (!permission.equals(requestedPermission)) {
            return false;
        }
        if (isGlobal()) {
            return true;
        }
        return resourceScope != null && PATH_MATCHER.match(resourcePattern, resourceScope);
    }
}
