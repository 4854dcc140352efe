package com.example.authz.authz.service;

import lombok.Builder;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * One permission check.
 *
 * @param permission         permission key being requested
 * @param resourceType       type of the target resource, exposed to ABAC as {@code resource.type}
 * @param resourceId         id of the target resource, exposed to ABAC as {@code resource.id}
 * @param resourceScope      path-like scope matched against scoped service grants (e.g. {@code tenants/acme/groups/42})
 * @param subjectAttributes  extra {@code subject.*} attributes, merged over the principal's own
 * @param resourceAttributes extra {@code resource.*} attributes
 * @param contextAttributes  {@code context.*} attributes such as time or client IP
 */
@Builder
public record AuthorizationRequest(
        @NonNull String permission,
        @Nullable String resourceType,
        @Nullable String resourceId,
        @Nullable String resourceScope,
        Map<String, Object> subjectAttributes,
        Map<String, Object> resourceAttributes,
        Map<String, Object> contextAttributes
) {
    public AuthorizationRequest {
        Objects.requireNonNull(permission, "permission");
        if (subjectAttributes == null) subjectAttributes = Map.of();
        if (resourceAttributes == null) resourceAttributes = Map.of();
        if (contextAttributes == null) contextAttributes = Map.of();
    }

    public static AuthorizationRequest of(@NonNull String permission) {
        return AuthorizationRequest.builder().permission(permission).build();
    }
}
