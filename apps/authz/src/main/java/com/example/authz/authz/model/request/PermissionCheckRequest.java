package com.example.authz.authz.model.request;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record PermissionCheckRequest(
        @NotBlank(message = "Permission is required")
        String permission,

        String resourceType,
        String resourceId,
        String resourceScope,
        Map<String, Object> resourceAttributes,
        Map<String, Object> contextAttributes
) {}
