package com.example.authz.authz.model.response;

public record PermissionCheckResponse(
        String permission,
        boolean allowed
) {}
