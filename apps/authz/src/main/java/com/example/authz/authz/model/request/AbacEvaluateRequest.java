package com.example.authz.authz.model.request;

import java.util.Map;

public record AbacEvaluateRequest(
        Map<String, Object> subject,
        Map<String, Object> resource,
        Map<String, Object> context
) {}
