package com.example.authz.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bearer token settings.
 *
 * @param jwkSetUri  JWKS endpoint used to verify token signatures
 * @param headerName request header carrying {@code Bearer <token>}
 */
@ConfigurationProperties(prefix = "app.security.jwt")
public record JwtProperties(
        String jwkSetUri,
        String headerName
) {
    public JwtProperties {
        if (headerName == null || headerName.isBlank()) headerName = "Authorization";
    }
}
