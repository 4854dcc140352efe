package com.example.authz.security.principal;

import com.example.authz.security.exception.AuthenticationRequiredException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * {@link TokenValidator} backed by Spring Security's {@link ReactiveJwtDecoder} (Nimbus, JWKS keys).
 */
@Slf4j
@RequiredArgsConstructor
public class JwtTokenValidator implements TokenValidator {

    private final ReactiveJwtDecoder jwtDecoder;

    @Override
    public Mono<Map<String, Object>> validate(String token) {
        return jwtDecoder.decode(token)
                .map(Jwt::getClaims)
                .onErrorMap(JwtException.class, e -> {
                    log.debug("JWT validation failed: {}", e.getMessage());
                    return new AuthenticationRequiredException("Invalid or expired access token", e);
                });
    }
}
