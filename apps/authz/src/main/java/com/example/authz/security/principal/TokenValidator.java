package com.example.authz.security.principal;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Validates a bearer token (signature, expiry, issuer) and exposes its claims.
 *
 * <p>Validation failures are signalled as
 * {@link com.example.authz.security.exception.AuthenticationRequiredException}.
 */
public interface TokenValidator {

    Mono<Map<String, Object>> validate(String token);
}
