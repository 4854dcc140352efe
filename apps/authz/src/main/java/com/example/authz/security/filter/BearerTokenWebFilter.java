package com.example.authz.security.filter;

import com.example.authz.common.util.StringSanitizer;
import com.example.authz.config.JwtProperties;
import com.example.authz.exception.ErrorResponse;
import com.example.authz.security.context.PrincipalContextHolder;
import com.example.authz.security.exception.AuthenticationRequiredException;
import com.example.authz.security.principal.JwtPrincipalDecoder;
import com.example.authz.security.principal.Principal;
import com.example.authz.security.principal.TokenValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Resolves the caller's {@link Principal} from a bearer token.
 *
 * <p>No token: the request continues anonymously and protected operations fail with 401 later.
 * Invalid token: the request is rejected with 401 immediately.
 * Valid token: the principal is stored in the exchange attributes and in the Reactor context.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class BearerTokenWebFilter implements WebFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenValidator tokenValidator;
    private final JwtPrincipalDecoder principalDecoder;
    private final JwtProperties jwtProperties;
    private final ObjectMapper objectMapper;

    @Override
    @NonNull
    public Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        String token = extractToken(exchange);
        if (token == null) {
            return chain.filter(exchange);
        }

        return tokenValidator.validate(token)
                .map(principalDecoder::fromClaims)
                .onErrorResume(AuthenticationRequiredException.class, e -> {
                    log.info("Bearer token rejected: {}", e.getMessage());
                    return unauthorizedResponse(exchange).then(Mono.<Principal>empty());
                })
                .flatMap(principal -> {
                    exchange.getAttributes().put(Principal.EXCHANGE_ATTRIBUTE, principal);
                    log.debug("Principal resolved: type={}, id={}, path={}",
                            principal.principalType(),
                            StringSanitizer.forLog(principal.displayName()),
                            exchange.getRequest().getPath().value());
                    return chain.filter(exchange)
                            .contextWrite(PrincipalContextHolder.withPrincipal(principal));
                });
    }

    @Nullable
    private String extractToken(ServerWebExchange exchange) {
        String header = exchange.getRequest().getHeaders().getFirst(jwtProperties.headerName());
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private Mono<Void> unauthorizedResponse(ServerWebExchange exchange) {
        if (exchange.getResponse().isCommitted()) {
            return Mono.empty();
        }
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

        ErrorResponse errorResponse = ErrorResponse.of(
                HttpStatus.UNAUTHORIZED.value(),
                ErrorResponse.AUTHENTICATION_ERROR,
                "Authentication required",
                exchange.getRequest().getPath().value());

        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(errorResponse);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize error response: {}", e.getMessage());
            body = "{\"error\":\"authentication_error\",\"message\":\"Authentication required\"}"
                    .getBytes(StandardCharsets.UTF_8);
        }
        return exchange.getResponse()
                .writeWith(Mono.just(exchange.getResponse().bufferFactory().wrap(body)));
    }
}
