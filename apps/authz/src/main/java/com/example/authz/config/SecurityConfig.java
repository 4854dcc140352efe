package com.example.authz.config;

import com.example.authz.security.principal.JwtTokenValidator;
import com.example.authz.security.principal.TokenValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.oauth2.jwt.NimbusReactiveJwtDecoder;
import org.springframework.security.web.server.SecurityWebFilterChain;

/**
 * Spring Security is used for its header hardening only. Callers are authenticated by
 * {@link com.example.authz.security.filter.BearerTokenWebFilter} and authorized per operation
 * by {@link com.example.authz.authz.service.AuthorizationService}, not by URL rules.
 */
@Slf4j
@Configuration
@EnableWebFluxSecurity
@EnableConfigurationProperties({JwtProperties.class, AuthzProperties.class})
public class SecurityConfig {

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable) // bearer tokens only, no cookies
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .logout(ServerHttpSecurity.LogoutSpec::disable)
                .authorizeExchange(exchanges -> exchanges.anyExchange().permitAll())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean(TokenValidator.class)
    public TokenValidator tokenValidator(JwtProperties jwtProperties) {
        if (jwtProperties.jwkSetUri() == null || jwtProperties.jwkSetUri().isBlank()) {
            throw new IllegalStateException("app.security.jwt.jwk-set-uri must be configured");
        }
        log.info("Validating bearer tokens against JWKS at {}", jwtProperties.jwkSetUri());
        return new JwtTokenValidator(NimbusReactiveJwtDecoder.withJwkSetUri(jwtProperties.jwkSetUri()).build());
    }
}
