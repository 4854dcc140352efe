package com.example.authz.security.context;

import com.example.authz.security.exception.AuthenticationRequiredException;
import com.example.authz.security.principal.Principal;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.function.Function;

public final class PrincipalContextHolder {

    private static final String PRINCIPAL_KEY = Principal.class.getName();

    private PrincipalContextHolder() {
        // Utility class
    }

    public static Mono<Principal> getPrincipal() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(PRINCIPAL_KEY)) {
                return Mono.just(ctx.get(PRINCIPAL_KEY));
            }
            return Mono.error(new AuthenticationRequiredException(
                    "No principal found in reactive context"));
        });
    }

    public static Mono<Principal> getPrincipalIfPresent() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(PRINCIPAL_KEY)) {
                return Mono.just(ctx.get(PRINCIPAL_KEY));
            }
            return Mono.empty();
        });
    }

    public static Function<Context, Context> withPrincipal(Principal principal) {
        return context -> context.put(PRINCIPAL_KEY, principal);
    }
}
