package com.example.authz.authz.aspect;

import com.example.authz.authz.annotation.RequiresPermission;
import com.example.authz.authz.service.AuthorizationRequest;
import com.example.authz.authz.service.AuthorizationService;
import com.example.authz.security.context.PrincipalContextHolder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.annotation.Order;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.PathVariable;
import reactor.core.publisher.Mono;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.Optional;

/**
 * Aspect that enforces {@link RequiresPermission} through {@link AuthorizationService}.
 */
@Slf4j
@Aspect
@Component
@Order(1)
@RequiredArgsConstructor
public class AuthorizationAspect {

    private final AuthorizationService authorizationService;

    @Around("@annotation(requiresPermission)")
    public Object checkPermission(ProceedingJoinPoint joinPoint, RequiresPermission requiresPermission) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        if (!Mono.class.isAssignableFrom(method.getReturnType())) {
            throw new IllegalStateException(
                    "@RequiresPermission requires a Mono return type: " + method.getName());
        }

        AuthorizationRequest request = AuthorizationRequest.builder()
                .permission(requiresPermission.value())
                .resourceType(emptyToNull(requiresPermission.resourceType()))
                .resourceId(extractResourceId(joinPoint, method, requiresPermission.resourceIdParam()))
                .build();

        return PrincipalContextHolder.getPrincipalIfPresent()
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(principal -> authorizationService.authorize(principal.orElse(null), request))
                .then(Mono.defer(() -> {
                    log.debug("Permission {} granted for {}", request.permission(), method.getName());
                    return proceed(joinPoint);
                }));
    }

    private Mono<Object> proceed(ProceedingJoinPoint joinPoint) {
        try {
            Object result = joinPoint.proceed();
            if (result instanceof Mono<?> mono) {
                return mono.cast(Object.class);
            }
            return Mono.justOrEmpty(result);
        } catch (Throwable e) {
            return Mono.error(e);
        }
    }

    @Nullable
    private String extractResourceId(ProceedingJoinPoint joinPoint, Method method, String paramName) {
        if (paramName.isEmpty()) {
            return null;
        }

        Parameter[] parameters = method.getParameters();
        Object[] args = joinPoint.getArgs();

        for (int i = 0; i < parameters.length; i++) {
            PathVariable pathVariable = parameters[i].getAnnotation(PathVariable.class);
            if (pathVariable != null) {
                String name = pathVariable.value().isEmpty()
                        ? parameters[i].getName()
                        : pathVariable.value();
                if (paramName.equals(name) && args[i] != null) {
                    return args[i].toString();
                }
            }
        }
        return null;
    }

    @Nullable
    private static String emptyToNull(String value) {
        return value.isEmpty() ? null : value;
    }
}
