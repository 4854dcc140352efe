package com.example.authz.exception;

import com.example.authz.abac.store.PolicyStoreException;
import com.example.authz.common.util.StringSanitizer;
import com.example.authz.security.exception.AuthenticationRequiredException;
import com.example.authz.security.exception.AuthorizationDeniedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

/**
 * Renders every unhandled error as an {@link ErrorResponse}.
 *
 * <p>Denial reasons, matched policy names and policy store details are logged here and never
 * written to the response body.
 */
@Slf4j
@Component
@Order(-2)  // Higher priority than DefaultErrorWebExceptionHandler
public class GlobalErrorWebExceptionHandler extends AbstractErrorWebExceptionHandler {

    public GlobalErrorWebExceptionHandler(
            ErrorAttributes errorAttributes,
            WebProperties webProperties,
            ApplicationContext applicationContext,
            ServerCodecConfigurer serverCodecConfigurer) {
        super(errorAttributes, webProperties.getResources(), applicationContext);
        this.setMessageWriters(serverCodecConfigurer.getWriters());
    }

    @Override
    protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
        return RouterFunctions.route(RequestPredicates.all(), this::render);
    }

    private Mono<ServerResponse> render(ServerRequest request) {
        Throwable error = getError(request);
        ErrorMapping mapping = map(request, error);

        ErrorResponse body = ErrorResponse.of(mapping.status().value(), mapping.error(), mapping.message(), request.path());
        return ServerResponse.status(mapping.status())
                .contentType(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body));
    }

    private ErrorMapping map(ServerRequest request, Throwable error) {
        String path = request.path();

        if (error instanceof AuthenticationRequiredException) {
            log.warn("Unauthenticated request: path={}, error={}", path, error.getMessage());
            return new ErrorMapping(HttpStatus.UNAUTHORIZED, ErrorResponse.AUTHENTICATION_ERROR,
                    "Authentication required");
        }

        if (error instanceof AuthorizationDeniedException denied) {
            log.warn("Permission {} denied: path={}, detail={}, reason={}",
                    StringSanitizer.forLog(denied.getPermission()), path,
                    StringSanitizer.forLog(denied.getMessage(), 256), denied.getReason());
            return new ErrorMapping(HttpStatus.FORBIDDEN, ErrorResponse.AUTHORIZATION_ERROR, "Access denied");
        }

        if (error instanceof PolicyStoreException) {
            log.error("ABAC policy store unavailable: path={}, error={}", path, error.getMessage());
            return new ErrorMapping(HttpStatus.SERVICE_UNAVAILABLE, ErrorResponse.POLICY_STORE_ERROR,
                    "Authorization policies unavailable");
        }

        if (error instanceof WebExchangeBindException bindException) {
            String fieldErrors = bindException.getFieldErrors().stream()
                    .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                    .collect(Collectors.joining(", "));
            log.warn("Invalid request body: path={}, errors={}", path, fieldErrors);
            return new ErrorMapping(HttpStatus.BAD_REQUEST, ErrorResponse.VALIDATION_ERROR,
                    "Validation failed: " + fieldErrors);
        }

        if (error instanceof ResponseStatusException statusException) {
            HttpStatus status = HttpStatus.resolve(statusException.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }
            log.warn("Request failed: path={}, status={}, reason={}", path, status, statusException.getReason());
            return new ErrorMapping(status, ErrorResponse.REQUEST_ERROR,
                    statusException.getReason() != null ? statusException.getReason() : status.getReasonPhrase());
        }

        if (error instanceof IllegalArgumentException) {
            log.warn("Invalid argument: path={}, error={}", path, error.getMessage());
            return new ErrorMapping(HttpStatus.BAD_REQUEST, ErrorResponse.INVALID_ARGUMENT, "Invalid request parameter");
        }

        int status = (int) getErrorAttributes(request, ErrorAttributeOptions.defaults()).getOrDefault("status", 500);
        log.error("Unhandled error: path={}, status={}, error={}", path, status, error.getMessage(), error);
        return new ErrorMapping(HttpStatus.valueOf(status), ErrorResponse.SERVER_ERROR, "An unexpected error occurred");
    }

    private record ErrorMapping(HttpStatus status, String error, String message) {}
}
