package com.example.authz.exception;

import java.time.Instant;

public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path
) {
    public static final String AUTHENTICATION_ERROR = "authentication_error";
    public static final String AUTHORIZATION_ERROR = "authorization_error";
    public static final String POLICY_STORE_ERROR = "policy_store_error";
    public static final String VALIDATION_ERROR = "validation_error";
    public static final String REQUEST_ERROR = "request_error";
    public static final String INVALID_ARGUMENT = "invalid_argument";
    public static final String SERVER_ERROR = "server_error";

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path);
    }
}
