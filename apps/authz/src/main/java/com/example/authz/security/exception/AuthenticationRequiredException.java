package com.example.authz.security.exception;

/**
 * No authenticated principal, or the presented token could not be validated. Rendered as HTTP 401.
 */
public class AuthenticationRequiredException extends RuntimeException {

    public AuthenticationRequiredException(String message) {
        super(message);
    }

    public AuthenticationRequiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
