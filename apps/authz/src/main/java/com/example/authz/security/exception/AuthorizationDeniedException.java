package com.example.authz.security.exception;

import lombok.Getter;

/**
 * Authenticated principal lacks the requested permission. Rendered as HTTP 403.
 *
 * <p>The message names the principal and permission; it is logged server-side only.
 */
@Getter
public class AuthorizationDeniedException extends RuntimeException {

    private final String permission;
    private final String reason;

    public AuthorizationDeniedException(String message, String permission, String reason) {
        super(message);
        this.permission = permission;
        this.reason = reason;
    }
}
