package com.example.authz.security.principal;

/**
 * Kind of caller. A service acting on behalf of a user is still a {@link #SERVICE}.
 */
public enum PrincipalType {
    USER,
    SERVICE
}
