package com.example.authz.abac.model;

/**
 * Effect applied when an ABAC policy condition matches.
 */
public enum PolicyEffect {
    ALLOW,
    DENY
}
