package com.example.authz.config;

/**
 * How ABAC decisions combine with the flat permission check.
 */
public enum AbacCombiningMode {

    /**
     * The flat permission check must pass; a matching ABAC DENY can still veto it.
     */
    VETO_ONLY,

    /**
     * A matching ABAC DENY vetoes, a matching ABAC ALLOW grants even without a flat permission,
     * and no ABAC decision falls back to the flat check.
     */
    GRANT_AND_VETO
}
