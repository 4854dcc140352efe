package com.example.authz.abac.event;

import org.springframework.lang.Nullable;

/**
 * Published when ABAC policies are created, edited or removed.
 *
 * @param policyName the changed policy, or {@code null} when every policy may have changed
 */
public record PolicyChangedEvent(@Nullable String policyName) {

    public static PolicyChangedEvent all() {
        return new PolicyChangedEvent(null);
    }

    public static PolicyChangedEvent of(String policyName) {
        return new PolicyChangedEvent(policyName);
    }

    public boolean affectsAll() {
        return policyName == null;
    }
}
