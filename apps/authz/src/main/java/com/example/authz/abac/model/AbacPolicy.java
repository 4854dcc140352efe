package com.example.authz.abac.model;

import lombok.Builder;

/**
 * Named ABAC rule pairing a JSON condition with an ALLOW/DENY effect.
 *
 * @param id        store identifier (may equal the name for config-backed policies)
 * @param name      unique, human-readable policy name
 * @param effect    effect applied when the condition matches
 * @param condition JSON-encoded condition tree
 * @param active    inactive policies are never evaluated
 * @param version   store version, bumped on every edit; part of the parsed-condition cache key
 */
@Builder(toBuilder = true)
public record AbacPolicy(
        String id,
        String name,
        PolicyEffect effect,
        String condition,
        boolean active,
        long version
) {
    public AbacPolicy {
        if (id == null) {
            id = name;
        }
    }

    public boolean isDeny() {
        return effect == PolicyEffect.DENY;
    }

    public boolean isAllow() {
        return effect == PolicyEffect.ALLOW;
    }
}
