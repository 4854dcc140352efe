package com.example.authz.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.authz")
public record AuthzProperties(
        Boolean abacEnabled,
        AbacCombiningMode combiningMode
) {
    public AuthzProperties {
        if (abacEnabled == null) {
            abacEnabled = true;
        }
        if (combiningMode == null) {
            combiningMode = AbacCombiningMode.VETO_ONLY;
        }
    }
}
