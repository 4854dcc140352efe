package com.example.authz.abac.store;

import com.example.authz.abac.model.AbacPolicy;
import com.example.authz.abac.model.PolicyEffect;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * MongoDB document for ABAC policies.
 * Policies are managed by the security team and stored in the database
 * so they can change without a deployment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "abac_policies")
public class AbacPolicyDoc {

    @Id
    private String id;

    /**
     * Unique policy name (e.g., "deny-suspended-users").
     */
    @Indexed(unique = true)
    private String name;

    private PolicyEffect effect;

    /**
     * JSON condition tree.
     */
    private String condition;

    private boolean active;

    /**
     * Incremented by Spring Data on every save.
     */
    @Version
    private Long version;

    public AbacPolicy toPolicy() {
        return AbacPolicy.builder()
                .id(id)
                .name(name)
                .effect(effect)
                .condition(condition)
                .active(active)
                .version(version != null ? version : 0L)
                .build();
    }
}
