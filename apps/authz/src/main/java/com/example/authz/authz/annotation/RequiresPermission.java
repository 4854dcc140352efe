package com.example.authz.authz.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Requires the caller to hold a permission before a reactive handler method runs.
 *
 * <p>The annotated method must return a {@link reactor.core.publisher.Mono}. The caller is the
 * principal resolved by the bearer token filter; no principal results in 401, a denial in 403.
 *
 * <pre>
 * &#64;RequiresPermission(value = "security:group:save", resourceType = "group", resourceIdParam = "groupId")
 * public Mono&lt;Group&gt; saveGroup(&#64;PathVariable String groupId, ...) { }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequiresPermission {

    /**
     * Permission key.
     */
    String value();

    /**
     * Resource type passed to ABAC as {@code resource.type}.
     */
    String resourceType() default "";

    /**
     * Name of the {@code @PathVariable} holding the resource id, passed to ABAC as {@code resource.id}.
     */
    String resourceIdParam() default "";
}
