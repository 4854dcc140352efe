package com.example.authz.abac.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attribute context for a single ABAC evaluation.
 *
 * <p>Holds up to three namespaces addressed by dotted paths:
 * <ul>
 *   <li>{@code subject} - caller attributes (always present, possibly empty)</li>
 *   <li>{@code resource} - target object attributes (optional)</li>
 *   <li>{@code context} - environmental attributes such as time or IP (optional)</li>
 * </ul>
 *
 * @param root the namespaces keyed by name
 */
public record EvaluationContext(AttributeValue.MapValue root) {

    public static final String SUBJECT = "subject";
    public static final String RESOURCE = "resource";
    public static final String CONTEXT = "context";

    private static final String PATH_SEPARATOR = "\\.";

    @NonNull
    public static EvaluationContext of(
            @Nullable Map<String, ?> subjectAttributes,
            @Nullable Map<String, ?> resourceAttributes,
            @Nullable Map<String, ?> contextAttributes) {

        Map<String, Object> namespaces = new LinkedHashMap<>();
        namespaces.put(SUBJECT, subjectAttributes != null ? subjectAttributes : Map.of());
        if (resourceAttributes != null) {
            namespaces.put(RESOURCE, resourceAttributes);
        }
        if (contextAttributes != null) {
            namespaces.put(CONTEXT, contextAttributes);
        }
        return new EvaluationContext((AttributeValue.MapValue) AttributeValue.of(namespaces));
    }

    @NonNull
    public static EvaluationContext ofSubject(@Nullable Map<String, ?> subjectAttributes) {
        return of(subjectAttributes, null, null);
    }

    /**
     * Resolve a dotted path such as {@code subject.userId} or {@code resource.owner.id}.
     * Any missing key, or a non-map value in the middle of the path, resolves to {@link AttributeValue#NULL}.
     */
    @NonNull
    public AttributeValue resolve(@Nullable String path) {
        if (path == null || path.isEmpty()) {
            return AttributeValue.NULL;
        }

        AttributeValue current = root;
        for (String segment : path.split(PATH_SEPARATOR)) {
            if (!(current instanceof AttributeValue.MapValue map)) {
                return AttributeValue.NULL;
            }
            current = map.get(segment);
            if (current.isNull()) {
                return AttributeValue.NULL;
            }
        }
        return current;
    }

    public boolean hasNamespace(@NonNull String namespace) {
        return root.entries().containsKey(namespace);
    }
}
