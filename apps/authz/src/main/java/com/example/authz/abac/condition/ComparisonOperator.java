package com.example.authz.abac.condition;

import java.util.Arrays;
import java.util.Optional;

/**
 * Leaf comparison operators of the condition DSL.
 */
public enum ComparisonOperator {
    EQ("eq"),
    NE("ne"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte");

    private final String key;

    ComparisonOperator(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isOrdering() {
        return this != EQ && this != NE;
    }

    public static Optional<ComparisonOperator> fromKey(String key) {
        return Arrays.stream(values())
                .filter(operator -> operator.key.equals(key))
                .findFirst();
    }
}
