package com.example.authz.abac.condition;

import com.example.authz.abac.model.AttributeValue;
import com.example.authz.abac.model.EvaluationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

import java.util.Objects;

import static com.example.authz.abac.condition.ConditionParser.MAX_RECURSION_DEPTH;

/**
 * Evaluates a parsed {@link ConditionNode} against an {@link EvaluationContext}.
 *
 * <p>Evaluation is pure and thread-safe. Missing attributes never throw; they resolve to
 * {@link AttributeValue#NULL} and generally produce a non-match.
 */
@Slf4j
public class ConditionEvaluator {

    private final boolean strictNumericComparison;

    public ConditionEvaluator() {
        this(false);
    }

    /**
     * @param strictNumericComparison when {@code true}, ordering operators treat missing or non-numeric
     *                                operands as a non-match instead of coercing them to {@code 0.0}
     */
    public ConditionEvaluator(boolean strictNumericComparison) {
        this.strictNumericComparison = strictNumericComparison;
    }

    public boolean evaluate(@NonNull ConditionNode node, @NonNull EvaluationContext context) {
        return evaluate(node, context, 0);
    }

    /**
     * Evaluate a sub-tree that sits {@code depth} levels below its root. The limit applies to the
     * whole remaining tree up-front, so an over-deep tree is {@code false} however many {@code not}
     * nodes it contains.
     */
    public boolean evaluate(@NonNull ConditionNode node, @NonNull EvaluationContext context, int depth) {
        if (node.deeperThan(MAX_RECURSION_DEPTH - depth)) {
            log.warn("Condition tree exceeds depth limit {}", MAX_RECURSION_DEPTH);
            return false;
        }
        return walk(node, context);
    }

    private boolean walk(ConditionNode node, EvaluationContext context) {
        if (node instanceof ConditionNode.And and) {
            for (ConditionNode child : and.children()) {
                if (!walk(child, context)) {
                    return false;
                }
            }
            return true;
        }
        if (node instanceof ConditionNode.Or or) {
            for (ConditionNode child : or.children()) {
                if (walk(child, context)) {
                    return true;
                }
            }
            return false;
        }
        if (node instanceof ConditionNode.Not not) {
            return !walk(not.child(), context);
        }
        if (node instanceof ConditionNode.Comparison comparison) {
            return compare(comparison, context.resolve(comparison.attributePath()));
        }
        if (node instanceof ConditionNode.Membership membership) {
            return isMember(context.resolve(membership.attributePath()), membership);
        }
        return false;
    }

    private boolean compare(ConditionNode.Comparison comparison, AttributeValue actual) {
        return switch (comparison.operator()) {
            case EQ -> !actual.isNull() && sameValue(actual, comparison.literal());
            case NE -> !actual.isNull() && !sameValue(actual, comparison.literal());
            case GT, GTE, LT, LTE -> compareOrdering(comparison.operator(), actual, comparison.literal());
        };
    }

    private static boolean sameValue(AttributeValue actual, AttributeValue expected) {
        if (actual instanceof AttributeValue.Numeric left && expected instanceof AttributeValue.Numeric right) {
            return left.numericallyEquals(right);
        }
        return actual.equals(expected);
    }

    private boolean compareOrdering(ComparisonOperator operator, AttributeValue actual, AttributeValue expected) {
        Double left = toDouble(actual);
        Double right = toDouble(expected);
        if (left == null || right == null) {
            if (strictNumericComparison) {
                return false;
            }
            left = left != null ? left : 0.0;
            right = right != null ? right : 0.0;
        }

        int result = Double.compare(left, right);
        return switch (operator) {
            case GT -> result > 0;
            case GTE -> result >= 0;
            case LT -> result < 0;
            case LTE -> result <= 0;
            case EQ, NE -> false;
        };
    }

    private static Double toDouble(AttributeValue value) {
        if (value instanceof AttributeValue.Numeric numeric) {
            return numeric.asDouble();
        }
        return null;
    }

    private static boolean isMember(AttributeValue actual, ConditionNode.Membership membership) {
        if (actual instanceof AttributeValue.ListValue list) {
            return list.elements().stream()
                    .map(AttributeValue::asText)
                    .filter(Objects::nonNull)
                    .anyMatch(membership.candidates()::contains);
        }
        if (actual.isNull()) {
            return false;
        }
        return membership.candidates().contains(actual.asText());
    }
}
