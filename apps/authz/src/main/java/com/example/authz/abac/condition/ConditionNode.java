package com.example.authz.abac.condition;

import com.example.authz.abac.model.AttributeValue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed, shape-validated condition tree.
 *
 * <p>Built by {@link ConditionParser}; a malformed condition never produces a partial tree but a
 * single {@link Never} node, which evaluates to {@code false}.
 */
public sealed interface ConditionNode
        permits ConditionNode.And, ConditionNode.Or, ConditionNode.Not,
        ConditionNode.Comparison, ConditionNode.Membership, ConditionNode.Never {

    /**
     * Direct children of a boolean node; empty for leaves.
     */
    default List<ConditionNode> operands() {
        return List.of();
    }

    /**
     * Nesting depth of this tree; a leaf has depth 0.
     */
    default int depth() {
        return measureDepth(this, Integer.MAX_VALUE);
    }

    /**
     * Whether this tree nests deeper than {@code limit}. Stops walking as soon as the limit is passed.
     */
    default boolean deeperThan(int limit) {
        return limit < 0 || measureDepth(this, limit) > limit;
    }

    /**
     * Iterative depth walk. Returns the first level found beyond {@code limit}, or the full depth
     * when the tree stays within it.
     */
    private static int measureDepth(ConditionNode root, int limit) {
        Deque<Map.Entry<ConditionNode, Integer>> pending = new ArrayDeque<>();
        pending.push(Map.entry(root, 0));
        int max = 0;
        while (!pending.isEmpty()) {
            Map.Entry<ConditionNode, Integer> current = pending.pop();
            int level = current.getValue();
            max = Math.max(max, level);
            if (max > limit) {
                return max;
            }
            for (ConditionNode child : current.getKey().operands()) {
                pending.push(Map.entry(child, level + 1));
            }
        }
        return max;
    }

    record And(List<ConditionNode> children) implements ConditionNode {
        public And {
            children = List.copyOf(children);
        }

        @Override
        public List<ConditionNode> operands() {
            return children;
        }
    }

    record Or(List<ConditionNode> children) implements ConditionNode {
        public Or {
            children = List.copyOf(children);
        }

        @Override
        public List<ConditionNode> operands() {
            return children;
        }
    }

    record Not(ConditionNode child) implements ConditionNode {
        public Not {
            Objects.requireNonNull(child, "child");
        }

        @Override
        public List<ConditionNode> operands() {
            return List.of(child);
        }
    }

    /**
     * {@code {"<operator>": {"<path>": <literal>}}}
     */
    record Comparison(ComparisonOperator operator, String attributePath, AttributeValue literal)
            implements ConditionNode {
    }

    /**
     * {@code {"in": {"<path>": [<candidates>]}}}; candidates are kept in their string form.
     */
    record Membership(String attributePath, List<String> candidates) implements ConditionNode {
        public Membership {
            candidates = List.copyOf(candidates);
        }
    }

    /**
     * Fail-closed sentinel for a condition that could not be parsed.
     */
    record Never(String reason) implements ConditionNode {
    }
}
