package com.example.authz.abac.condition;

import com.example.authz.abac.model.AttributeValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses the JSON condition DSL into a {@link ConditionNode} tree.
 *
 * <p>Grammar:
 * <pre>
 * node       := {"and": [node, ...]} | {"or": [node, ...]} | {"not": node}
 *             | {"eq"|"ne"|"gt"|"gte"|"lt"|"lte": {"path": scalar}}
 *             | {"in": {"path": [scalar, ...]}}
 * </pre>
 *
 * <p>Parsing never throws. Oversized, malformed, unknown or over-deep input yields a single
 * {@link ConditionNode.Never} for the whole condition.
 */
@Slf4j
@Component
public class ConditionParser {

    public static final int MAX_CONDITION_SIZE = 10 * 1024;
    public static final int MAX_RECURSION_DEPTH = 10;

    private static final String AND = "and";
    private static final String OR = "or";
    private static final String NOT = "not";
    private static final String IN = "in";

    private final ObjectReader reader;

    public ConditionParser(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @NonNull
    public ConditionNode parse(@Nullable String condition) {
        if (condition == null || condition.isBlank()) {
            return never("condition is empty");
        }
        if (condition.length() > MAX_CONDITION_SIZE) {
            return never("condition exceeds " + MAX_CONDITION_SIZE + " characters");
        }

        JsonNode root;
        try {
            root = reader.readTree(condition);
        } catch (JsonProcessingException e) {
            return never("condition is not valid JSON");
        }

        if (root == null || !root.isObject()) {
            return never("condition root must be a JSON object");
        }

        try {
            return parseNode(root, 0);
        } catch (InvalidConditionException e) {
            return never(e.getMessage());
        }
    }

    private ConditionNode parseNode(JsonNode node, int depth) throws InvalidConditionException {
        if (depth > MAX_RECURSION_DEPTH) {
            throw new InvalidConditionException("condition nesting exceeds depth " + MAX_RECURSION_DEPTH);
        }
        if (!node.isObject() || node.size() != 1) {
            throw new InvalidConditionException("each condition node must be an object with exactly one operator");
        }

        Map.Entry<String, JsonNode> entry = node.fields().next();
        String operator = entry.getKey();
        JsonNode operand = entry.getValue();

        return switch (operator) {
            case AND -> new ConditionNode.And(parseChildren(operator, operand, depth));
            case OR -> new ConditionNode.Or(parseChildren(operator, operand, depth));
            case NOT -> parseNegation(operand, depth);
            case IN -> parseMembership(operand);
            default -> parseComparison(
                    ComparisonOperator.fromKey(operator)
                            .orElseThrow(() -> new InvalidConditionException("unknown operator")),
                    operand);
        };
    }

    private ConditionNode parseNegation(JsonNode operand, int depth) throws InvalidConditionException {
        if (!operand.isObject()) {
            throw new InvalidConditionException("'not' requires a condition object");
        }
        return new ConditionNode.Not(parseNode(operand, depth + 1));
    }

    private List<ConditionNode> parseChildren(String operator, JsonNode operand, int depth)
            throws InvalidConditionException {
        if (!operand.isArray()) {
            throw new InvalidConditionException("'" + operator + "' requires an array of conditions");
        }
        List<ConditionNode> children = new ArrayList<>(operand.size());
        for (JsonNode child : operand) {
            if (!child.isObject()) {
                throw new InvalidConditionException("'" + operator + "' elements must be condition objects");
            }
            children.add(parseNode(child, depth + 1));
        }
        return children;
    }

    private ConditionNode parseComparison(ComparisonOperator operator, JsonNode operand)
            throws InvalidConditionException {
        Map.Entry<String, JsonNode> binding = singleBinding(operator.key(), operand);
        return new ConditionNode.Comparison(operator, binding.getKey(), toLiteral(operator.key(), binding.getValue()));
    }

    private ConditionNode parseMembership(JsonNode operand) throws InvalidConditionException {
        Map.Entry<String, JsonNode> binding = singleBinding(IN, operand);
        JsonNode values = binding.getValue();
        if (!values.isArray()) {
            throw new InvalidConditionException("'in' requires an array of values");
        }
        List<String> candidates = new ArrayList<>(values.size());
        for (JsonNode value : values) {
            if (!value.isValueNode() || value.isNull()) {
                throw new InvalidConditionException("'in' values must be scalars");
            }
            candidates.add(value.asText());
        }
        return new ConditionNode.Membership(binding.getKey(), candidates);
    }

    private Map.Entry<String, JsonNode> singleBinding(String operator, JsonNode operand)
            throws InvalidConditionException {
        if (!operand.isObject() || operand.size() != 1) {
            throw new InvalidConditionException("'" + operator + "' requires exactly one attribute path");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = operand.fields();
        Map.Entry<String, JsonNode> binding = fields.next();
        if (binding.getKey().isEmpty()) {
            throw new InvalidConditionException("'" + operator + "' attribute path is empty");
        }
        return binding;
    }

    private AttributeValue toLiteral(String operator, JsonNode value) throws InvalidConditionException {
        if (value.isTextual()) {
            return new AttributeValue.Text(value.textValue());
        }
        if (value.isNumber()) {
            return new AttributeValue.Numeric(value.numberValue());
        }
        if (value.isBoolean()) {
            return new AttributeValue.Bool(value.booleanValue());
        }
        throw new InvalidConditionException("'" + operator + "' requires a string, number or boolean literal");
    }

    private ConditionNode never(String reason) {
        log.warn("Rejected ABAC condition: {}", reason);
        return new ConditionNode.Never(reason);
    }

    private static final class InvalidConditionException extends Exception {
        InvalidConditionException(String message) {
            super(message);
        }
    }
}
