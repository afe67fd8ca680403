package io.github.cyfko.sdtp.core.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.github.cyfko.sdtp.core.api.Op;
import io.github.cyfko.sdtp.core.config.FilterPolicy;
import io.github.cyfko.sdtp.core.conversion.SdtpJson;
import io.github.cyfko.sdtp.core.exception.SpecException;
import io.github.cyfko.sdtp.core.model.FilterCombinator;
import io.github.cyfko.sdtp.core.model.FilterLeaf;
import io.github.cyfko.sdtp.core.model.FilterPath;
import io.github.cyfko.sdtp.core.model.FilterSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns a wire filter document into a {@link FilterSpec} tree.
 * <p>
 * The parser only checks structure: every node is a JSON object with a string {@code operator};
 * leaves name a {@code column} and carry the operand their operator needs; combinators carry an
 * {@code arguments} array of legal length. Column names and literal types are left to
 * {@link io.github.cyfko.sdtp.core.validation.FilterValidator}. The parser fails fast on the
 * first problem with a {@link SpecException} locating it.
 * </p>
 *
 * <h2>Accepted spellings</h2>
 * <p>Besides the canonical form, documents written for the earlier data-plane protocol are read:</p>
 * <pre>{@code
 * {"operator": "ALL",  "arguments": [...]}                          // AND
 * {"operator": "ANY",  "arguments": [...]}                          // OR
 * {"operator": "NONE", "arguments": [...]}                          // NOT(OR(...))
 * {"operator": "IN_LIST",     "column": "c", "values": [...]}       // IN
 * {"operator": "IN_RANGE",    "column": "c", "min_val": 1, "max_val": 9}  // BETWEEN [1, 9]
 * {"operator": "REGEX_MATCH", "column": "c", "expression": "a.*"}   // REGEX
 * }</pre>
 *
 * <h2>Limits</h2>
 * <p>
 * Depth and node count are bounded by the {@link FilterPolicy}. Every element of an array operand
 * (IN members, BETWEEN bounds) counts as a node. The limits are checked while descending, so an
 * oversized document is rejected before it is fully read.
 * </p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @since 1.0.0
 */
public final class FilterSpecParser {

    static final String LEGACY_NONE = "NONE";

    private final FilterPolicy policy;

    public FilterSpecParser(FilterPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public FilterPolicy policy() {
        return policy;
    }

    /**
     * Parses a filter document.
     *
     * @param document the value of the request's {@code filter} field
     * @return the filter tree
     * @throws SpecException if the document is malformed or exceeds the policy limits
     */
    public FilterSpec parse(JsonNode document) {
        Objects.requireNonNull(document, "document");
        return parseNode(document, FilterPath.ROOT, 1, new int[]{0});
    }

    private FilterSpec parseNode(JsonNode node, String path, int depth, int[] nodeCount) {
        if (depth > policy.maxDepth()) {
            throw new SpecException("Filter nesting exceeds the maximum depth of " + policy.maxDepth(),
                    FilterPath.node(path, "filter"));
        }
        if (++nodeCount[0] > policy.maxNodes()) {
            throw new SpecException("Filter exceeds the maximum of " + policy.maxNodes() + " nodes",
                    FilterPath.node(path, "filter"));
        }
        if (node == null || !node.isObject()) {
            throw new SpecException("Filter node must be a JSON object", FilterPath.node(path, "filter"));
        }

        JsonNode operatorNode = node.get("operator");
        if (operatorNode == null || !operatorNode.isTextual()) {
            throw new SpecException("Filter node needs a string 'operator' field", FilterPath.field(path, "operator"));
        }
        String spelling = operatorNode.textValue();

        if (LEGACY_NONE.equals(spelling.trim().toUpperCase(Locale.ROOT))) {
            String orPath = FilterPath.child(path, Op.NOT, 0);
            List<FilterSpec> arguments = parseArguments(node, path, orPath, Op.OR, depth + 1, nodeCount);
            if (arguments.isEmpty()) {
                throw new SpecException("Operator NONE requires at least 1 argument", FilterPath.node(path, LEGACY_NONE));
            }
            return new FilterCombinator(Op.NOT, List.of(new FilterCombinator(Op.OR, arguments)));
        }

        Op operator = Op.fromString(spelling).orElseThrow(() -> new SpecException(
                "Unknown operator '" + spelling + "'", FilterPath.field(path, "operator")));

        if (operator.isCombinator()) {
            List<FilterSpec> arguments = parseArguments(node, path, path, operator, depth, nodeCount);
            String arityError = FilterCombinator.arityError(operator, arguments.size());
            if (arityError != null) {
                throw new SpecException(arityError, FilterPath.node(path, operator.code()));
            }
            return new FilterCombinator(operator, arguments);
        }
        return parseLeaf(node, operator, path, nodeCount);
    }

    private List<FilterSpec> parseArguments(JsonNode node, String path, String childBase, Op combinator,
                                            int depth, int[] nodeCount) {
        JsonNode arguments = node.get("arguments");
        if (arguments == null || !arguments.isArray()) {
            throw new SpecException("Operator " + combinator.code() + " needs an 'arguments' array",
                    FilterPath.field(path, "arguments"));
        }
        List<FilterSpec> children = new ArrayList<>(arguments.size());
        for (int i = 0; i < arguments.size(); i++) {
            children.add(parseNode(arguments.get(i), FilterPath.child(childBase, combinator, i), depth + 1, nodeCount));
        }
        return children;
    }

    private FilterLeaf parseLeaf(JsonNode node, Op operator, String path, int[] nodeCount) {
        JsonNode column = node.get("column");
        if (column == null || !column.isTextual() || column.textValue().isBlank()) {
            throw new SpecException("Operator " + operator.code() + " needs a string 'column' field",
                    FilterPath.field(path, "column"));
        }

        JsonNode value = operandOf(node, operator, path);
        boolean present = value != null && !value.isMissingNode();
        if (operator.requiresValue() && !present) {
            throw new SpecException("Operator " + operator.code() + " requires a 'value' field",
                    FilterPath.field(path, "value"));
        }
        if (!operator.requiresValue() && present && !value.isNull()) {
            throw new SpecException("Operator " + operator.code() + " takes no value", FilterPath.field(path, "value"));
        }
        if (present && value.isArray()) {
            nodeCount[0] += value.size();
            if (nodeCount[0] > policy.maxNodes()) {
                throw new SpecException("Filter exceeds the maximum of " + policy.maxNodes()
                        + " nodes, operand list elements included", FilterPath.field(path, "value"));
            }
        }
        return new FilterLeaf(operator, column.textValue(), value);
    }

    private static JsonNode operandOf(JsonNode node, Op operator, String path) {
        JsonNode value = node.get("value");
        if (value != null) {
            return value;
        }
        return switch (operator) {
            case IN -> node.get("values");
            case REGEX -> node.get("expression");
            case BETWEEN -> legacyRange(node, path);
            default -> null;
        };
    }

    private static JsonNode legacyRange(JsonNode node, String path) {
        JsonNode min = node.get("min_val");
        JsonNode max = node.get("max_val");
        if (min == null && max == null) {
            return null;
        }
        if (min == null || max == null) {
            throw new SpecException("Range needs both 'min_val' and 'max_val'",
                    FilterPath.field(path, min == null ? "min_val" : "max_val"));
        }
        ArrayNode pair = SdtpJson.nodes().arrayNode(2);
        pair.add(min);
        pair.add(max);
        return pair;
    }
}
