package io.github.cyfko.sdtp.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.sdtp.core.api.Op;
import io.github.cyfko.sdtp.core.api.SdtpType;
import io.github.cyfko.sdtp.core.conversion.SdtpJson;
import io.github.cyfko.sdtp.core.conversion.WireConversion;
import io.github.cyfko.sdtp.core.model.Column;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A validated predicate on one column.
 * <p>
 * The operand list holds native values of the column type: one value for comparisons, the
 * distinct members for IN, {@code [low, high]} for BETWEEN, and nothing for ISNULL/NOTNULL. A
 * REGEX leaf holds its compiled pattern instead.
 * </p>
 *
 * @since 1.0.0
 */
public final class ValidatedLeaf implements ValidatedFilter {

    private final Op operator;
    private final Column column;
    private final List<Object> operands;
    private final Pattern pattern;

    ValidatedLeaf(Op operator, Column column, List<Object> operands, Pattern pattern) {
        this.operator = operator;
        this.column = column;
        this.operands = List.copyOf(operands);
        this.pattern = pattern;
    }

    @Override
    public Op operator() {
        return operator;
    }

    public Column column() {
        return column;
    }

    public SdtpType type() {
        return column.type();
    }

    /**
     * @return the native operands; empty for ISNULL, NOTNULL and REGEX
     */
    public List<Object> operands() {
        return operands;
    }

    /**
     * @return the single operand of a comparison leaf
     */
    public Object operand() {
        return operands.get(0);
    }

    /**
     * @return the compiled pattern of a REGEX leaf, {@code null} otherwise
     */
    public Pattern pattern() {
        return pattern;
    }

    @Override
    public Set<String> referencedColumns() {
        return Set.of(column.name());
    }

    @Override
    public List<Object> columnValues(String columnName) {
        if (!column.name().equals(columnName)) {
            return List.of();
        }
        if (operator == Op.REGEX) {
            return List.of(pattern.pattern());
        }
        return operands;
    }

    @Override
    public JsonNode toWire() {
        ObjectNode node = SdtpJson.nodes().objectNode();
        node.put("operator", operator.code());
        node.put("column", column.name());
        switch (operator.kind()) {
            case NULL_CHECK -> {
                // no operand
            }
            case PATTERN -> node.put("value", pattern.pattern());
            case MEMBERSHIP, RANGE -> {
                ArrayNode values = node.putArray("value");
                operands.forEach(operand -> values.add(WireConversion.serialize(operand, type())));
            }
            default -> node.set("value", WireConversion.serialize(operand(), type()));
        }
        return node;
    }

    @Override
    public String toString() {
        return SdtpJson.write(toWire());
    }
}
