package io.github.cyfko.sdtp.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.sdtp.core.api.Op;
import io.github.cyfko.sdtp.core.exception.SpecException;

/**
 * A predicate on one column.
 * <p>
 * {@code value} holds the raw operand: a scalar for comparisons and REGEX, an array for IN and
 * BETWEEN, and {@code null} for ISNULL/NOTNULL.
 * </p>
 *
 * @param operator a non-combinator operator
 * @param column   the column name, not yet checked against a schema
 * @param value    the raw operand
 * @since 1.0.0
 */
public record FilterLeaf(Op operator, String column, JsonNode value) implements FilterSpec {

    public FilterLeaf {
        if (operator == null || operator.isCombinator()) {
            throw new SpecException("Leaf operator must be a comparison, got " + operator);
        }
        if (column == null || column.isBlank()) {
            throw new SpecException("Leaf column cannot be null nor blank");
        }
        boolean hasValue = value != null && !value.isMissingNode();
        if (operator.requiresValue() && !hasValue) {
            throw new SpecException("Operator " + operator.code() + " requires a value");
        }
        if (!operator.requiresValue()) {
            if (hasValue && !value.isNull()) {
                throw new SpecException("Operator " + operator.code() + " takes no value");
            }
            value = null;
        }
    }

    @Override
    public int size() {
        return 1;
    }
}
