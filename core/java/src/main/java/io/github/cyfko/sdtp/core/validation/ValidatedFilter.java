package io.github.cyfko.sdtp.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.sdtp.core.api.Op;

import java.util.List;
import java.util.Set;

/**
 * A filter proven consistent with one table schema.
 * <p>
 * Instances are only created by {@link FilterValidator}. Every column they mention exists in the
 * schema they were validated against, every operand is a native value of its column type, BETWEEN
 * bounds are ordered and IN operands are distinct. Evaluation therefore never validates again.
 * </p>
 * <p>
 * Validated filters are immutable and may be shared between threads and cached.
 * </p>
 *
 * @since 1.0.0
 * @see ValidatedLeaf
 * @see ValidatedCombinator
 */
public interface ValidatedFilter {

    /**
     * @return the operator of this node
     */
    Op operator();

    /**
     * Returns every column this filter reads, in first-mention order.
     *
     * @return column names, never empty for a leaf
     */
    Set<String> referencedColumns();

    /**
     * Collects every operand compared against {@code column} anywhere in the tree, without
     * duplicates. Backends that push a filter down to a parameterized source can use it to fetch
     * candidate values.
     *
     * @param column a column name
     * @return native operand values, in first-seen order; empty if the column is not mentioned
     */
    List<Object> columnValues(String column);

    /**
     * Renders the filter in canonical wire form: canonical operator codes, {@code value} operands
     * serialized per column type, BETWEEN bounds in ascending order.
     *
     * @return the filter document
     */
    JsonNode toWire();
}
