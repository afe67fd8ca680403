package io.github.cyfko.sdtp.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.sdtp.core.exception.SpecException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * One table query, as received on the wire.
 *
 * <pre>{@code
 * {
 *   "table": "people",
 *   "filter": {"operator": "GT", "column": "age", "value": 35},
 *   "columns": ["name", "age"],
 *   "timeout_ms": 500
 * }
 * }</pre>
 *
 * <p>{@code filter}, {@code columns} and {@code timeout_ms} are optional.</p>
 *
 * @param table   name of the target table
 * @param filter  raw filter document, or {@code null} to return every row
 * @param columns projection, or {@code null} to return every column in schema order
 * @param timeout request-specific time budget, or {@code null} to use the configured one
 * @since 1.0.0
 */
public record QueryRequest(String table, JsonNode filter, List<String> columns, Duration timeout) {

    public QueryRequest {
        if (table == null || table.isBlank()) {
            throw new SpecException("Request field 'table' cannot be null nor blank", "table");
        }
        if (filter != null && (filter.isNull() || filter.isMissingNode())) {
            filter = null;
        }
        columns = columns == null ? null : List.copyOf(columns);
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new SpecException("Request timeout must be positive, got " + timeout, "timeout_ms");
        }
    }

    /**
     * Request for every row and column of a table.
     *
     * @param table table name
     */
    public QueryRequest(String table) {
        this(table, null, null, null);
    }

    /**
     * @param table  table name
     * @param filter raw filter document, may be {@code null}
     */
    public QueryRequest(String table, JsonNode filter) {
        this(table, filter, null, null);
    }

    /**
     * Reads a request document.
     *
     * @param body the request body
     * @return the request
     * @throws SpecException if the document does not have the request shape
     */
    public static QueryRequest fromWire(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new SpecException("Request body must be a JSON object");
        }
        JsonNode table = body.get("table");
        if (table == null || !table.isTextual()) {
            throw new SpecException("Request field 'table' must be a string", "table");
        }
        return new QueryRequest(table.textValue(), body.get("filter"), readColumns(body.get("columns")),
                readTimeout(body.get("timeout_ms")));
    }

    private static List<String> readColumns(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new SpecException("Request field 'columns' must be an array of strings", "columns");
        }
        List<String> columns = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode name = node.get(i);
            if (!name.isTextual()) {
                throw new SpecException("Column names must be strings", FilterPath.element("", "columns", i));
            }
            columns.add(name.textValue());
        }
        return columns;
    }

    private static Duration readTimeout(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.canConvertToLong() || !node.isIntegralNumber()) {
            throw new SpecException("Request field 'timeout_ms' must be an integer", "timeout_ms");
        }
        return Duration.ofMillis(node.longValue());
    }
}
