package io.github.cyfko.sdtp.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.sdtp.core.conversion.SdtpJson;

import java.util.List;

/**
 * A successful query answer: the projected columns and the wire-encoded rows.
 *
 * @param columns columns of the answer, in row order
 * @param rows    rows of wire values, each as long as {@code columns}
 * @since 1.0.0
 */
public record QueryResult(List<Column> columns, List<List<JsonNode>> rows) {

    public QueryResult {
        columns = List.copyOf(columns);
        rows = rows.stream().map(List::copyOf).toList();
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * @return {@code {"columns": [{"name": ..., "type": ...}, ...], "rows": [[...], ...]}}
     */
    public ObjectNode toWire() {
        ObjectNode document = SdtpJson.nodes().objectNode();
        ArrayNode columnNodes = document.putArray("columns");
        columns.forEach(column -> columnNodes.add(column.toWire()));
        ArrayNode rowNodes = document.putArray("rows");
        for (List<JsonNode> row : rows) {
            rowNodes.addArray().addAll(row);
        }
        return document;
    }
}
