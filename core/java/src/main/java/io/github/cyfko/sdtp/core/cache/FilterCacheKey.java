package io.github.cyfko.sdtp.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.sdtp.core.model.Column;

import java.util.List;
import java.util.StringJoiner;

/**
 * Identity of a validated filter: the table, the schema it was validated against, and the filter
 * document text.
 * <p>
 * The schema fingerprint lists every column name and type in order, so a table whose schema
 * changes gets new keys and never reuses a filter validated against its old schema.
 * </p>
 *
 * @param table             table name
 * @param schemaFingerprint fingerprint of the table schema
 * @param filterText        compact JSON text of the filter document, numbers as Jackson renders them by default
 * @since 1.0.0
 */
public record FilterCacheKey(String table, String schemaFingerprint, String filterText) {

    /**
     * @param table  table name
     * @param schema current schema of the table
     * @param filter the raw filter document
     * @return the key
     */
    public static FilterCacheKey of(String table, List<Column> schema, JsonNode filter) {
        return new FilterCacheKey(table, fingerprint(schema), filter.toString());
    }

    /**
     * @param schema a table schema
     * @return {@code name:type} pairs joined by commas, in schema order
     */
    public static String fingerprint(List<Column> schema) {
        StringJoiner joiner = new StringJoiner(",");
        for (Column column : schema) {
            joiner.add(column.name() + ":" + column.type().wireName());
        }
        return joiner.toString();
    }
}
