package io.github.cyfko.sdtp.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.sdtp.core.api.SdtpType;
import io.github.cyfko.sdtp.core.conversion.SdtpJson;
import io.github.cyfko.sdtp.core.exception.SchemaException;

import java.util.Objects;

/**
 * A named, typed column of a table.
 * <p>
 * A column may carry a default value used to clean row values that are missing or unreadable.
 * The default is given either as a native value of {@link #type()} or as its wire text, and is
 * checked against the type each time it is used.
 * </p>
 *
 * <pre>{@code
 * new Column("age", SdtpType.NUMBER);
 * new Column("born", SdtpType.DATE, "1970-01-01");
 * }</pre>
 *
 * @param name         column name, unique within its table
 * @param type         declared type
 * @param defaultValue cleansing default, or {@code null} for none
 * @since 1.0.0
 */
public record Column(String name, SdtpType type, Object defaultValue) {

    public Column {
        if (name == null || name.isBlank()) {
            throw new SchemaException("Column name cannot be null nor blank");
        }
        Objects.requireNonNull(type, "type");
    }

    /**
     * Creates a column without default.
     *
     * @param name column name
     * @param type declared type
     */
    public Column(String name, SdtpType type) {
        this(name, type, null);
    }

    /**
     * @return {@code true} if a cleansing default is configured
     */
    public boolean hasDefault() {
        return defaultValue != null;
    }

    /**
     * Renders the column as it appears in schema and result documents.
     *
     * @return {@code {"name": ..., "type": ...}}
     */
    public ObjectNode toWire() {
        ObjectNode node = SdtpJson.nodes().objectNode();
        node.put("name", name);
        node.put("type", type.wireName());
        return node;
    }

    /**
     * Reads a column descriptor {@code {"name": ..., "type": ..., "default_value": ...}}.
     *
     * @param node the descriptor
     * @return the column
     * @throws SchemaException if the descriptor is malformed or names an unknown type
     */
    public static Column fromWire(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new SchemaException("Column descriptor must be a JSON object");
        }
        JsonNode name = node.get("name");
        JsonNode type = node.get("type");
        if (name == null || !name.isTextual() || type == null || !type.isTextual()) {
            throw new SchemaException("Column descriptor needs string fields 'name' and 'type'");
        }
        SdtpType sdtpType;
        try {
            sdtpType = SdtpType.fromWireName(type.textValue());
        } catch (IllegalArgumentException e) {
            throw new SchemaException(e.getMessage(), name.textValue());
        }
        JsonNode defaultValue = node.get("default_value");
        boolean hasDefault = defaultValue != null && !defaultValue.isNull();
        return new Column(name.textValue(), sdtpType, hasDefault ? defaultValue : null);
    }
}
