package io.github.cyfko.sdtp.core.table;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.sdtp.core.api.Table;
import io.github.cyfko.sdtp.core.conversion.WireConversion;
import io.github.cyfko.sdtp.core.evaluation.ColumnIndex;
import io.github.cyfko.sdtp.core.evaluation.FilterEvaluator;
import io.github.cyfko.sdtp.core.exception.ConversionException;
import io.github.cyfko.sdtp.core.exception.SchemaException;
import io.github.cyfko.sdtp.core.model.Column;
import io.github.cyfko.sdtp.core.validation.ValidatedFilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A table over a fixed list of rows held in memory.
 * <p>
 * Rows are checked and converted once, at construction: every row must have one value per
 * column, and every value must convert to its column type, with the column default standing in
 * for missing or unreadable values. Queries then scan the rows with {@link FilterEvaluator}.
 * </p>
 * <p>
 * The table is immutable and safe for concurrent queries.
 * </p>
 *
 * <pre>{@code
 * RowTable people = new RowTable(
 *     List.of(new Column("age", SdtpType.NUMBER), new Column("name", SdtpType.STRING)),
 *     List.of(List.of(30, "a"), List.of(40, "b")));
 * }</pre>
 *
 * @since 1.0.0
 */
public class RowTable implements Table {

    private final ColumnIndex index;
    private final List<List<Object>> rows;

    /**
     * @param columns the schema, in row order
     * @param rows    the rows; values may be native, wire text or {@link JsonNode}
     * @throws SchemaException     if a column name repeats or a row has the wrong length
     * @throws ConversionException if a value cannot be converted and its column has no usable default
     */
    public RowTable(List<Column> columns, List<? extends List<?>> rows) {
        this.index = ColumnIndex.of(columns);
        List<List<Object>> converted = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            converted.add(convertRow(r, rows.get(r)));
        }
        this.rows = Collections.unmodifiableList(converted);
    }

    /**
     * Builds a table from wire rows, such as the cells read from a CSV file or a JSON document.
     *
     * @param columns the schema
     * @param rows    a JSON array of JSON arrays
     * @return the table
     * @throws SchemaException     if {@code rows} is not an array of arrays of the right length
     * @throws ConversionException if a value cannot be converted and its column has no usable default
     */
    public static RowTable fromWire(List<Column> columns, JsonNode rows) {
        if (rows == null || !rows.isArray()) {
            throw new SchemaException("Rows must be a JSON array of arrays");
        }
        List<List<JsonNode>> wireRows = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            JsonNode row = rows.get(r);
            if (!row.isArray()) {
                throw new SchemaException("Row " + r + " is not a JSON array");
            }
            List<JsonNode> values = new ArrayList<>(row.size());
            row.forEach(values::add);
            wireRows.add(values);
        }
        return new RowTable(columns, wireRows);
    }

    @Override
    public List<Column> columns() {
        return index.columns();
    }

    @Override
    public List<List<Object>> getRows(ValidatedFilter filter, List<String> project) {
        Projection projection = Projection.of(index, project);
        List<List<Object>> matching = FilterEvaluator.filterRows(filter, rows, index);
        if (project == null) {
            return matching;
        }
        List<List<Object>> projected = new ArrayList<>(matching.size());
        for (List<Object> row : matching) {
            projected.add(projection.apply(row));
        }
        return projected;
    }

    public int size() {
        return rows.size();
    }

    private List<Object> convertRow(int rowNumber, List<?> row) {
        if (row == null || row.size() != index.size()) {
            throw new SchemaException("Row " + rowNumber + " has " + (row == null ? 0 : row.size())
                    + " values, expected " + index.size());
        }
        List<Object> values = new ArrayList<>(row.size());
        for (int c = 0; c < row.size(); c++) {
            Column column = index.column(c);
            try {
                values.add(WireConversion.coerce(row.get(c), column.type(), column.defaultValue()));
            } catch (ConversionException e) {
                throw new ConversionException("Row " + rowNumber + ", column '" + column.name() + "': "
                        + e.getMessage(), e);
            }
        }
        return Collections.unmodifiableList(values);
    }
}
