package io.github.cyfko.sdtp.core.table;

import io.github.cyfko.sdtp.core.api.SdtpType;
import io.github.cyfko.sdtp.core.api.Table;
import io.github.cyfko.sdtp.core.conversion.WireConversion;
import io.github.cyfko.sdtp.core.exception.TypeMismatchException;
import io.github.cyfko.sdtp.core.model.RangeSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * Summaries of one column, used by clients to build filter widgets: the distinct values of a
 * column and its value range.
 *
 * @since 1.0.0
 */
public final class TableStatistics {

    private TableStatistics() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Returns the distinct present values of a column, sorted by the column type ordering.
     *
     * @param table  the table
     * @param column a column name
     * @return native values, without the absent value
     * @throws io.github.cyfko.sdtp.core.exception.SchemaException if the column is unknown
     * @throws TypeMismatchException if the column is OPAQUE
     */
    public static List<Object> allValues(Table table, String column) {
        SdtpType type = orderedType(table, column);
        List<Object> values = new ArrayList<>();
        for (List<Object> row : table.getRows(null, List.of(column))) {
            Object value = row.get(0);
            if (value != null) {
                values.add(WireConversion.toNative(value, type));
            }
        }
        values.sort(type::compare);
        List<Object> distinct = new ArrayList<>(values.size());
        for (Object value : values) {
            if (distinct.isEmpty() || !type.valuesEqual(distinct.get(distinct.size() - 1), value)) {
                distinct.add(value);
            }
        }
        return distinct;
    }

    /**
     * Returns the smallest and largest present values of a column.
     *
     * @param table  the table
     * @param column a column name
     * @return the range; both bounds absent if the column has no present value
     * @throws io.github.cyfko.sdtp.core.exception.SchemaException if the column is unknown
     * @throws TypeMismatchException if the column is OPAQUE
     */
    public static RangeSpec rangeSpec(Table table, String column) {
        SdtpType type = orderedType(table, column);
        Object min = null;
        Object max = null;
        for (List<Object> row : table.getRows(null, List.of(column))) {
            if (row.get(0) == null) {
                continue;
            }
            Object value = WireConversion.toNative(row.get(0), type);
            if (min == null || type.compare(value, min) < 0) {
                min = value;
            }
            if (max == null || type.compare(value, max) > 0) {
                max = value;
            }
        }
        return new RangeSpec(type, min, max);
    }

    private static SdtpType orderedType(Table table, String column) {
        SdtpType type = table.columnType(column);
        if (!type.isOrdered()) {
            throw new TypeMismatchException("Column '" + column + "' is " + type.wireName() + " and has no ordering",
                    column);
        }
        return type;
    }
}
