package io.github.cyfko.sdtp.core.api;

import io.github.cyfko.sdtp.core.exception.SchemaException;
import io.github.cyfko.sdtp.core.model.Column;
import io.github.cyfko.sdtp.core.validation.ValidatedFilter;

import java.util.List;
import java.util.Optional;

/**
 * A source of rows exposed through SDTP.
 * <p>
 * Implementations decide how rows are produced: an in-memory list, a file, or a query pushed down
 * to a database. Whatever the strategy, {@link #getRows(ValidatedFilter, List)} must return
 * exactly what scanning every row, keeping those accepted by
 * {@link io.github.cyfko.sdtp.core.evaluation.FilterEvaluator}, then projecting would return.
 * </p>
 *
 * <h2>Concurrency</h2>
 * <p>
 * Both operations may be called concurrently by several requests. An implementation whose data
 * changes is responsible for making those reads safe. The schema may change between calls; the
 * dispatcher reads it again for every request.
 * </p>
 *
 * <pre>{@code
 * Table people = new RowTable(
 *     List.of(new Column("age", SdtpType.NUMBER), new Column("name", SdtpType.STRING)),
 *     List.of(List.of(30, "a"), List.of(40, "b")));
 * registry.register("people", people);
 * }</pre>
 *
 * @since 1.0.0
 */
public interface Table {

    /**
     * @return the columns of this table, in row order
     */
    List<Column> columns();

    /**
     * Produces rows of native values.
     *
     * @param filter  a filter validated against {@link #columns()}, or {@code null} for every row
     * @param project column names to return, in that order, or {@code null} for every column
     * @return the matching rows in source order, each laid out as {@code project}
     * @throws SchemaException if {@code project} names an unknown column
     */
    List<List<Object>> getRows(ValidatedFilter filter, List<String> project);

    default List<String> columnNames() {
        return columns().stream().map(Column::name).toList();
    }

    default Optional<Column> column(String name) {
        return columns().stream().filter(column -> column.name().equals(name)).findFirst();
    }

    /**
     * @param name a column name
     * @return the declared type of that column
     * @throws SchemaException if there is no such column
     */
    default SdtpType columnType(String name) {
        return column(name)
                .map(Column::type)
                .orElseThrow(() -> new SchemaException("Unknown column '" + name + "'", name));
    }
}
