package io.github.cyfko.sdtp.core.table;

import io.github.cyfko.sdtp.core.evaluation.ColumnIndex;
import io.github.cyfko.sdtp.core.exception.SchemaException;
import io.github.cyfko.sdtp.core.model.Column;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Narrows and reorders rows to a requested list of columns.
 *
 * @since 1.0.0
 */
public final class Projection {

    private final List<Column> columns;
    private final int[] positions;

    private Projection(List<Column> columns, int[] positions) {
        this.columns = List.copyOf(columns);
        this.positions = positions;
    }

    /**
     * Resolves a projection against a schema.
     *
     * @param index the schema
     * @param names requested columns, in output order, or {@code null} for the whole schema
     * @return the projection
     * @throws SchemaException if a requested column is not in the schema
     */
    public static Projection of(ColumnIndex index, List<String> names) {
        if (names == null) {
            int[] identity = new int[index.size()];
            for (int i = 0; i < identity.length; i++) {
                identity[i] = i;
            }
            return new Projection(index.columns(), identity);
        }
        List<Column> columns = new ArrayList<>(names.size());
        int[] positions = new int[names.size()];
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            if (!index.contains(name)) {
                throw new SchemaException("Projection names unknown column '" + name + "'");
            }
            positions[i] = index.positionOf(name);
            columns.add(index.column(positions[i]));
        }
        return new Projection(columns, positions);
    }

    /**
     * @return the output columns
     */
    public List<Column> columns() {
        return columns;
    }

    /**
     * @param row a row laid out as the source schema
     * @return a new row laid out as {@link #columns()}
     */
    public List<Object> apply(List<?> row) {
        List<Object> projected = new ArrayList<>(positions.length);
        for (int position : positions) {
            projected.add(row.get(position));
        }
        return Collections.unmodifiableList(projected);
    }
}
