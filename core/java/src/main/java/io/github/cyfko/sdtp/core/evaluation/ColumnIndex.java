package io.github.cyfko.sdtp.core.evaluation;

import io.github.cyfko.sdtp.core.exception.SchemaException;
import io.github.cyfko.sdtp.core.model.Column;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps column names to their position in a row.
 *
 * @since 1.0.0
 */
public final class ColumnIndex {

    private final List<Column> columns;
    private final Map<String, Integer> positions;

    private ColumnIndex(List<Column> columns) {
        this.columns = List.copyOf(columns);
        Map<String, Integer> map = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            String name = this.columns.get(i).name();
            if (map.putIfAbsent(name, i) != null) {
                throw new SchemaException("Duplicate column '" + name + "'");
            }
        }
        this.positions = Collections.unmodifiableMap(map);
    }

    /**
     * @param columns a table schema, in row order
     * @return the index of that schema
     * @throws SchemaException if two columns share a name
     */
    public static ColumnIndex of(List<Column> columns) {
        return new ColumnIndex(columns);
    }

    /**
     * @param name a column name
     * @return its row position
     * @throws SchemaException if the schema has no such column
     */
    public int positionOf(String name) {
        Integer position = positions.get(name);
        if (position == null) {
            throw new SchemaException("Unknown column '" + name + "'", name);
        }
        return position;
    }

    public boolean contains(String name) {
        return positions.containsKey(name);
    }

    public Column column(int position) {
        return columns.get(position);
    }

    public List<Column> columns() {
        return columns;
    }

    public int size() {
        return columns.size();
    }
}
