package io.github.cyfko.sdtp.core.table;

import io.github.cyfko.sdtp.core.api.Table;
import io.github.cyfko.sdtp.core.exception.TableNotFoundException;
import io.github.cyfko.sdtp.core.model.Column;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Thread-safe directory of the tables served by a dispatcher.
 * <p>
 * The registry only references tables; it does not manage their lifetime. Registering a name
 * that is already taken replaces the previous table.
 * </p>
 *
 * @since 1.0.0
 */
public class TableRegistry {

    private static final Logger log = Logger.getLogger(TableRegistry.class.getName());

    private final Map<String, Table> tables = new ConcurrentHashMap<>();

    /**
     * @param name  table name used in requests
     * @param table the table
     * @return the table previously registered under {@code name}, if any
     */
    public Optional<Table> register(String name, Table table) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be null nor blank");
        }
        Objects.requireNonNull(table, "table");
        Table previous = tables.put(name, table);
        log.info(() -> (previous == null ? "Registered table '" : "Replaced table '") + name + "' with "
                + table.columns().size() + " columns");
        return Optional.ofNullable(previous);
    }

    public Optional<Table> unregister(String name) {
        return Optional.ofNullable(tables.remove(name));
    }

    public Optional<Table> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tables.get(name));
    }

    /**
     * @param name a table name
     * @return the table
     * @throws TableNotFoundException if no table has that name
     */
    public Table get(String name) {
        return find(name).orElseThrow(() -> new TableNotFoundException(name));
    }

    /**
     * @return registered names, sorted
     */
    public List<String> names() {
        return tables.keySet().stream().sorted().toList();
    }

    /**
     * Reads the current schema of every table.
     *
     * @return schemas by table name, sorted by name
     */
    public Map<String, List<Column>> schemas() {
        Map<String, List<Column>> schemas = new LinkedHashMap<>();
        for (String name : names()) {
            find(name).ifPresent(table -> schemas.put(name, table.columns()));
        }
        return schemas;
    }
}
