package io.github.cyfko.sdtp.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.sdtp.core.api.SdtpType;
import io.github.cyfko.sdtp.core.api.Table;
import io.github.cyfko.sdtp.core.cache.FilterCacheKey;
import io.github.cyfko.sdtp.core.cache.ValidatedFilterCache;
import io.github.cyfko.sdtp.core.config.SdtpConfig;
import io.github.cyfko.sdtp.core.conversion.SdtpJson;
import io.github.cyfko.sdtp.core.conversion.WireConversion;
import io.github.cyfko.sdtp.core.evaluation.ColumnIndex;
import io.github.cyfko.sdtp.core.exception.BackendException;
import io.github.cyfko.sdtp.core.exception.RequestTimeoutException;
import io.github.cyfko.sdtp.core.exception.SdtpException;
import io.github.cyfko.sdtp.core.exception.SpecException;
import io.github.cyfko.sdtp.core.model.Column;
import io.github.cyfko.sdtp.core.model.QueryRequest;
import io.github.cyfko.sdtp.core.model.QueryResult;
import io.github.cyfko.sdtp.core.parsing.FilterSpecParser;
import io.github.cyfko.sdtp.core.table.Projection;
import io.github.cyfko.sdtp.core.table.TableRegistry;
import io.github.cyfko.sdtp.core.table.TableStatistics;
import io.github.cyfko.sdtp.core.validation.FilterValidator;
import io.github.cyfko.sdtp.core.validation.ValidatedFilter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves SDTP requests against the tables of a {@link TableRegistry}.
 *
 * <h2>Request flow</h2>
 * <ol>
 *   <li>Resolve the table by name ({@code NotFoundError} if absent).</li>
 *   <li>Read its schema, fresh for every request.</li>
 *   <li>Parse and validate the filter against that schema, through the validated-filter cache.</li>
 *   <li>Resolve the projection ({@code SchemaError} on unknown columns).</li>
 *   <li>On a worker thread: fetch rows from the table and encode every value to the wire.</li>
 *   <li>Wait for the worker at most the time budget ({@code TimeoutError} on expiry).</li>
 * </ol>
 * <p>
 * Any failure aborts the whole request; a response never holds partial rows.
 * </p>
 *
 * <h2>Entry points</h2>
 * <ul>
 *   <li>{@link #query(QueryRequest)}: typed, throws {@link SdtpException}.</li>
 *   <li>{@link #handle(JsonNode)} and {@link #handle(String)}: wire level, answer with either the
 *       result document or an error document {@code {"error_kind", "message", "path"}}.</li>
 *   <li>{@link #describeTables()}, {@link #allValues(String, String)} and
 *       {@link #rangeSpec(String, String)}: schema and column summaries.</li>
 * </ul>
 *
 * <pre>{@code
 * TableRegistry registry = new TableRegistry();
 * registry.register("people", peopleTable);
 *
 * try (SdtpDispatcher dispatcher = new SdtpDispatcher(registry, SdtpConfig.defaults())) {
 *     String response = dispatcher.handle("{\"table\": \"people\", \"filter\": "
 *             + "{\"operator\": \"GT\", \"column\": \"age\", \"value\": 35}}");
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class SdtpDispatcher implements AutoCloseable {

    private static final Logger log = Logger.getLogger(SdtpDispatcher.class.getName());

    private final TableRegistry registry;
    private final SdtpConfig config;
    private final FilterSpecParser parser;
    private final ValidatedFilterCache cache;
    private final ExecutorService workers;

    public SdtpDispatcher(TableRegistry registry) {
        this(registry, SdtpConfig.defaults());
    }

    public SdtpDispatcher(TableRegistry registry, SdtpConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.parser = new FilterSpecParser(config.getFilterPolicy());
        this.cache = new ValidatedFilterCache(config.getCachePolicy());
        this.workers = Executors.newFixedThreadPool(config.getWorkerThreads(), workerThreadFactory());
        log.fine(() -> "SDTP dispatcher started with " + config);
    }

    // ========================================
    // Typed API
    // ========================================

    /**
     * Runs one query.
     *
     * @param request the request
     * @return the projected, wire-encoded rows
     * @throws SdtpException on any failure; no partial result is returned
     */
    public QueryResult query(QueryRequest request) {
        Objects.requireNonNull(request, "request");
        long start = System.nanoTime();
        log.fine(() -> String.format("Query on table '%s': filter=%s, columns=%s",
                request.table(), request.filter() != null, request.columns()));

        Table table = registry.get(request.table());
        List<Column> schema = List.copyOf(table.columns());
        ColumnIndex index = ColumnIndex.of(schema);
        ValidatedFilter filter = request.filter() == null ? null : validate(request.table(), schema, request.filter());
        Projection projection = Projection.of(index, request.columns());
        Duration budget = request.timeout() != null ? request.timeout() : config.getRequestTimeout();

        List<List<JsonNode>> rows = await(request.table(), budget,
                () -> encodeRows(projection.columns(), table.getRows(filter, request.columns())));
        QueryResult result = new QueryResult(projection.columns(), rows);

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        log.info(() -> String.format("Query on table '%s' returned %d rows in %d ms",
                request.table(), result.rowCount(), durationMs));
        return result;
    }

    /**
     * Lists the schema of every registered table.
     *
     * @return {@code {"table": [{"name": ..., "type": ...}, ...], ...}}, tables sorted by name
     */
    public ObjectNode describeTables() {
        ObjectNode document = SdtpJson.nodes().objectNode();
        for (Map.Entry<String, List<Column>> entry : registry.schemas().entrySet()) {
            ArrayNode columns = document.putArray(entry.getKey());
            entry.getValue().forEach(column -> columns.add(column.toWire()));
        }
        return document;
    }

    /**
     * @param tableName a table name
     * @param column    a column of that table
     * @return the distinct present values of the column, sorted, as a wire array
     * @throws SdtpException if the table or column is unknown or the column is OPAQUE
     */
    public ArrayNode allValues(String tableName, String column) {
        Table table = registry.get(tableName);
        SdtpType type = table.columnType(column);
        ArrayNode values = SdtpJson.nodes().arrayNode();
        TableStatistics.allValues(table, column).forEach(value -> values.add(WireConversion.serialize(value, type)));
        return values;
    }

    /**
     * @param tableName a table name
     * @param column    a column of that table
     * @return {@code {"min_val": ..., "max_val": ...}}
     * @throws SdtpException if the table or column is unknown or the column is OPAQUE
     */
    public ObjectNode rangeSpec(String tableName, String column) {
        return TableStatistics.rangeSpec(registry.get(tableName), column).toWire();
    }

    // ========================================
    // Wire API
    // ========================================

    /**
     * Answers a request document. Request-level failures are reported as an error document.
     *
     * @param body the request document
     * @return the result document or the error document
     */
    public JsonNode handle(JsonNode body) {
        try {
            return query(QueryRequest.fromWire(body)).toWire();
        } catch (SdtpException e) {
            log.warning(() -> String.format("Request failed with %s%s: %s", e.kind().wireName(),
                    e.hasPath() ? " at '" + e.path() + "'" : "", e.getMessage()));
            return errorDocument(e);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Request failed unexpectedly", e);
            return errorDocument(new BackendException("Unexpected failure: " + e.getMessage(), e));
        }
    }

    /**
     * Answers a request given as JSON text.
     *
     * @param body the request text
     * @return the result document or the error document, as JSON text
     */
    public String handle(String body) {
        JsonNode document;
        try {
            document = SdtpJson.read(body);
        } catch (JsonProcessingException e) {
            SpecException error = new SpecException("Request body is not valid JSON: " + e.getOriginalMessage(), null, e);
            log.warning(() -> "Request failed with " + error.kind().wireName() + ": " + error.getMessage());
            return SdtpJson.write(errorDocument(error));
        }
        return SdtpJson.write(handle(document));
    }

    /**
     * Renders a failure as {@code {"error_kind": ..., "message": ..., "path": ...}}; {@code path}
     * is left out when the failure is not tied to a filter node.
     *
     * @param error the failure
     * @return the error document
     */
    public static ObjectNode errorDocument(SdtpException error) {
        ObjectNode document = SdtpJson.nodes().objectNode();
        document.put("error_kind", error.kind().wireName());
        document.put("message", error.getMessage());
        if (error.hasPath()) {
            document.put("path", error.path());
        }
        return document;
    }

    public SdtpConfig config() {
        return config;
    }

    public ValidatedFilterCache cache() {
        return cache;
    }

    /**
     * Stops the worker threads, interrupting retrievals still running.
     */
    @Override
    public void close() {
        workers.shutdownNow();
        log.fine("SDTP dispatcher closed");
    }

    // ========================================
    // Internals
    // ========================================

    private ValidatedFilter validate(String tableName, List<Column> schema, JsonNode document) {
        if (!config.getCachePolicy().cacheEnabled()) {
            return FilterValidator.validate(parser.parse(document), schema);
        }
        return cache.computeIfAbsent(FilterCacheKey.of(tableName, schema, document), key -> {
            log.fine(() -> "Validating filter for table '" + tableName + "' (not cached)");
            return FilterValidator.validate(parser.parse(document), schema);
        });
    }

    private <T> T await(String tableName, Duration budget, Callable<T> work) {
        Future<T> task;
        try {
            task = workers.submit(work);
        } catch (RejectedExecutionException e) {
            throw new BackendException("Dispatcher is closed", e);
        }
        try {
            return task.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw new RequestTimeoutException(tableName, budget);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted while reading table '" + tableName + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SdtpException sdtp) {
                throw sdtp;
            }
            throw new BackendException("Table '" + tableName + "' failed: " + cause, cause);
        }
    }

    private static List<List<JsonNode>> encodeRows(List<Column> columns, List<List<Object>> rows) {
        List<List<JsonNode>> encoded = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != columns.size()) {
                throw new BackendException("Table returned a row of " + row.size() + " values for "
                        + columns.size() + " columns", null);
            }
            List<JsonNode> values = new ArrayList<>(row.size());
            for (int i = 0; i < row.size(); i++) {
                Column column = columns.get(i);
                values.add(WireConversion.encode(row.get(i), column.type(), column.defaultValue()));
            }
            encoded.add(values);
        }
        return encoded;
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "sdtp-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
