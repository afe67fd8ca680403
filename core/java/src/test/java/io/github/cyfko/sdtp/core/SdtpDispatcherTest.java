package io.github.cyfko.sdtp.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.sdtp.core.api.SdtpType;
import io.github.cyfko.sdtp.core.api.Table;
import io.github.cyfko.sdtp.core.config.CachePolicy;
import io.github.cyfko.sdtp.core.config.SdtpConfig;
import io.github.cyfko.sdtp.core.conversion.SdtpJson;
import io.github.cyfko.sdtp.core.exception.ErrorKind;
import io.github.cyfko.sdtp.core.exception.SdtpException;
import io.github.cyfko.sdtp.core.model.Column;
import io.github.cyfko.sdtp.core.model.QueryRequest;
import io.github.cyfko.sdtp.core.model.QueryResult;
import io.github.cyfko.sdtp.core.table.RowTable;
import io.github.cyfko.sdtp.core.table.TableRegistry;
import io.github.cyfko.sdtp.core.validation.ValidatedFilter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("SdtpDispatcher Tests")
class SdtpDispatcherTest {

    private static final List<Column> PEOPLE_SCHEMA = List.of(
            new Column("age", SdtpType.NUMBER),
            new Column("name", SdtpType.STRING));

    private TableRegistry registry;
    private SdtpDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new TableRegistry();
        registry.register("people", new RowTable(PEOPLE_SCHEMA, List.of(List.of(30, "a"), List.of(40, "b"))));
        dispatcher = new SdtpDispatcher(registry, SdtpConfig.builder().workerThreads(2).build());
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    private static String json(String text) {
        return text.replace('\'', '"');
    }

    // ============================================================================
    // Wire requests against an in-memory table
    // ============================================================================

    @Nested
    @DisplayName("Wire requests")
    class WireRequests {

        @Test
        @DisplayName("Should answer a filtered query with columns and rows")
        void shouldAnswerFilteredQuery() {
            String response = dispatcher.handle(json(
                    "{'table': 'people', 'filter': {'operator': 'GT', 'column': 'age', 'value': 35}}"));

            assertEquals(json("{'columns':[{'name':'age','type':'number'},{'name':'name','type':'string'}],"
                    + "'rows':[[40,'b']]}"), response);
        }

        @Test
        @DisplayName("Should answer a conjunction")
        void shouldAnswerConjunction() {
            String response = dispatcher.handle(json("{'table': 'people', 'filter': {'operator': 'AND', 'arguments': ["
                    + "{'operator': 'GE', 'column': 'age', 'value': 30},"
                    + "{'operator': 'EQ', 'column': 'name', 'value': 'a'}]}}"));

            assertTrue(response.endsWith(json("'rows':[[30,'a']]}")), response);
        }

        @Test
        @DisplayName("Should return every row without a filter, projected")
        void shouldProjectWithoutFilter() {
            String response = dispatcher.handle(json("{'table': 'people', 'columns': ['name']}"));

            assertEquals(json("{'columns':[{'name':'name','type':'string'}],'rows':[['a'],['b']]}"), response);
        }

        @Test
        @DisplayName("Should report an unknown filter column with its path")
        void shouldReportUnknownColumn() {
            String response = dispatcher.handle(json(
                    "{'table': 'people', 'filter': {'operator': 'GT', 'column': 'height', 'value': 3}}"));

            assertEquals("{\"error_kind\":\"SchemaError\",\"message\":\"Unknown column 'height'\",\"path\":\"height\"}",
                    response);
        }

        @Test
        @DisplayName("Should report an unknown projection column without path")
        void shouldReportUnknownProjection() throws Exception {
            JsonNode response = SdtpJson.read(dispatcher.handle(json("{'table': 'people', 'columns': ['height']}")));

            assertEquals("SchemaError", response.get("error_kind").textValue());
            assertFalse(response.has("path"));
        }

        @Test
        @DisplayName("Should report an unknown table")
        void shouldReportUnknownTable() throws Exception {
            JsonNode response = SdtpJson.read(dispatcher.handle(json("{'table': 'ghosts'}")));

            assertEquals("NotFoundError", response.get("error_kind").textValue());
        }

        @Test
        @DisplayName("Should report a bad literal as a type error")
        void shouldReportBadLiteral() throws Exception {
            JsonNode response = SdtpJson.read(dispatcher.handle(json("{'table': 'people', 'filter': {'operator': 'OR',"
                    + " 'arguments': [{'operator': 'ISNULL', 'column': 'age'}, {'operator': 'LT', 'column': 'age', 'value': 'old'}]}}")));

            assertEquals("TypeError", response.get("error_kind").textValue());
            assertEquals("OR[1].value", response.get("path").textValue());
        }

        @Test
        @DisplayName("Should report malformed requests as spec errors")
        void shouldReportMalformedRequests() throws Exception {
            JsonNode notJson = SdtpJson.read(dispatcher.handle("{table"));
            JsonNode noTable = SdtpJson.read(dispatcher.handle("{}"));

            assertEquals("SpecError", notJson.get("error_kind").textValue());
            assertFalse(notJson.has("path"));
            assertEquals("SpecError", noTable.get("error_kind").textValue());
            assertEquals("table", noTable.get("path").textValue());
        }

        @Test
        @DisplayName("Should describe every table")
        void shouldDescribeTables() {
            registry.register("cities", new RowTable(List.of(new Column("city", SdtpType.STRING)), List.of()));

            assertEquals(json("{'cities':[{'name':'city','type':'string'}],"
                            + "'people':[{'name':'age','type':'number'},{'name':'name','type':'string'}]}"),
                    SdtpJson.write(dispatcher.describeTables()));
        }

        @Test
        @DisplayName("Should summarize a column")
        void shouldSummarizeColumn() {
            assertEquals("[\"a\",\"b\"]", SdtpJson.write(dispatcher.allValues("people", "name")));
            assertEquals(json("{'min_val':30,'max_val':40}"), SdtpJson.write(dispatcher.rangeSpec("people", "age")));
            assertThrows(SdtpException.class, () -> dispatcher.allValues("ghosts", "name"));
        }

        @Test
        @DisplayName("Should reuse validated filters for repeated queries")
        void shouldReuseValidatedFilters() {
            String request = json("{'table': 'people', 'filter': {'operator': 'EQ', 'column': 'name', 'value': 'a'}}");

            String first = dispatcher.handle(request);
            String second = dispatcher.handle(request);

            assertEquals(first, second);
            assertEquals(1, dispatcher.cache().misses());
            assertEquals(1, dispatcher.cache().hits());
        }

        @Test
        @DisplayName("Should answer a literal with an extreme exponent the same with and without cache")
        void shouldAnswerExtremeExponentWithAndWithoutCache() {
            // Given
            String request = json("{'table': 'people', 'filter': {'operator': 'NE', 'column': 'age', 'value': 1e-99999}}");
            String expected = json("{'columns':[{'name':'age','type':'number'},{'name':'name','type':'string'}],"
                    + "'rows':[[30,'a'],[40,'b']]}");

            try (SdtpDispatcher uncached = new SdtpDispatcher(registry,
                    SdtpConfig.builder().cachePolicy(CachePolicy.none()).workerThreads(1).build())) {
                // When
                String cachedResponse = dispatcher.handle(request);
                String uncachedResponse = uncached.handle(request);

                // Then
                assertEquals(expected, cachedResponse);
                assertEquals(expected, uncachedResponse);
            }
        }
    }

    // ============================================================================
    // Typed requests against a mocked backend
    // ============================================================================

    @Nested
    @DisplayName("Backend interaction")
    class Backend {

        private Table table;

        @BeforeEach
        void setUp() {
            table = mock(Table.class);
            when(table.columns()).thenReturn(PEOPLE_SCHEMA);
            registry.register("remote", table);
        }

        private QueryRequest request(String filter, List<String> columns, Duration timeout) throws Exception {
            JsonNode node = filter == null ? null : SdtpJson.read(json(filter));
            return new QueryRequest("remote", node, columns, timeout);
        }

        @Test
        @DisplayName("Should hand the validated filter and projection to the table")
        void shouldPassFilterAndProjection() throws Exception {
            // Given
            when(table.getRows(any(), any())).thenReturn(List.of(List.of("b")));
            ArgumentCaptor<ValidatedFilter> captor = ArgumentCaptor.forClass(ValidatedFilter.class);

            // When
            QueryResult result = dispatcher.query(request("{'operator': 'IN_LIST', 'column': 'age', 'values': [40, 41]}",
                    List.of("name"), null));

            // Then
            verify(table).getRows(captor.capture(), eq(List.of("name")));
            assertEquals(json("{'operator':'IN','column':'age','value':[40,41]}"), SdtpJson.write(captor.getValue().toWire()));
            assertEquals(1, result.rowCount());
            assertEquals(List.of(new Column("name", SdtpType.STRING)), result.columns());
        }

        @Test
        @DisplayName("Should pass a null filter when the request has none")
        void shouldPassNullFilter() throws Exception {
            when(table.getRows(any(), any())).thenReturn(List.of());

            dispatcher.query(request(null, null, null));

            verify(table).getRows(isNull(), isNull());
        }

        @Test
        @DisplayName("Should write a backend number with an extreme exponent in scientific notation")
        void shouldWriteExtremeBackendNumber() throws Exception {
            // Given
            when(table.getRows(any(), any())).thenReturn(List.of(List.of(new BigDecimal("1E-99999"))));

            // When
            JsonNode response = SdtpJson.read(dispatcher.handle(json("{'table': 'remote', 'columns': ['age']}")));

            // Then
            assertFalse(response.has("error_kind"), response.toString());
            assertEquals(0, new BigDecimal("1E-99999").compareTo(response.get("rows").get(0).get(0).decimalValue()));
        }

        @Test
        @DisplayName("Should give up on a table slower than the request budget")
        void shouldTimeOut() throws Exception {
            when(table.getRows(any(), any())).thenAnswer(invocation -> {
                Thread.sleep(5_000);
                return List.of();
            });

            SdtpException e = assertThrows(SdtpException.class,
                    () -> dispatcher.query(request(null, null, Duration.ofMillis(50))));

            assertEquals(ErrorKind.TIMEOUT, e.kind());
        }

        @Test
        @DisplayName("Should report backend failures as internal errors")
        void shouldReportBackendFailure() throws Exception {
            when(table.getRows(any(), any())).thenThrow(new IllegalStateException("connection reset"));

            SdtpException e = assertThrows(SdtpException.class, () -> dispatcher.query(request(null, null, null)));

            assertEquals(ErrorKind.INTERNAL, e.kind());
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }

        @Test
        @DisplayName("Should fail the whole request on an unencodable value")
        void shouldFailOnUnencodableValue() throws Exception {
            when(table.getRows(any(), any())).thenReturn(List.of(List.of(30, "a"), List.of("many", "b")));

            SdtpException e = assertThrows(SdtpException.class, () -> dispatcher.query(request(null, null, null)));

            assertEquals(ErrorKind.CONVERSION, e.kind());
        }

        @Test
        @DisplayName("Should reject rows that do not match the projection")
        void shouldRejectMisshapenRows() throws Exception {
            when(table.getRows(any(), any())).thenReturn(List.of(List.of(30)));

            SdtpException e = assertThrows(SdtpException.class, () -> dispatcher.query(request(null, null, null)));

            assertEquals(ErrorKind.INTERNAL, e.kind());
        }

        @Test
        @DisplayName("Should fill unencodable values with the column default")
        void shouldApplyDefaultsWhenEncoding() throws Exception {
            when(table.columns()).thenReturn(List.of(new Column("age", SdtpType.NUMBER, -1)));
            when(table.getRows(any(), any())).thenReturn(List.of(List.of("many")));

            QueryResult result = dispatcher.query(request(null, null, null));

            assertEquals("[[-1]]", SdtpJson.write(result.toWire().get("rows")));
        }

        @Test
        @DisplayName("Should validate against the schema current at request time")
        void shouldFollowSchemaChanges() throws Exception {
            // Given
            AtomicReference<List<Column>> schema = new AtomicReference<>(PEOPLE_SCHEMA);
            when(table.columns()).thenAnswer(invocation -> schema.get());
            when(table.getRows(any(), any())).thenReturn(List.of());
            String filter = "{'operator': 'GT', 'column': 'age', 'value': 3}";
            dispatcher.query(request(filter, List.of("name"), null));

            // When
            schema.set(List.of(new Column("name", SdtpType.STRING)));

            // Then
            SdtpException e = assertThrows(SdtpException.class, () -> dispatcher.query(request(filter, List.of("name"), null)));
            assertEquals(ErrorKind.SCHEMA, e.kind());
            assertEquals("age", e.path());
        }
    }

    @Test
    @DisplayName("Should refuse requests once closed")
    void shouldRefuseWhenClosed() {
        dispatcher.close();

        SdtpException e = assertThrows(SdtpException.class, () -> dispatcher.query(new QueryRequest("people")));

        assertEquals(ErrorKind.INTERNAL, e.kind());
    }

    @Test
    @DisplayName("Should validate directly when caching is disabled")
    void shouldWorkWithoutCache() {
        try (SdtpDispatcher uncached = new SdtpDispatcher(registry,
                SdtpConfig.builder().cachePolicy(CachePolicy.none()).workerThreads(1).build())) {
            String request = json("{'table': 'people', 'filter': {'operator': 'ISNULL', 'column': 'age'}}");

            assertTrue(uncached.handle(request).endsWith(json("'rows':[]}")));
            assertEquals(0, uncached.cache().size());
        }
    }
}
