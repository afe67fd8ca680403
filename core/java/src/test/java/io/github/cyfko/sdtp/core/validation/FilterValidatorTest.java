package io.github.cyfko.sdtp.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.sdtp.core.api.Op;
import io.github.cyfko.sdtp.core.api.SdtpType;
import io.github.cyfko.sdtp.core.config.FilterPolicy;
import io.github.cyfko.sdtp.core.conversion.SdtpJson;
import io.github.cyfko.sdtp.core.exception.ErrorKind;
import io.github.cyfko.sdtp.core.exception.SchemaException;
import io.github.cyfko.sdtp.core.exception.SdtpException;
import io.github.cyfko.sdtp.core.exception.SpecException;
import io.github.cyfko.sdtp.core.exception.TypeMismatchException;
import io.github.cyfko.sdtp.core.model.Column;
import io.github.cyfko.sdtp.core.model.FilterLeaf;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FilterValidator Tests")
class FilterValidatorTest {

    private static final List<Column> SCHEMA = List.of(
            new Column("age", SdtpType.NUMBER),
            new Column("name", SdtpType.STRING),
            new Column("born", SdtpType.DATE),
            new Column("active", SdtpType.BOOLEAN),
            new Column("payload", SdtpType.OPAQUE));

    private static JsonNode json(String text) {
        try {
            return SdtpJson.read(text.replace('\'', '"'));
        } catch (Exception e) {
            throw new IllegalArgumentException(text, e);
        }
    }

    private static ValidatedFilter validate(String document) {
        return FilterValidator.validate(json(document), SCHEMA, FilterPolicy.defaults());
    }

    private static SdtpException failure(String document) {
        return assertThrows(SdtpException.class, () -> validate(document));
    }

    // ============================================================================
    // Soundness
    // ============================================================================

    @Nested
    @DisplayName("Well-formed filters")
    class WellFormed {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "{'operator': 'EQ', 'column': 'age', 'value': 30}",
                "{'operator': 'NE', 'column': 'name', 'value': 'a'}",
                "{'operator': 'LT', 'column': 'born', 'value': '2000-01-01'}",
                "{'operator': 'LE', 'column': 'age', 'value': '30.5'}",
                "{'operator': 'GT', 'column': 'active', 'value': false}",
                "{'operator': 'GE', 'column': 'name', 'value': 'm'}",
                "{'operator': 'IN', 'column': 'age', 'value': [1, 2, 3]}",
                "{'operator': 'BETWEEN', 'column': 'born', 'value': ['2000-01-01', '2010-12-31']}",
                "{'operator': 'REGEX', 'column': 'name', 'value': '^[a-c]+$'}",
                "{'operator': 'ISNULL', 'column': 'payload'}",
                "{'operator': 'NOTNULL', 'column': 'age'}",
                "{'operator': 'EQ', 'column': 'payload', 'value': {'k': [1]}}",
                "{'operator': 'AND', 'arguments': [{'operator': 'OR', 'arguments': [{'operator': 'ISNULL', 'column': 'age'}]}]}"
        })
        @DisplayName("Should validate filters built from schema columns with typed literals")
        void shouldValidate(String document) {
            assertDoesNotThrow(() -> validate(document));
        }

        @Test
        @DisplayName("Should convert literals to native values")
        void shouldConvertLiterals() {
            ValidatedLeaf leaf = (ValidatedLeaf) validate("{'operator': 'LT', 'column': 'born', 'value': '2000-01-01'}");

            assertEquals(LocalDate.of(2000, 1, 1), leaf.operand());
            assertEquals(SdtpType.DATE, leaf.type());
        }

        @Test
        @DisplayName("Should normalize reversed BETWEEN bounds")
        void shouldNormalizeBetween() {
            ValidatedLeaf leaf = (ValidatedLeaf) validate("{'operator': 'BETWEEN', 'column': 'age', 'value': [40, 30]}");

            assertEquals(List.of(new BigDecimal("30"), new BigDecimal("40")), leaf.operands());
        }

        @Test
        @DisplayName("Should drop repeated IN members keeping first occurrences")
        void shouldDeduplicateIn() {
            ValidatedLeaf leaf = (ValidatedLeaf) validate("{'operator': 'IN', 'column': 'age', 'value': [3, 1, 3.0, '1', 2]}");

            assertEquals(List.of(new BigDecimal("3"), new BigDecimal("1"), new BigDecimal("2")), leaf.operands());
        }

        @Test
        @DisplayName("Should deduplicate a long IN list quickly and in order")
        void shouldDeduplicateLongInList() {
            // Given
            StringBuilder members = new StringBuilder();
            for (int i = 0; i < 5_000; i++) {
                members.append(i == 0 ? "" : ",").append(4_999 - i);
            }
            members.append(",0,4999");
            JsonNode document = json("{'operator': 'IN', 'column': 'age', 'value': [" + members + "]}");

            // When
            ValidatedLeaf leaf = (ValidatedLeaf) assertTimeout(Duration.ofSeconds(2),
                    () -> FilterValidator.validate(document, SCHEMA, FilterPolicy.relaxed()));

            // Then
            assertEquals(5_000, leaf.operands().size());
            assertEquals(new BigDecimal("4999"), leaf.operands().get(0));
            assertEquals(new BigDecimal("0"), leaf.operands().get(4_999));
        }

        @Test
        @DisplayName("Should render the canonical wire form")
        void shouldRenderCanonicalWireForm() {
            ValidatedFilter filter = validate("{'operator': 'ALL', 'arguments': ["
                    + "{'operator': 'IN_RANGE', 'column': 'age', 'min_val': 9, 'max_val': '1'},"
                    + "{'operator': 'IS_NULL', 'column': 'name'}]}");

            assertEquals("{\"operator\":\"AND\",\"arguments\":["
                            + "{\"operator\":\"BETWEEN\",\"column\":\"age\",\"value\":[1,9]},"
                            + "{\"operator\":\"ISNULL\",\"column\":\"name\"}]}",
                    SdtpJson.write(filter.toWire()));
        }

        @Test
        @DisplayName("Should validate a programmatically built tree")
        void shouldValidateBuiltTree() {
            FilterLeaf leaf = new FilterLeaf(Op.GE, "age", SdtpJson.nodes().numberNode(18));

            ValidatedFilter filter = FilterValidator.validate(leaf, SCHEMA);

            assertEquals(Op.GE, filter.operator());
        }
    }

    @Nested
    @DisplayName("Filter introspection")
    class Introspection {

        @Test
        @DisplayName("Should list referenced columns in first-mention order")
        void shouldListReferencedColumns() {
            ValidatedFilter filter = validate("{'operator': 'OR', 'arguments': ["
                    + "{'operator': 'EQ', 'column': 'name', 'value': 'a'},"
                    + "{'operator': 'GT', 'column': 'age', 'value': 3},"
                    + "{'operator': 'EQ', 'column': 'name', 'value': 'b'}]}");

            assertEquals(List.of("name", "age"), List.copyOf(filter.referencedColumns()));
        }

        @Test
        @DisplayName("Should collect the operands of one column across the tree")
        void shouldCollectColumnValues() {
            ValidatedFilter filter = validate("{'operator': 'OR', 'arguments': ["
                    + "{'operator': 'IN', 'column': 'name', 'value': ['a', 'b']},"
                    + "{'operator': 'GT', 'column': 'age', 'value': 3},"
                    + "{'operator': 'NOT', 'arguments': [{'operator': 'EQ', 'column': 'name', 'value': 'c'}]},"
                    + "{'operator': 'EQ', 'column': 'name', 'value': 'a'}]}");

            assertEquals(List.of("a", "b", "c"), filter.columnValues("name"));
            assertEquals(List.of(new BigDecimal("3")), filter.columnValues("age"));
            assertEquals(List.of(), filter.columnValues("born"));
            assertEquals(Set.of("name", "age"), filter.referencedColumns());
        }
    }

    // ============================================================================
    // Failures by kind
    // ============================================================================

    @Nested
    @DisplayName("Rejected filters")
    class Rejected {

        @Test
        @DisplayName("Should report an unknown top-level column by name")
        void shouldReportUnknownColumn() {
            SdtpException e = failure("{'operator': 'GT', 'column': 'height', 'value': 3}");

            assertInstanceOf(SchemaException.class, e);
            assertEquals(ErrorKind.SCHEMA, e.kind());
            assertEquals("height", e.path());
        }

        @Test
        @DisplayName("Should report the full path of a nested unknown column")
        void shouldReportNestedUnknownColumn() {
            SdtpException e = failure("{'operator': 'AND', 'arguments': ["
                    + "{'operator': 'GT', 'column': 'age', 'value': 3},"
                    + "{'operator': 'NOT', 'arguments': [{'operator': 'ISNULL', 'column': 'height'}]}]}");

            assertEquals(ErrorKind.SCHEMA, e.kind());
            assertEquals("AND[1].NOT[0].height", e.path());
        }

        @Test
        @DisplayName("Should report the first failing child only")
        void shouldStopAtFirstFailure() {
            SdtpException e = failure("{'operator': 'OR', 'arguments': ["
                    + "{'operator': 'GT', 'column': 'age', 'value': 'old'},"
                    + "{'operator': 'EQ', 'column': 'height', 'value': 3}]}");

            assertEquals(ErrorKind.TYPE, e.kind());
            assertEquals("OR[0].value", e.path());
        }

        @Test
        @DisplayName("Should reject a literal of the wrong type")
        void shouldRejectMismatchedLiteral() {
            SdtpException e = failure("{'operator': 'EQ', 'column': 'born', 'value': '2023-02-30'}");

            assertInstanceOf(TypeMismatchException.class, e);
            assertEquals("value", e.path());
        }

        @Test
        @DisplayName("Should reject a null literal")
        void shouldRejectNullLiteral() {
            assertEquals(ErrorKind.TYPE, failure("{'operator': 'EQ', 'column': 'age', 'value': null}").kind());
        }

        @Test
        @DisplayName("Should locate a bad IN member")
        void shouldLocateBadInMember() {
            SdtpException e = failure("{'operator': 'IN', 'column': 'age', 'value': [1, 'x']}");

            assertEquals(ErrorKind.TYPE, e.kind());
            assertEquals("value[1]", e.path());
        }

        @Test
        @DisplayName("Should reject an empty IN")
        void shouldRejectEmptyIn() {
            SdtpException e = failure("{'operator': 'IN', 'column': 'age', 'value': []}");

            assertInstanceOf(SpecException.class, e);
            assertEquals("value", e.path());
        }

        @Test
        @DisplayName("Should reject IN with a scalar")
        void shouldRejectScalarIn() {
            assertEquals(ErrorKind.SPEC, failure("{'operator': 'IN', 'column': 'age', 'value': 1}").kind());
        }

        @Test
        @DisplayName("Should reject BETWEEN without exactly two bounds")
        void shouldRejectBetweenArity() {
            assertEquals(ErrorKind.SPEC, failure("{'operator': 'BETWEEN', 'column': 'age', 'value': [1, 2, 3]}").kind());
            assertEquals(ErrorKind.SPEC, failure("{'operator': 'BETWEEN', 'column': 'age', 'value': 1}").kind());
        }

        @Test
        @DisplayName("Should reject REGEX on a non-string column")
        void shouldRejectRegexOnNumbers() {
            SdtpException e = failure("{'operator': 'REGEX', 'column': 'age', 'value': '3.*'}");

            assertEquals(ErrorKind.TYPE, e.kind());
        }

        @Test
        @DisplayName("Should reject a pattern that does not compile")
        void shouldRejectBadPattern() {
            SdtpException e = failure("{'operator': 'REGEX', 'column': 'name', 'value': '(unclosed'}");

            assertEquals(ErrorKind.TYPE, e.kind());
            assertEquals("value", e.path());
        }

        @Test
        @DisplayName("Should reject ordering on opaque columns")
        void shouldRejectOrderingOnOpaque() {
            SdtpException e = failure("{'operator': 'LT', 'column': 'payload', 'value': 1}");

            assertEquals(ErrorKind.TYPE, e.kind());
            assertEquals("operator", e.path());
        }

        @Test
        @DisplayName("Should reject unknown operators and wrong arity as shape errors")
        void shouldRejectShapeErrors() {
            assertEquals(ErrorKind.SPEC, failure("{'operator': 'CONTAINS', 'column': 'age', 'value': 1}").kind());
            assertEquals(ErrorKind.SPEC, failure("{'operator': 'NOT', 'arguments': []}").kind());
        }
    }
}
