package io.github.cyfko.sdtp.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.sdtp.core.api.Op;
import io.github.cyfko.sdtp.core.api.SdtpType;
import io.github.cyfko.sdtp.core.config.FilterPolicy;
import io.github.cyfko.sdtp.core.conversion.WireConversion;
import io.github.cyfko.sdtp.core.exception.ConversionException;
import io.github.cyfko.sdtp.core.exception.SchemaException;
import io.github.cyfko.sdtp.core.exception.SpecException;
import io.github.cyfko.sdtp.core.exception.TypeMismatchException;
import io.github.cyfko.sdtp.core.model.Column;
import io.github.cyfko.sdtp.core.model.FilterCombinator;
import io.github.cyfko.sdtp.core.model.FilterLeaf;
import io.github.cyfko.sdtp.core.model.FilterPath;
import io.github.cyfko.sdtp.core.model.FilterSpec;
import io.github.cyfko.sdtp.core.parsing.FilterSpecParser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a {@link FilterSpec} against a table schema and produces a {@link ValidatedFilter}.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Every leaf column exists in the schema, else {@link SchemaException}.</li>
 *   <li>Every literal converts to its column type with no default, else {@link TypeMismatchException}.</li>
 *   <li>LT, LE, GT, GE and BETWEEN need an ordered column type; REGEX needs a STRING column.</li>
 *   <li>IN takes a non-empty array, BETWEEN an array of exactly two literals, else {@link SpecException}.</li>
 *   <li>REGEX literals must compile.</li>
 * </ul>
 * <p>
 * BETWEEN bounds given high-to-low are swapped, and repeated IN members are dropped keeping the
 * first occurrence. Validation stops at the first failing node and reports its path from the root,
 * for example {@code "AND[1].value"}. No row data is read.
 * </p>
 *
 * <pre>{@code
 * List<Column> schema = List.of(new Column("age", SdtpType.NUMBER), new Column("name", SdtpType.STRING));
 * ValidatedFilter filter = FilterValidator.validate(spec, schema);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class FilterValidator {

    private FilterValidator() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Validates a parsed filter.
     *
     * @param spec   the filter tree
     * @param schema the columns of the target table
     * @return the validated filter
     * @throws SchemaException       if a column is unknown
     * @throws TypeMismatchException if a literal or operator does not fit its column type
     * @throws SpecException         if an operand has the wrong shape
     */
    public static ValidatedFilter validate(FilterSpec spec, List<Column> schema) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(schema, "schema");
        Map<String, Column> columns = new HashMap<>();
        schema.forEach(column -> columns.put(column.name(), column));
        return validateNode(spec, columns, FilterPath.ROOT);
    }

    /**
     * Parses then validates a wire filter document.
     *
     * @param document the filter document
     * @param schema   the columns of the target table
     * @param policy   size limits for the document
     * @return the validated filter
     */
    public static ValidatedFilter validate(JsonNode document, List<Column> schema, FilterPolicy policy) {
        return validate(new FilterSpecParser(policy).parse(document), schema);
    }

    private static ValidatedFilter validateNode(FilterSpec spec, Map<String, Column> columns, String path) {
        if (spec instanceof FilterLeaf leaf) {
            return validateLeaf(leaf, columns, path);
        }
        if (spec instanceof FilterCombinator combinator) {
            List<ValidatedFilter> arguments = new ArrayList<>(combinator.arguments().size());
            for (int i = 0; i < combinator.arguments().size(); i++) {
                String childPath = FilterPath.child(path, combinator.operator(), i);
                arguments.add(validateNode(combinator.arguments().get(i), columns, childPath));
            }
            return new ValidatedCombinator(combinator.operator(), arguments);
        }
        throw new SpecException("Unsupported filter node " + spec.getClass().getName(), FilterPath.node(path, "filter"));
    }

    private static ValidatedLeaf validateLeaf(FilterLeaf leaf, Map<String, Column> columns, String path) {
        Op operator = leaf.operator();
        Column column = columns.get(leaf.column());
        if (column == null) {
            throw new SchemaException("Unknown column '" + leaf.column() + "'", FilterPath.field(path, leaf.column()));
        }
        SdtpType type = column.type();

        if (operator.requiresOrdering() && !type.isOrdered()) {
            throw new TypeMismatchException("Operator " + operator.code() + " needs an ordered column, '"
                    + column.name() + "' is " + type.wireName(), FilterPath.field(path, "operator"));
        }

        String valuePath = FilterPath.field(path, "value");
        JsonNode value = leaf.value();
        return switch (operator.kind()) {
            case NULL_CHECK -> new ValidatedLeaf(operator, column, List.of(), null);
            case COMPARISON, ORDERING ->
                    new ValidatedLeaf(operator, column, List.of(literal(value, type, valuePath)), null);
            case MEMBERSHIP -> new ValidatedLeaf(operator, column, members(value, type, path), null);
            case RANGE -> new ValidatedLeaf(operator, column, bounds(value, type, path), null);
            case PATTERN -> new ValidatedLeaf(operator, column, List.of(), pattern(value, column, valuePath));
            case COMBINATOR -> throw new SpecException("Combinator used as a leaf", FilterPath.node(path, operator.code()));
        };
    }

    private static Object literal(JsonNode value, SdtpType type, String path) {
        try {
            return WireConversion.parse(value, type);
        } catch (ConversionException e) {
            throw new TypeMismatchException(e.getMessage(), path, e);
        }
    }

    private static List<Object> members(JsonNode value, SdtpType type, String path) {
        if (!value.isArray()) {
            throw new SpecException("Operator IN needs an array of values", FilterPath.field(path, "value"));
        }
        if (value.isEmpty()) {
            throw new SpecException("Operator IN needs at least one value", FilterPath.field(path, "value"));
        }
        List<Object> members = new ArrayList<>(value.size());
        Set<Object> seen = type.isOrdered() ? new TreeSet<>(type::compare) : new HashSet<>();
        for (int i = 0; i < value.size(); i++) {
            Object member = literal(value.get(i), type, FilterPath.element(path, "value", i));
            if (seen.add(member)) {
                members.add(member);
            }
        }
        return members;
    }

    private static List<Object> bounds(JsonNode value, SdtpType type, String path) {
        if (!value.isArray() || value.size() != 2) {
            throw new SpecException("Operator BETWEEN needs an array of exactly 2 values", FilterPath.field(path, "value"));
        }
        Object first = literal(value.get(0), type, FilterPath.element(path, "value", 0));
        Object second = literal(value.get(1), type, FilterPath.element(path, "value", 1));
        return type.compare(first, second) <= 0 ? List.of(first, second) : List.of(second, first);
    }

    private static Pattern pattern(JsonNode value, Column column, String path) {
        if (column.type() != SdtpType.STRING) {
            throw new TypeMismatchException("Operator REGEX needs a string column, '" + column.name() + "' is "
                    + column.type().wireName(), path);
        }
        if (!value.isTextual()) {
            throw new TypeMismatchException("Operator REGEX needs a string pattern", path);
        }
        try {
            return Pattern.compile(value.textValue());
        } catch (PatternSyntaxException e) {
            throw new TypeMismatchException("Invalid regular expression: " + e.getDescription(), path, e);
        }
    }
}
