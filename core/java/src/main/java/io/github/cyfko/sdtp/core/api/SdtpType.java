package io.github.cyfko.sdtp.core.api;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Objects;

/**
 * The closed set of column types understood by SDTP.
 * <p>
 * Each type names its wire spelling (used in schema documents) and the Java class carrying its
 * native values. Ordering and equality between two native values of the same type are defined
 * here, so the filter evaluator and the column statistics share one set of rules.
 * </p>
 *
 * <table>
 *   <caption>Native representations</caption>
 *   <tr><th>Type</th><th>Wire name</th><th>Native class</th><th>Ordering</th></tr>
 *   <tr><td>{@link #STRING}</td><td>string</td><td>{@link String}</td><td>lexical</td></tr>
 *   <tr><td>{@link #NUMBER}</td><td>number</td><td>{@link BigDecimal}</td><td>numeric, scale-insensitive</td></tr>
 *   <tr><td>{@link #BOOLEAN}</td><td>boolean</td><td>{@link Boolean}</td><td>false &lt; true</td></tr>
 *   <tr><td>{@link #DATE}</td><td>date</td><td>{@link LocalDate}</td><td>chronological</td></tr>
 *   <tr><td>{@link #TIME}</td><td>timeofday</td><td>{@link LocalTime}</td><td>chronological</td></tr>
 *   <tr><td>{@link #DATETIME}</td><td>datetime</td><td>{@link LocalDateTime} or {@link OffsetDateTime}</td>
 *       <td>by instant, values without offset read as UTC</td></tr>
 *   <tr><td>{@link #OPAQUE}</td><td>opaque</td><td>any object</td><td>none, equality only</td></tr>
 * </table>
 *
 * <p>The absent value is {@code null} for every type; the methods below never receive it.</p>
 *
 * @since 1.0.0
 */
public enum SdtpType {

    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    DATE("date"),
    TIME("timeofday"),
    DATETIME("datetime"),

    /** Values passed through untouched; only equality and null checks apply. */
    OPAQUE("opaque");

    private final String wireName;

    SdtpType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return the spelling of this type in schema documents
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire spelling, ignoring case. {@code "time"} is accepted for {@link #TIME}.
     *
     * @param name the wire spelling
     * @return the matching type
     * @throws IllegalArgumentException if no type has that spelling
     * @throws NullPointerException if {@code name} is {@code null}
     */
    public static SdtpType fromWireName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if ("time".equals(normalized)) {
            return TIME;
        }
        for (SdtpType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown column type '" + name + "'");
    }

    /**
     * Indicates whether values of this type have a natural ordering, which LT/LE/GT/GE and
     * BETWEEN require.
     *
     * @return {@code false} only for {@link #OPAQUE}
     */
    public boolean isOrdered() {
        return this != OPAQUE;
    }

    /**
     * @return {@code true} for DATE, TIME and DATETIME
     */
    public boolean isTemporal() {
        return this == DATE || this == TIME || this == DATETIME;
    }

    /**
     * Checks that {@code value} already is a native value of this type.
     *
     * @param value candidate value, may be {@code null}
     * @return {@code true} if no coercion is needed
     */
    public boolean isNative(Object value) {
        if (value == null) {
            return false;
        }
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof BigDecimal;
            case BOOLEAN -> value instanceof Boolean;
            case DATE -> value instanceof LocalDate;
            case TIME -> value instanceof LocalTime;
            case DATETIME -> value instanceof LocalDateTime || value instanceof OffsetDateTime;
            case OPAQUE -> true;
        };
    }

    /**
     * Compares two native values of this type.
     *
     * @param left  a native value of this type
     * @param right a native value of this type
     * @return a negative number, zero or a positive number as {@code left} is before, equal to or after {@code right}
     * @throws UnsupportedOperationException for {@link #OPAQUE}
     * @throws ClassCastException if either value is not native to this type
     */
    public int compare(Object left, Object right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        return switch (this) {
            case STRING -> ((String) left).compareTo((String) right);
            case NUMBER -> ((BigDecimal) left).compareTo((BigDecimal) right);
            case BOOLEAN -> Boolean.compare((Boolean) left, (Boolean) right);
            case DATE -> ((LocalDate) left).compareTo((LocalDate) right);
            case TIME -> ((LocalTime) left).compareTo((LocalTime) right);
            case DATETIME -> compareDateTimes(left, right);
            case OPAQUE -> throw new UnsupportedOperationException("opaque values have no ordering");
        };
    }

    /**
     * Value equality as used by EQ, NE and IN. For ordered types two values are equal when
     * {@link #compare(Object, Object)} returns zero, so {@code 30} equals {@code 30.0}.
     *
     * @param left  a native value of this type
     * @param right a native value of this type
     * @return {@code true} if both denote the same value
     */
    public boolean valuesEqual(Object left, Object right) {
        if (this == OPAQUE) {
            return Objects.equals(left, right);
        }
        return compare(left, right) == 0;
    }

    private static int compareDateTimes(Object left, Object right) {
        if (left instanceof LocalDateTime l && right instanceof LocalDateTime r) {
            return l.compareTo(r);
        }
        return toInstant(left).compareTo(toInstant(right));
    }

    private static Instant toInstant(Object dateTime) {
        if (dateTime instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        return ((LocalDateTime) dateTime).toInstant(ZoneOffset.UTC);
    }
}
