package io.github.cyfko.sdtp.core.conversion;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.sdtp.core.api.SdtpType;
import io.github.cyfko.sdtp.core.exception.ConversionException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Moves values between the JSON wire format and their native {@link SdtpType} representation.
 *
 * <h2>Strict parsing</h2>
 * <p>
 * {@link #parse(JsonNode, SdtpType)} and {@link #toNative(Object, SdtpType)} either produce a
 * native value or fail with a {@link ConversionException}. Filter literals go through this path:
 * a literal that does not parse is an error, never silently replaced.
 * </p>
 *
 * <h2>Soft-fail-to-default</h2>
 * <p>
 * {@link #convert(JsonNode, SdtpType, Object)}, {@link #coerce(Object, SdtpType, Object)} and
 * {@link #encode(Object, SdtpType, Object)} clean row values. A missing or unparsable value is
 * replaced by the column default, which is itself checked against the type. Without a default a
 * missing value stays absent ({@code null}) and an unparsable one raises
 * {@link ConversionException}. Defaults are never synthesized.
 * </p>
 *
 * <pre>{@code
 * WireConversion.convert(TextNode.valueOf("2024-02-30"), SdtpType.DATE, "1970-01-01"); // 1970-01-01
 * WireConversion.convert(NullNode.getInstance(), SdtpType.NUMBER, null);              // null (absent)
 * WireConversion.convert(TextNode.valueOf("abc"), SdtpType.NUMBER, null);             // ConversionException
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>All methods are stateless and thread-safe.</p>
 *
 * @since 1.0.0
 */
public final class WireConversion {

    private static final Logger log = Logger.getLogger(WireConversion.class.getName());

    private static final Pattern DECIMAL = Pattern.compile("-?(?:0|[1-9]\\d*)(?:\\.\\d+)?(?:[eE][+-]?\\d+)?");

    private WireConversion() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    // ========================================
    // Wire -> native
    // ========================================

    /**
     * Parses a wire value with no default.
     *
     * @param wire the wire value; {@code null}, JSON null and a missing node are rejected
     * @param type the target type
     * @return the native value, never {@code null}
     * @throws ConversionException if the value does not follow the grammar of {@code type}
     */
    public static Object parse(JsonNode wire, SdtpType type) {
        Objects.requireNonNull(type, "type");
        if (isAbsent(wire)) {
            throw new ConversionException("Missing " + type.wireName() + " value");
        }
        try {
            return switch (type) {
                case STRING -> parseString(wire);
                case NUMBER -> parseNumber(wire);
                case BOOLEAN -> parseBoolean(wire);
                case DATE -> TemporalFormats.parseDate(textOf(wire, type));
                case TIME -> TemporalFormats.parseTime(textOf(wire, type));
                case DATETIME -> TemporalFormats.parseDateTime(textOf(wire, type));
                case OPAQUE -> wire;
            };
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new ConversionException("Cannot read " + describe(wire) + " as " + type.wireName(), e);
        }
    }

    /**
     * Converts a wire value, falling back to {@code defaultValue} when it is missing or does not parse.
     *
     * @param wire         the wire value, may be {@code null}
     * @param type         the target type
     * @param defaultValue the column default (a native value, wire text or {@link JsonNode}), or {@code null} for none
     * @return the native value, or {@code null} when the value is missing and no default is configured
     * @throws ConversionException if the value does not parse and the default is missing or itself invalid
     */
    public static Object convert(JsonNode wire, SdtpType type, Object defaultValue) {
        if (isAbsent(wire)) {
            return defaultValue == null ? null : resolveDefault(defaultValue, type);
        }
        try {
            return parse(wire, type);
        } catch (ConversionException e) {
            if (defaultValue == null) {
                throw e;
            }
            log.fine(() -> "Replacing unreadable " + type.wireName() + " value " + describe(wire) + " by its default");
            return resolveDefault(defaultValue, type);
        }
    }

    // ========================================
    // Native -> native
    // ========================================

    /**
     * Brings a value produced by a backend to the native representation of {@code type}.
     * <p>
     * Accepted besides native values: any {@link Number} for NUMBER; wire text for every type;
     * {@link JsonNode} values (parsed as wire values); a date-time for DATE and TIME (its date or
     * time part); a {@link LocalDate}, {@link ZonedDateTime} or {@link Instant} for DATETIME.
     * </p>
     *
     * @param value a backend value, may be {@code null}
     * @param type  the column type
     * @return the native value, never {@code null}
     * @throws ConversionException if the value cannot represent {@code type}, or is a temporal
     *                             value outside the wire grammar (see {@link TemporalFormats#isRepresentable(Object)})
     */
    public static Object toNative(Object value, SdtpType type) {
        Objects.requireNonNull(type, "type");
        if (value == null) {
            throw new ConversionException("Missing " + type.wireName() + " value");
        }
        if (value instanceof JsonNode node) {
            return parse(node, type);
        }
        if (type.isNative(value)) {
            return requireRepresentable(value, type);
        }
        if (value instanceof String text && type != SdtpType.STRING) {
            return parse(SdtpJson.nodes().textNode(text), type);
        }
        Object converted = switch (type) {
            case NUMBER -> numberOf(value);
            case DATE -> dateOf(value);
            case TIME -> timeOf(value);
            case DATETIME -> dateTimeOf(value);
            default -> null;
        };
        if (converted == null) {
            throw new ConversionException("Cannot use " + value.getClass().getSimpleName() + " value '"
                    + value + "' as " + type.wireName());
        }
        return requireRepresentable(converted, type);
    }

    /**
     * Soft-fail variant of {@link #toNative(Object, SdtpType)}.
     *
     * @param value        a backend value, may be {@code null}
     * @param type         the column type
     * @param defaultValue the column default, or {@code null} for none
     * @return the native value, or {@code null} when {@code value} is absent and no default is configured
     * @throws ConversionException if the value is invalid and no valid default exists
     */
    public static Object coerce(Object value, SdtpType type, Object defaultValue) {
        if (value == null || (value instanceof JsonNode node && isAbsent(node))) {
            return defaultValue == null ? null : resolveDefault(defaultValue, type);
        }
        try {
            return toNative(value, type);
        } catch (ConversionException e) {
            if (defaultValue == null) {
                throw e;
            }
            log.fine(() -> "Replacing unusable " + type.wireName() + " value '" + value + "' by its default");
            return resolveDefault(defaultValue, type);
        }
    }

    // ========================================
    // Native -> wire
    // ========================================

    /**
     * Serializes a native value.
     *
     * @param value a native value of {@code type}, or {@code null} for the absent value
     * @param type  the column type
     * @return the wire value; JSON null for the absent value
     * @throws ConversionException if {@code value} is not native to {@code type} or cannot be written in its grammar
     */
    public static JsonNode serialize(Object value, SdtpType type) {
        if (value == null) {
            return SdtpJson.nodes().nullNode();
        }
        if (!type.isNative(value)) {
            throw new ConversionException("Value '" + value + "' is not a native " + type.wireName() + " value");
        }
        requireRepresentable(value, type);
        return switch (type) {
            case STRING -> SdtpJson.nodes().textNode((String) value);
            case NUMBER -> SdtpJson.nodes().numberNode((BigDecimal) value);
            case BOOLEAN -> SdtpJson.nodes().booleanNode((Boolean) value);
            case DATE -> SdtpJson.nodes().textNode(TemporalFormats.formatDate((LocalDate) value));
            case TIME -> SdtpJson.nodes().textNode(TemporalFormats.formatTime((LocalTime) value));
            case DATETIME -> SdtpJson.nodes().textNode(TemporalFormats.formatDateTime(value));
            case OPAQUE -> opaqueToWire(value);
        };
    }

    /**
     * Cleans then serializes a backend value: {@code serialize(coerce(value, type, defaultValue), type)}.
     *
     * @param value        a backend value, may be {@code null}
     * @param type         the column type
     * @param defaultValue the column default, or {@code null} for none
     * @return the wire value
     * @throws ConversionException if the value is invalid and no valid default exists
     */
    public static JsonNode encode(Object value, SdtpType type, Object defaultValue) {
        return serialize(coerce(value, type, defaultValue), type);
    }

    // ========================================
    // Helpers
    // ========================================

    private static boolean isAbsent(JsonNode wire) {
        return wire == null || wire.isNull() || wire.isMissingNode();
    }

    private static Object requireRepresentable(Object value, SdtpType type) {
        if (type.isTemporal() && !TemporalFormats.isRepresentable(value)) {
            throw new ConversionException("Value '" + value + "' cannot be written as " + type.wireName()
                    + " text (four-digit year and whole-minute offset required)");
        }
        return value;
    }

    private static Object resolveDefault(Object defaultValue, SdtpType type) {
        try {
            return toNative(defaultValue, type);
        } catch (ConversionException e) {
            throw new ConversionException("Default value '" + defaultValue + "' is not a valid "
                    + type.wireName() + " value", e);
        }
    }

    private static String parseString(JsonNode wire) {
        if (!wire.isTextual()) {
            throw new ConversionException("Expected a JSON string, got " + describe(wire));
        }
        return wire.textValue();
    }

    private static BigDecimal parseNumber(JsonNode wire) {
        if (wire.isNumber()) {
            return wire.decimalValue();
        }
        if (wire.isTextual() && DECIMAL.matcher(wire.textValue()).matches()) {
            return new BigDecimal(wire.textValue());
        }
        throw new ConversionException("Expected a number, got " + describe(wire));
    }

    private static Boolean parseBoolean(JsonNode wire) {
        if (wire.isBoolean()) {
            return wire.booleanValue();
        }
        if (wire.isTextual()) {
            String text = wire.textValue().toLowerCase(Locale.ROOT);
            if ("true".equals(text)) {
                return Boolean.TRUE;
            }
            if ("false".equals(text)) {
                return Boolean.FALSE;
            }
        }
        throw new ConversionException("Expected a boolean, got " + describe(wire));
    }

    private static String textOf(JsonNode wire, SdtpType type) {
        if (!wire.isTextual()) {
            throw new ConversionException("Expected " + type.wireName() + " text, got " + describe(wire));
        }
        return wire.textValue();
    }

    private static BigDecimal numberOf(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return new BigDecimal(big);
        }
        if (value instanceof Float f && Float.isFinite(f)) {
            return new BigDecimal(f.toString());
        }
        if (value instanceof Double d && Double.isFinite(d)) {
            return BigDecimal.valueOf(d);
        }
        return null;
    }

    private static LocalDate dateOf(Object value) {
        if (value instanceof LocalDateTime ldt) {
            return ldt.toLocalDate();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toLocalDate();
        }
        return null;
    }

    private static LocalTime timeOf(Object value) {
        if (value instanceof LocalDateTime ldt) {
            return ldt.toLocalTime();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toLocalTime();
        }
        return null;
    }

    private static Object dateTimeOf(Object value) {
        if (value instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toOffsetDateTime();
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        return null;
    }

    private static JsonNode opaqueToWire(Object value) {
        if (value instanceof JsonNode node) {
            return node;
        }
        try {
            return SdtpJson.mapper().valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new ConversionException("Cannot serialize opaque value of type " + value.getClass().getName(), e);
        }
    }

    private static String describe(JsonNode wire) {
        String text = wire.toString();
        return text.length() > 64 ? text.substring(0, 61) + "..." : text;
    }
}
