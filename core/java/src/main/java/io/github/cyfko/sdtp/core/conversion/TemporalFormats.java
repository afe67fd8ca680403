package io.github.cyfko.sdtp.core.conversion;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The fixed textual grammars of DATE, TIME and DATETIME values.
 * <p>
 * Accepted input:
 * </p>
 * <ul>
 *   <li>DATE: {@code YYYY-MM-DD}</li>
 *   <li>TIME: {@code HH:MM:SS} with an optional fraction of one to nine digits</li>
 *   <li>DATETIME: a DATE, {@code T} or a single space, a TIME, then optionally {@code Z} or {@code ±HH:MM}</li>
 * </ul>
 * <p>
 * Input must match the grammar literally and denote a real date or time, so {@code 2023-02-30},
 * {@code 24:00:00} and {@code 2023-1-5} are all rejected. Output always uses {@code T} as the
 * separator, omits a zero fraction, drops trailing zeros of a non-zero fraction, and renders a
 * zero offset as {@code Z}. Only years 0000 to 9999 and offsets in whole minutes can be written;
 * see {@link #isRepresentable(Object)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class TemporalFormats {

    private static final String DATE_GRAMMAR = "\\d{4}-\\d{2}-\\d{2}";
    private static final String TIME_GRAMMAR = "\\d{2}:\\d{2}:\\d{2}(?:\\.\\d{1,9})?";

    private static final Pattern DATE = Pattern.compile(DATE_GRAMMAR);
    private static final Pattern TIME = Pattern.compile(TIME_GRAMMAR);
    private static final Pattern DATETIME = Pattern.compile(
            "(" + DATE_GRAMMAR + ")[T ](" + TIME_GRAMMAR + ")(Z|[+-]\\d{2}:\\d{2})?");

    private static final DateTimeFormatter TIME_OUT = new DateTimeFormatterBuilder()
            .appendPattern("HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .toFormatter();

    private static final DateTimeFormatter DATETIME_OUT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .append(TIME_OUT)
            .toFormatter();

    private static final DateTimeFormatter OFFSET_DATETIME_OUT = new DateTimeFormatterBuilder()
            .append(DATETIME_OUT)
            .appendOffset("+HH:MM", "Z")
            .toFormatter();

    private TemporalFormats() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * @param text candidate text
     * @return the date
     * @throws DateTimeParseException if {@code text} is not a valid DATE
     */
    public static LocalDate parseDate(String text) {
        if (!DATE.matcher(text).matches()) {
            throw new DateTimeParseException("Expected YYYY-MM-DD", text, 0);
        }
        return LocalDate.parse(text);
    }

    /**
     * @param text candidate text
     * @return the time of day
     * @throws DateTimeParseException if {@code text} is not a valid TIME
     */
    public static LocalTime parseTime(String text) {
        if (!TIME.matcher(text).matches()) {
            throw new DateTimeParseException("Expected HH:MM:SS[.fraction]", text, 0);
        }
        return LocalTime.parse(text);
    }

    /**
     * Parses a DATETIME. The result is an {@link OffsetDateTime} when the text carries an offset
     * and a {@link LocalDateTime} otherwise.
     *
     * @param text candidate text
     * @return the date-time
     * @throws DateTimeParseException if {@code text} is not a valid DATETIME
     */
    public static Object parseDateTime(String text) {
        Matcher matcher = DATETIME.matcher(text);
        if (!matcher.matches()) {
            throw new DateTimeParseException("Expected YYYY-MM-DD(T| )HH:MM:SS[.fraction][Z|±HH:MM]", text, 0);
        }
        LocalDateTime local = LocalDateTime.of(LocalDate.parse(matcher.group(1)), LocalTime.parse(matcher.group(2)));
        String offset = matcher.group(3);
        if (offset == null) {
            return local;
        }
        try {
            return OffsetDateTime.of(local, ZoneOffset.of(offset));
        } catch (DateTimeException e) {
            throw new DateTimeParseException("Offset out of range", text, matcher.start(3), e);
        }
    }

    /**
     * Tells whether a temporal value can be written in the grammar and read back unchanged: the
     * year must have four digits and an offset must be whole minutes.
     *
     * @param value a {@link LocalDate}, {@link LocalDateTime} or {@link OffsetDateTime}; other values are accepted
     * @return {@code false} if formatting {@code value} would produce text outside the grammar
     */
    public static boolean isRepresentable(Object value) {
        if (value instanceof LocalDate date) {
            return hasFourDigitYear(date.getYear());
        }
        if (value instanceof LocalDateTime ldt) {
            return hasFourDigitYear(ldt.getYear());
        }
        if (value instanceof OffsetDateTime odt) {
            return hasFourDigitYear(odt.getYear()) && odt.getOffset().getTotalSeconds() % 60 == 0;
        }
        return true;
    }

    public static String formatDate(LocalDate date) {
        return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
    }

    public static String formatTime(LocalTime time) {
        return TIME_OUT.format(time);
    }

    /**
     * @param dateTime a {@link LocalDateTime} or an {@link OffsetDateTime}
     * @return its canonical text
     */
    public static String formatDateTime(Object dateTime) {
        if (dateTime instanceof OffsetDateTime odt) {
            return OFFSET_DATETIME_OUT.format(odt);
        }
        return DATETIME_OUT.format((LocalDateTime) dateTime);
    }

    private static boolean hasFourDigitYear(int year) {
        return year >= 0 && year <= 9999;
    }
}
