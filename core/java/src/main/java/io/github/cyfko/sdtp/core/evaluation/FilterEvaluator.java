package io.github.cyfko.sdtp.core.evaluation;

import io.github.cyfko.sdtp.core.api.SdtpType;
import io.github.cyfko.sdtp.core.conversion.WireConversion;
import io.github.cyfko.sdtp.core.exception.BackendException;
import io.github.cyfko.sdtp.core.validation.ValidatedCombinator;
import io.github.cyfko.sdtp.core.validation.ValidatedFilter;
import io.github.cyfko.sdtp.core.validation.ValidatedLeaf;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which rows a {@link ValidatedFilter} keeps.
 *
 * <h2>Leaf semantics</h2>
 * <ul>
 *   <li>EQ, NE and IN use the value equality of the column type, so {@code 30} equals {@code 30.0}.</li>
 *   <li>LT, LE, GT and GE use the natural ordering of the column type.</li>
 *   <li>BETWEEN is inclusive on both bounds.</li>
 *   <li>REGEX matches the whole value, not a substring.</li>
 *   <li>ISNULL and NOTNULL test for the absent value ({@code null}).</li>
 * </ul>
 * <p>
 * Every other operator is false on an absent value, NE included.
 * </p>
 *
 * <h2>Combinators</h2>
 * <p>
 * AND and OR evaluate their arguments left to right and stop at the first argument that decides
 * the result. Short-circuiting only changes which leaves run, never the outcome.
 * </p>
 *
 * <p>
 * Row values are expected to be native values of their column type. A non-native value, such as
 * an {@link Integer} in a NUMBER column, is coerced first.
 * </p>
 *
 * @since 1.0.0
 */
public final class FilterEvaluator {

    private FilterEvaluator() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Tests one row.
     *
     * @param filter the validated filter
     * @param row    the row, laid out as {@code index}
     * @param index  column positions of the row
     * @return {@code true} if the row is kept
     */
    public static boolean evaluate(ValidatedFilter filter, List<?> row, ColumnIndex index) {
        if (filter instanceof ValidatedLeaf leaf) {
            return evaluateLeaf(leaf, row, index);
        }
        ValidatedCombinator combinator = (ValidatedCombinator) filter;
        switch (combinator.operator()) {
            case AND -> {
                for (ValidatedFilter argument : combinator.arguments()) {
                    if (!evaluate(argument, row, index)) {
                        return false;
                    }
                }
                return true;
            }
            case OR -> {
                for (ValidatedFilter argument : combinator.arguments()) {
                    if (evaluate(argument, row, index)) {
                        return true;
                    }
                }
                return false;
            }
            case NOT -> {
                return !evaluate(combinator.arguments().get(0), row, index);
            }
            default -> throw new IllegalStateException("Not a combinator: " + combinator.operator());
        }
    }

    /**
     * Keeps the rows accepted by {@code filter}, in their original order.
     * <p>
     * The scan stops with a {@link BackendException} once the current thread is interrupted,
     * so a cancelled query releases its worker.
     * </p>
     *
     * @param filter the validated filter, or {@code null} to keep every row
     * @param rows   the rows to scan
     * @param index  column positions of the rows
     * @param <R>    row type
     * @return the matching rows
     */
    public static <R extends List<?>> List<R> filterRows(ValidatedFilter filter, List<R> rows, ColumnIndex index) {
        if (filter == null) {
            return new ArrayList<>(rows);
        }
        List<R> kept = new ArrayList<>();
        for (R row : rows) {
            checkInterrupted();
            if (evaluate(filter, row, index)) {
                kept.add(row);
            }
        }
        return kept;
    }

    private static boolean evaluateLeaf(ValidatedLeaf leaf, List<?> row, ColumnIndex index) {
        SdtpType type = leaf.type();
        Object value = row.get(index.positionOf(leaf.column().name()));
        if (value != null && !type.isNative(value)) {
            value = WireConversion.toNative(value, type);
        }

        switch (leaf.operator()) {
            case ISNULL -> {
                return value == null;
            }
            case NOTNULL -> {
                return value != null;
            }
            default -> {
                if (value == null) {
                    return false;
                }
            }
        }

        return switch (leaf.operator()) {
            case EQ -> type.valuesEqual(value, leaf.operand());
            case NE -> !type.valuesEqual(value, leaf.operand());
            case LT -> type.compare(value, leaf.operand()) < 0;
            case LE -> type.compare(value, leaf.operand()) <= 0;
            case GT -> type.compare(value, leaf.operand()) > 0;
            case GE -> type.compare(value, leaf.operand()) >= 0;
            case IN -> isMember(type, value, leaf.operands());
            case BETWEEN -> type.compare(value, leaf.operands().get(0)) >= 0
                    && type.compare(value, leaf.operands().get(1)) <= 0;
            case REGEX -> leaf.pattern().matcher(new InterruptibleText((String) value)).matches();
            default -> throw new IllegalStateException("Not a leaf operator: " + leaf.operator());
        };
    }

    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new BackendException("Row scan interrupted", null);
        }
    }

    /**
     * Text that aborts a regular expression match once the current thread is interrupted.
     */
    private static final class InterruptibleText implements CharSequence {

        private final CharSequence text;

        InterruptibleText(CharSequence text) {
            this.text = text;
        }

        @Override
        public char charAt(int index) {
            checkInterrupted();
            return text.charAt(index);
        }

        @Override
        public int length() {
            return text.length();
        }

        @Override
        public CharSequence subSequence(int start, int end) {
            return new InterruptibleText(text.subSequence(start, end));
        }

        @Override
        public String toString() {
            return text.toString();
        }
    }

    private static boolean isMember(SdtpType type, Object value, List<Object> members) {
        for (Object member : members) {
            if (type.valuesEqual(value, member)) {
                return true;
            }
        }
        return false;
    }
}
