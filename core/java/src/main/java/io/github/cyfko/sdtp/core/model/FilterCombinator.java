package io.github.cyfko.sdtp.core.model;

import io.github.cyfko.sdtp.core.api.Op;
import io.github.cyfko.sdtp.core.exception.SpecException;

import java.util.List;

/**
 * AND, OR or NOT over child filters, kept in document order.
 *
 * @param operator  AND, OR or NOT
 * @param arguments children; exactly one for NOT, at least one otherwise
 * @since 1.0.0
 */
public record FilterCombinator(Op operator, List<FilterSpec> arguments) implements FilterSpec {

    public FilterCombinator {
        if (operator == null || !operator.isCombinator()) {
            throw new SpecException("Combinator operator must be AND, OR or NOT, got " + operator);
        }
        arguments = List.copyOf(arguments);
        String arityError = arityError(operator, arguments.size());
        if (arityError != null) {
            throw new SpecException(arityError);
        }
    }

    /**
     * Checks the arity rule of a combinator.
     *
     * @param operator a combinator
     * @param count    number of arguments
     * @return a description of the violation, or {@code null} when {@code count} is legal
     */
    public static String arityError(Op operator, int count) {
        if (operator == Op.NOT && count != 1) {
            return "Operator NOT requires exactly 1 argument, got " + count;
        }
        if (count < 1) {
            return "Operator " + operator.code() + " requires at least 1 argument";
        }
        return null;
    }

    @Override
    public int size() {
        int size = 1;
        for (FilterSpec argument : arguments) {
            size += argument.size();
        }
        return size;
    }
}
