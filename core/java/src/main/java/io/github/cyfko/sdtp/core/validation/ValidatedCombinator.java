package io.github.cyfko.sdtp.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.sdtp.core.api.Op;
import io.github.cyfko.sdtp.core.conversion.SdtpJson;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A validated AND, OR or NOT node.
 *
 * @since 1.0.0
 */
public final class ValidatedCombinator implements ValidatedFilter {

    private final Op operator;
    private final List<ValidatedFilter> arguments;

    ValidatedCombinator(Op operator, List<ValidatedFilter> arguments) {
        this.operator = operator;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public Op operator() {
        return operator;
    }

    public List<ValidatedFilter> arguments() {
        return arguments;
    }

    @Override
    public Set<String> referencedColumns() {
        Set<String> columns = new LinkedHashSet<>();
        arguments.forEach(argument -> columns.addAll(argument.referencedColumns()));
        return Collections.unmodifiableSet(columns);
    }

    @Override
    public List<Object> columnValues(String column) {
        List<Object> values = new ArrayList<>();
        for (ValidatedFilter argument : arguments) {
            for (Object value : argument.columnValues(column)) {
                if (!values.contains(value)) {
                    values.add(value);
                }
            }
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public JsonNode toWire() {
        ObjectNode node = SdtpJson.nodes().objectNode();
        node.put("operator", operator.code());
        ArrayNode children = node.putArray("arguments");
        arguments.forEach(argument -> children.add(argument.toWire()));
        return node;
    }

    @Override
    public String toString() {
        return SdtpJson.write(toWire());
    }
}
