package io.github.cyfko.sdtp.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.sdtp.core.api.SdtpType;
import io.github.cyfko.sdtp.core.conversion.SdtpJson;
import io.github.cyfko.sdtp.core.conversion.WireConversion;

import java.util.Objects;

/**
 * Smallest and largest value of a column. Both bounds are {@code null} for a column without any
 * present value.
 *
 * @param type column type
 * @param min  smallest native value, or {@code null}
 * @param max  largest native value, or {@code null}
 * @since 1.0.0
 */
public record RangeSpec(SdtpType type, Object min, Object max) {

    public RangeSpec {
        Objects.requireNonNull(type, "type");
        if ((min == null) != (max == null)) {
            throw new IllegalArgumentException("Range bounds must be both present or both absent");
        }
    }

    public boolean isEmpty() {
        return min == null;
    }

    /**
     * @return {@code {"min_val": ..., "max_val": ...}}
     */
    public ObjectNode toWire() {
        ObjectNode node = SdtpJson.nodes().objectNode();
        node.set("min_val", WireConversion.serialize(min, type));
        node.set("max_val", WireConversion.serialize(max, type));
        return node;
    }
}
