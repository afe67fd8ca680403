package io.github.cyfko.sdtp.core.conversion;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Shared Jackson setup for SDTP wire documents.
 * <p>
 * Numbers are kept as exact {@link java.math.BigDecimal} values in both directions: floats are
 * read as decimals, trailing zeros are not stripped, and decimals are written in plain notation.
 * A NUMBER value therefore leaves the server with the digits it was given. Jackson refuses plain
 * notation for a scale beyond &plusmn;9999; such documents are written in scientific notation instead.
 * </p>
 *
 * @since 1.0.0
 */
public final class SdtpJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .nodeFactory(NODES)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private static final ObjectWriter SCIENTIFIC = MAPPER.writer()
            .without(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

    private SdtpJson() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * @return the process-wide mapper; thread-safe once configured
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * @return the node factory used for every document built by this library
     */
    public static JsonNodeFactory nodes() {
        return NODES;
    }

    /**
     * Reads a JSON text into a tree.
     *
     * @param text the document
     * @return the parsed tree
     * @throws JsonProcessingException if {@code text} is not valid JSON
     */
    public static JsonNode read(String text) throws JsonProcessingException {
        return MAPPER.readTree(text);
    }

    /**
     * Writes a tree as compact JSON text. Decimals are plain unless their scale is out of the
     * range plain notation allows, in which case the whole document uses scientific notation.
     *
     * @param node the document
     * @return its JSON text
     */
    public static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException plainFailure) {
            try {
                return SCIENTIFIC.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                e.addSuppressed(plainFailure);
                throw new IllegalStateException("Cannot serialize JSON tree", e);
            }
        }
    }
}
