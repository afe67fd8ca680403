package io.github.cyfko.sdtp.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.cyfko.sdtp.core.api.SdtpType;
import io.github.cyfko.sdtp.core.conversion.SdtpJson;
import io.github.cyfko.sdtp.core.exception.SchemaException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Column Tests")
class ColumnTest {

    @Test
    @DisplayName("Should read a descriptor with a default value")
    void shouldReadDescriptor() throws Exception {
        Column column = Column.fromWire(SdtpJson.read(
                "{\"name\": \"born\", \"type\": \"date\", \"default_value\": \"1970-01-01\"}"));

        assertEquals("born", column.name());
        assertEquals(SdtpType.DATE, column.type());
        assertTrue(column.hasDefault());
        assertEquals("\"1970-01-01\"", SdtpJson.write((JsonNode) column.defaultValue()));
    }

    @Test
    @DisplayName("Should treat a null default as no default")
    void shouldIgnoreNullDefault() throws Exception {
        Column column = Column.fromWire(SdtpJson.read("{\"name\": \"at\", \"type\": \"time\", \"default_value\": null}"));

        assertEquals(SdtpType.TIME, column.type());
        assertFalse(column.hasDefault());
    }

    @Test
    @DisplayName("Should render name and type only")
    void shouldRenderWireForm() {
        Column column = new Column("at", SdtpType.TIME, "00:00:00");

        assertEquals("{\"name\":\"at\",\"type\":\"timeofday\"}", SdtpJson.write(column.toWire()));
    }

    @Test
    @DisplayName("Should reject malformed descriptors")
    void shouldRejectMalformedDescriptors() throws Exception {
        assertThrows(SchemaException.class, () -> Column.fromWire(SdtpJson.read("[]")));
        assertThrows(SchemaException.class, () -> Column.fromWire(SdtpJson.read("{\"name\": \"a\"}")));
        SchemaException e = assertThrows(SchemaException.class,
                () -> Column.fromWire(SdtpJson.read("{\"name\": \"a\", \"type\": \"money\"}")));
        assertEquals("a", e.path());
        assertThrows(SchemaException.class, () -> new Column(" ", SdtpType.STRING));
        assertThrows(NullPointerException.class, () -> new Column("a", null));
    }
}
