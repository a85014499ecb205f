package com.schemaflow.types;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static com.schemaflow.types.ScalarKind.FLOAT;
import static com.schemaflow.types.ScalarKind.STRING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TypeSpecJsonTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String SCHEMA_JSON = """
            {
              "x": {"type": "shapedArray", "elementKind": "FLOAT", "dimensions": [null, 3]},
              "alpha": "float",
              "tags": {"type": "sequence", "element": "string"},
              "weights": {"type": "mapping", "keyKind": "STRING", "value": {"type": "scalar", "kind": "FLOAT"}},
              "frame": {"type": "table", "columns": {"price": "float", "city": "string"}},
              "model": {"type": "opaque", "label": "LinearModel"}
            }
            """;

    @Test
    void readSchema_parsesEveryVariant() throws Exception {
        Schema schema = MAPPER.readValue(SCHEMA_JSON, Schema.class);

        assertEquals(TypeSpec.array(FLOAT, null, 3), schema.get("x").orElseThrow());
        assertEquals(TypeSpec.floating(), schema.get("alpha").orElseThrow());
        assertEquals(TypeSpec.sequence(TypeSpec.string()), schema.get("tags").orElseThrow());
        assertEquals(TypeSpec.mapping(STRING, TypeSpec.floating()), schema.get("weights").orElseThrow());
        assertEquals(TypeSpec.table(Schema.of("price", TypeSpec.floating(), "city", TypeSpec.string())),
                schema.get("frame").orElseThrow());
        assertEquals(TypeSpec.opaque("LinearModel"), schema.get("model").orElseThrow());
    }

    @Test
    void writeSchema_roundTrips() throws Exception {
        Schema schema = MAPPER.readValue(SCHEMA_JSON, Schema.class);
        String json = MAPPER.writeValueAsString(schema);

        assertEquals(schema, MAPPER.readValue(json, Schema.class));
    }

    @Test
    void negativeDimensionInJson_isMalformed() {
        String json = "{\"x\": {\"type\": \"shapedArray\", \"elementKind\": \"FLOAT\", \"dimensions\": [-1]}}";

        JsonMappingException e = assertThrows(JsonMappingException.class, () -> MAPPER.readValue(json, Schema.class));
        Throwable cause = e;
        while (cause != null && !(cause instanceof MalformedContractException)) {
            cause = cause.getCause();
        }
        assertInstanceOf(MalformedContractException.class, cause);
    }
}
