package com.schemaflow.types;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaTest {

    @Test
    void builder_keepsInsertionOrder() {
        Schema schema = Schema.builder()
                .put("b", TypeSpec.floating())
                .put("a", TypeSpec.string())
                .build();

        assertEquals(List.of("b", "a"), schema.keys());
        assertEquals(TypeSpec.string(), schema.get("a").orElseThrow());
        assertTrue(schema.get("c").isEmpty());
    }

    @Test
    void builder_rejectsDuplicateKeys() {
        Schema.Builder builder = Schema.builder().put("a", TypeSpec.floating());
        assertThrows(MalformedContractException.class, () -> builder.put("a", TypeSpec.integer()));
    }

    @Test
    void fromMap_rejectsBlankKeyAndMissingType() {
        Map<String, TypeSpec> withNull = new LinkedHashMap<>();
        withNull.put("a", null);
        assertThrows(MalformedContractException.class, () -> Schema.fromMap(withNull));
        assertThrows(MalformedContractException.class, () -> Schema.fromMap(Map.of(" ", TypeSpec.floating())));
    }

    @Test
    void negativeDimension_isMalformed() {
        assertThrows(MalformedContractException.class, () -> Dimension.fixed(-1));
        assertThrows(MalformedContractException.class, () -> TypeSpec.array(ScalarKind.FLOAT, null, -3));
    }

    @Test
    void malformedDescriptors_failAtConstruction() {
        assertThrows(MalformedContractException.class, () -> TypeSpec.sequence(null));
        assertThrows(MalformedContractException.class, () -> TypeSpec.opaque(" "));
        assertThrows(MalformedContractException.class, () -> TypeSpec.mapping(null, TypeSpec.floating()));
        assertThrows(MalformedContractException.class, () -> ScalarKind.fromName("complex"));
    }
}
