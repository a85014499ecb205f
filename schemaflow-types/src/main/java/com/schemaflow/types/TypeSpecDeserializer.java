package com.schemaflow.types;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Deserializes a type descriptor either as a scalar kind name (e.g. {@code "float"}) or as an object with a
 * {@code "type"} field:
 * <pre>
 * {"type": "scalar", "kind": "FLOAT"}
 * {"type": "sequence", "element": ...}
 * {"type": "shapedArray", "elementKind": "FLOAT", "dimensions": [null, 3]}
 * {"type": "mapping", "keyKind": "STRING", "value": ...}
 * {"type": "table", "columns": {"name": ...}}
 * {"type": "opaque", "label": "..."}
 * </pre>
 * Invalid descriptors raise {@link MalformedContractException}.
 */
public final class TypeSpecDeserializer extends JsonDeserializer<TypeSpec> {

    @Override
    public TypeSpec deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);
        return fromNode(node);
    }

    static TypeSpec fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new MalformedContractException("Type descriptor is missing");
        }
        if (node.isTextual()) {
            return TypeSpec.scalar(ScalarKind.fromName(node.asText()));
        }
        if (!node.isObject()) {
            throw new MalformedContractException("Type descriptor must be a kind name or an object: " + node);
        }
        TypeTag tag = TypeTag.fromJsonName(text(node, "type"));
        switch (tag) {
            case SCALAR:
                return TypeSpec.scalar(ScalarKind.fromName(text(node, "kind")));
            case SEQUENCE:
                return TypeSpec.sequence(fromNode(node.get("element")));
            case SHAPED_ARRAY:
                return TypeSpec.shapedArray(ScalarKind.fromName(text(node, "elementKind")), dimensions(node.get("dimensions")));
            case MAPPING:
                return TypeSpec.mapping(ScalarKind.fromName(text(node, "keyKind")), fromNode(node.get("value")));
            case TABLE:
                return TypeSpec.table(columns(node.get("columns")));
            case OPAQUE:
                return TypeSpec.opaque(text(node, "label"));
            default:
                throw new MalformedContractException("Unhandled type descriptor: " + tag);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static List<Dimension> dimensions(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new MalformedContractException("Shaped array needs a \"dimensions\" array");
        }
        List<Dimension> dims = new ArrayList<>();
        for (JsonNode d : node) {
            if (d.isNull()) {
                dims.add(Dimension.unconstrained());
            } else if (d.isInt()) {
                dims.add(Dimension.fixed(d.intValue()));
            } else {
                throw new MalformedContractException("Dimension must be an integer or null: " + d);
            }
        }
        return dims;
    }

    private static Schema columns(JsonNode node) {
        if (node == null || node.isNull()) {
            return Schema.empty();
        }
        if (!node.isObject()) {
            throw new MalformedContractException("Table \"columns\" must be an object");
        }
        Schema.Builder builder = Schema.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.put(field.getKey(), fromNode(field.getValue()));
        }
        return builder.build();
    }
}
