package com.schemaflow.chain;

import com.schemaflow.contract.SchemaOperation;
import com.schemaflow.types.Schema;
import com.schemaflow.types.TypeInference;
import com.schemaflow.types.TypeSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Schema state carried across one simulated pass over a chain. Entries start as the payload's concrete values (or
 * declared types) and are replaced by declared types as each link's output operations are folded in.
 * Not thread-safe; one instance per pass.
 */
final class WorkingSchema {

    private final Map<String, Object> entries;
    private final Map<String, String> producers = new LinkedHashMap<>();

    private WorkingSchema(Map<String, ?> initial) {
        this.entries = new LinkedHashMap<>(initial);
    }

    static WorkingSchema fromPayload(Map<String, ?> payload) {
        return new WorkingSchema(payload);
    }

    static WorkingSchema fromSchema(Schema schema) {
        return new WorkingSchema(schema.asMap());
    }

    /** Current entries, as handed to the stage checker. */
    Map<String, Object> entries() {
        return Collections.unmodifiableMap(entries);
    }

    /** Name of the link that last produced {@code key}, if any link did. */
    Optional<String> producerOf(String key) {
        return Optional.ofNullable(producers.get(key));
    }

    /** Observed or declared type of {@code key}; empty when absent. */
    Optional<TypeSpec> typeOf(String key) {
        if (!entries.containsKey(key)) {
            return Optional.empty();
        }
        return Optional.of(TypeInference.infer(entries.get(key)));
    }

    /** Applies each operation in order. Last writer wins; a dropped key loses its producer. */
    void fold(String link, Map<String, SchemaOperation> operations) {
        for (Map.Entry<String, SchemaOperation> e : operations.entrySet()) {
            String key = e.getKey();
            Schema before = typeOf(key).map(t -> Schema.of(key, t)).orElse(Schema.empty());
            Optional<TypeSpec> after = e.getValue().apply(key, before).get(key);
            if (after.isPresent()) {
                entries.put(key, after.get());
                producers.put(key, link);
            } else {
                entries.remove(key);
                producers.remove(key);
            }
        }
    }
}
