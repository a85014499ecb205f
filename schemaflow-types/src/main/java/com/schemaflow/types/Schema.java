package com.schemaflow.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable mapping from unique key names to {@link TypeSpec}s. Iteration follows insertion order,
 * which is used for stable reporting only and carries no meaning.
 * In JSON a schema is an object of key → type descriptor.
 */
public final class Schema {

    private static final Schema EMPTY = new Schema(new LinkedHashMap<>());

    private final Map<String, TypeSpec> entries;

    private Schema(LinkedHashMap<String, TypeSpec> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static Schema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Schema of(String key, TypeSpec type) {
        return builder().put(key, type).build();
    }

    public static Schema of(String key1, TypeSpec type1, String key2, TypeSpec type2) {
        return builder().put(key1, type1).put(key2, type2).build();
    }

    /**
     * Copies an existing map, keeping its iteration order.
     *
     * @throws MalformedContractException on a blank key or a missing type
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Schema fromMap(Map<String, ? extends TypeSpec> entries) {
        if (entries == null || entries.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        entries.forEach(builder::put);
        return builder.build();
    }

    public Optional<TypeSpec> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public List<String> keys() {
        return List.copyOf(entries.keySet());
    }

    /** Read-only view in insertion order. */
    @JsonValue
    public Map<String, TypeSpec> asMap() {
        return entries;
    }

    /**
     * Copy with {@code key} set to {@code type}. An existing key keeps its position; a new key is appended.
     *
     * @throws MalformedContractException on a blank key or a missing type
     */
    public Schema with(String key, TypeSpec type) {
        if (key == null || key.isBlank()) {
            throw new MalformedContractException("Schema key must not be blank");
        }
        if (type == null) {
            throw new MalformedContractException("Schema key '" + key + "' has no type");
        }
        LinkedHashMap<String, TypeSpec> copy = new LinkedHashMap<>(entries);
        copy.put(key, type);
        return new Schema(copy);
    }

    /** Copy without {@code key}; this schema when the key is absent. */
    public Schema without(String key) {
        if (!entries.containsKey(key)) {
            return this;
        }
        LinkedHashMap<String, TypeSpec> copy = new LinkedHashMap<>(entries);
        copy.remove(key);
        return copy.isEmpty() ? EMPTY : new Schema(copy);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((Schema) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    /** Collects entries; a key may be put only once. */
    public static final class Builder {

        private final LinkedHashMap<String, TypeSpec> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, TypeSpec type) {
            if (key == null || key.isBlank()) {
                throw new MalformedContractException("Schema key must not be blank");
            }
            if (type == null) {
                throw new MalformedContractException("Schema key '" + key + "' has no type");
            }
            if (entries.putIfAbsent(key, type) != null) {
                throw new MalformedContractException("Duplicate schema key: " + key);
            }
            return this;
        }

        public Builder putAll(Schema other) {
            if (other != null) {
                other.entries.forEach(this::put);
            }
            return this;
        }

        public Schema build() {
            return entries.isEmpty() ? EMPTY : new Schema(new LinkedHashMap<>(entries));
        }
    }
}
