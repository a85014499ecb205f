package com.schemaflow.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.schemaflow.types.MalformedContractException;
import com.schemaflow.types.Schema;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of stage contracts, schemas and chain definitions.
 * Unknown fields are rejected. JSON excludes null values when serializing.
 * An invalid type descriptor surfaces as {@link MalformedContractException}; any other parse failure as
 * {@link UncheckedIOException}.
 */
public final class ContractConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ContractConfig() {
    }

    /**
     * Deserializes a stage contract, e.g.
     * {@code {"fitRequires": {"x": "float"}, "fittedState": {"mean": "float"}}}.
     *
     * @throws MalformedContractException when a type descriptor is invalid
     * @throws UncheckedIOException       on any other parse failure
     */
    public static StageContract fromJson(String json) {
        return read(json, StageContract.class);
    }

    /** Deserializes a chain definition ({@code name}, {@code initialInput}, {@code links}). */
    public static ChainDefinition chainFromJson(String json) {
        return read(json, ChainDefinition.class);
    }

    public static Schema schemaFromJson(String json) {
        return read(json, Schema.class);
    }

    public static String toJson(StageContract contract) {
        return write(contract);
    }

    public static String toJson(ChainDefinition chain) {
        return write(chain);
    }

    public static String toJson(Schema schema) {
        return write(schema);
    }

    /** Pretty-printed form of a chain definition, for files written by tools. */
    public static String toJsonPretty(ChainDefinition chain) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(chain);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static <T> T read(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (IOException e) {
            MalformedContractException malformed = findMalformed(e);
            if (malformed != null) {
                throw malformed;
            }
            throw new UncheckedIOException(e);
        }
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Jackson wraps exceptions thrown from creators and deserializers; find ours in the cause chain. */
    private static MalformedContractException findMalformed(Throwable t) {
        Throwable cause = t;
        while (cause != null) {
            if (cause instanceof MalformedContractException) {
                return (MalformedContractException) cause;
            }
            cause = cause.getCause();
        }
        return null;
    }
}
