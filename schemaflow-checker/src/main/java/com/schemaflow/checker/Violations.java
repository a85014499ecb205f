package com.schemaflow.checker;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.stream.Collectors;

/** Helpers for violation lists returned by the checker and the chain composer. */
public final class Violations {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private Violations() {
    }

    /**
     * Throws when the list is not empty. An empty list is the only "consistent" signal.
     *
     * @throws SchemaFlowException carrying every violation
     */
    public static void requireNone(List<Violation> violations) {
        if (violations != null && !violations.isEmpty()) {
            throw new SchemaFlowException(violations);
        }
    }

    public static List<Violation> ofKind(List<Violation> violations, ViolationKind kind) {
        return violations.stream().filter(v -> v.getKind() == kind).collect(Collectors.toList());
    }

    public static List<Violation> atStage(List<Violation> violations, String stage) {
        return violations.stream().filter(v -> stage.equals(v.stage())).collect(Collectors.toList());
    }

    /** One line per violation, for logs. */
    public static String summary(List<Violation> violations) {
        return violations.stream().map(Violation::toString).collect(Collectors.joining(System.lineSeparator()));
    }

    /** JSON report (pretty-printed, nulls excluded). */
    public static String toJson(List<Violation> violations) {
        try {
            return MAPPER.writeValueAsString(violations);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
