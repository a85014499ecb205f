package com.schemaflow.checker;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.schemaflow.types.TypeSpec;

import java.util.Objects;

/**
 * One inconsistency between a declared contract and an observed payload or upstream-declared schema.
 * Violations are values returned to the caller, never thrown as control flow.
 */
@JsonPropertyOrder({"kind", "location", "expectedType", "observedType", "message"})
public final class Violation {

    private final Location location;
    private final ViolationKind kind;
    private final TypeSpec expectedType;
    private final TypeSpec observedType;
    private final String message;

    public Violation(Location location, ViolationKind kind, TypeSpec expectedType, TypeSpec observedType, String message) {
        this.location = Objects.requireNonNull(location, "location");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.expectedType = expectedType;
        this.observedType = observedType;
        this.message = message != null ? message : kind.name();
    }

    public Location getLocation() {
        return location;
    }

    public ViolationKind getKind() {
        return kind;
    }

    /** Declared type; null for NOT_FITTED and UNEXPECTED_PARAMETER. */
    public TypeSpec getExpectedType() {
        return expectedType;
    }

    /** Observed type; null when the key is missing or for NOT_FITTED. */
    public TypeSpec getObservedType() {
        return observedType;
    }

    public String getMessage() {
        return message;
    }

    /** Shortcut for {@code getLocation().getStage()}. */
    public String stage() {
        return location.getStage();
    }

    /** Shortcut for {@code getLocation().getKey()}. */
    public String key() {
        return location.getKey();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Violation that = (Violation) o;
        return location.equals(that.location) && kind == that.kind
                && Objects.equals(expectedType, that.expectedType)
                && Objects.equals(observedType, that.observedType)
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, kind, expectedType, observedType, message);
    }

    @Override
    public String toString() {
        return kind + " " + location + ": " + message;
    }
}
