package com.schemaflow.types;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Scalar of a given {@link ScalarKind}. Obtain through {@link TypeSpec#scalar(ScalarKind)}. */
@JsonPropertyOrder({"type", "kind"})
public final class ScalarType extends TypeSpec {

    private final ScalarKind kind;

    ScalarType(ScalarKind kind) {
        this.kind = kind;
    }

    @Override
    public TypeTag getTag() {
        return TypeTag.SCALAR;
    }

    public ScalarKind getKind() {
        return kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return kind == ((ScalarType) o).kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }

    @Override
    public String toString() {
        return kind.displayName();
    }
}
