package com.schemaflow.types;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Key-value mapping with scalar keys of one kind and values of one type. */
@JsonPropertyOrder({"type", "keyKind", "value"})
public final class MappingType extends TypeSpec {

    private final ScalarKind keyKind;
    private final TypeSpec value;

    MappingType(ScalarKind keyKind, TypeSpec value) {
        if (keyKind == null) {
            throw new MalformedContractException("Mapping key kind is missing");
        }
        if (value == null) {
            throw new MalformedContractException("Mapping value type is missing");
        }
        this.keyKind = keyKind;
        this.value = value;
    }

    @Override
    public TypeTag getTag() {
        return TypeTag.MAPPING;
    }

    public ScalarKind getKeyKind() {
        return keyKind;
    }

    public TypeSpec getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MappingType that = (MappingType) o;
        return keyKind == that.keyKind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyKind, value);
    }

    @Override
    public String toString() {
        return "Mapping<" + keyKind.displayName() + ", " + value + ">";
    }
}
