package com.schemaflow.types;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Object whose internal structure is not modelled (e.g. a trained model handle).
 * Typing is nominal: only the label is compared.
 */
@JsonPropertyOrder({"type", "label"})
public final class OpaqueType extends TypeSpec {

    private final String label;

    OpaqueType(String label) {
        if (label == null || label.isBlank()) {
            throw new MalformedContractException("Opaque label is missing");
        }
        this.label = label;
    }

    @Override
    public TypeTag getTag() {
        return TypeTag.OPAQUE;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return label.equals(((OpaqueType) o).label);
    }

    @Override
    public int hashCode() {
        return label.hashCode();
    }

    @Override
    public String toString() {
        return "Opaque(" + label + ")";
    }
}
