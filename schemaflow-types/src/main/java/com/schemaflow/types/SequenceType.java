package com.schemaflow.types;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Ordered sequence whose elements all have the element type. */
@JsonPropertyOrder({"type", "element"})
public final class SequenceType extends TypeSpec {

    private final TypeSpec element;

    SequenceType(TypeSpec element) {
        if (element == null) {
            throw new MalformedContractException("Sequence element type is missing");
        }
        this.element = element;
    }

    @Override
    public TypeTag getTag() {
        return TypeTag.SEQUENCE;
    }

    public TypeSpec getElement() {
        return element;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return element.equals(((SequenceType) o).element);
    }

    @Override
    public int hashCode() {
        return 31 * TypeTag.SEQUENCE.hashCode() + element.hashCode();
    }

    @Override
    public String toString() {
        return "Sequence<" + element + ">";
    }
}
