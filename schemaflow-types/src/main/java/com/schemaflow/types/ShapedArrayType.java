package com.schemaflow.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Array of scalars with a rank and per-dimension constraints.
 * Declared types may leave dimensions unconstrained; observed arrays always carry concrete sizes.
 */
@JsonPropertyOrder({"type", "elementKind", "dimensions"})
public final class ShapedArrayType extends TypeSpec {

    private final ScalarKind elementKind;
    private final List<Dimension> dimensions;

    ShapedArrayType(ScalarKind elementKind, List<Dimension> dimensions) {
        if (elementKind == null) {
            throw new MalformedContractException("Shaped array element kind is missing");
        }
        if (dimensions == null) {
            throw new MalformedContractException("Shaped array dimensions are missing");
        }
        for (Dimension d : dimensions) {
            if (d == null) {
                throw new MalformedContractException("Shaped array dimension is missing; use Dimension.unconstrained()");
            }
        }
        this.elementKind = elementKind;
        this.dimensions = List.copyOf(dimensions);
    }

    @Override
    public TypeTag getTag() {
        return TypeTag.SHAPED_ARRAY;
    }

    public ScalarKind getElementKind() {
        return elementKind;
    }

    public List<Dimension> getDimensions() {
        return dimensions;
    }

    @JsonIgnore
    public int getRank() {
        return dimensions.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ShapedArrayType that = (ShapedArrayType) o;
        return elementKind == that.elementKind && dimensions.equals(that.dimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementKind, dimensions);
    }

    @Override
    public String toString() {
        return "ShapedArray<" + elementKind.displayName() + ">"
                + dimensions.stream().map(Dimension::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
