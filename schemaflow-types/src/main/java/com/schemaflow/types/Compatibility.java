package com.schemaflow.types;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The compatibility predicate between a declared type and an observed (or upstream-declared) type.
 * <ul>
 *   <li>Scalar: kinds match exactly.</li>
 *   <li>Sequence: observed is a sequence with a compatible element type.</li>
 *   <li>ShapedArray: same element kind, same rank, and each declared dimension is unconstrained or equal.</li>
 *   <li>Mapping: same key kind, compatible value type.</li>
 *   <li>Table: every declared column present in the observed table with a compatible type.</li>
 *   <li>Opaque: labels equal.</li>
 * </ul>
 */
public final class Compatibility {

    /** How an incompatible pair disagrees. */
    public enum Mismatch {
        NONE,
        TYPE,
        SHAPE
    }

    private Compatibility() {
    }

    public static boolean isCompatible(TypeSpec declared, TypeSpec observed) {
        if (declared == null || observed == null) return false;
        if (declared.getTag() != observed.getTag()) return false;
        switch (declared.getTag()) {
            case SCALAR:
                return ((ScalarType) declared).getKind() == ((ScalarType) observed).getKind();
            case SEQUENCE:
                return isCompatible(((SequenceType) declared).getElement(), ((SequenceType) observed).getElement());
            case SHAPED_ARRAY:
                return shapedArrayMismatch((ShapedArrayType) declared, (ShapedArrayType) observed) == Mismatch.NONE;
            case MAPPING: {
                MappingType d = (MappingType) declared;
                MappingType o = (MappingType) observed;
                return d.getKeyKind() == o.getKeyKind() && isCompatible(d.getValue(), o.getValue());
            }
            case TABLE:
                return isCompatible(((TableType) declared).getColumns(), ((TableType) observed).getColumns());
            case OPAQUE:
                return ((OpaqueType) declared).getLabel().equals(((OpaqueType) observed).getLabel());
            default:
                throw new IllegalStateException("Unhandled type tag: " + declared.getTag());
        }
    }

    /** True when every declared column is present in {@code observed} with a compatible type. */
    public static boolean isCompatible(Schema declared, Schema observed) {
        for (Map.Entry<String, TypeSpec> column : declared.asMap().entrySet()) {
            Optional<TypeSpec> actual = observed.get(column.getKey());
            if (actual.isEmpty() || !isCompatible(column.getValue(), actual.get())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Classifies an incompatibility. SHAPE when both are shaped arrays of the same element kind whose rank or a
     * fixed dimension disagrees; TYPE for every other incompatibility; NONE when compatible.
     */
    public static Mismatch mismatch(TypeSpec declared, TypeSpec observed) {
        if (declared instanceof ShapedArrayType && observed instanceof ShapedArrayType) {
            return shapedArrayMismatch((ShapedArrayType) declared, (ShapedArrayType) observed);
        }
        return isCompatible(declared, observed) ? Mismatch.NONE : Mismatch.TYPE;
    }

    /** Compatible in both directions; used to decide whether two declarations describe the same type. */
    public static boolean isEquivalent(TypeSpec a, TypeSpec b) {
        return isCompatible(a, b) && isCompatible(b, a);
    }

    private static Mismatch shapedArrayMismatch(ShapedArrayType declared, ShapedArrayType observed) {
        if (declared.getElementKind() != observed.getElementKind()) return Mismatch.TYPE;
        List<Dimension> d = declared.getDimensions();
        List<Dimension> o = observed.getDimensions();
        if (d.size() != o.size()) return Mismatch.SHAPE;
        for (int i = 0; i < d.size(); i++) {
            if (!d.get(i).accepts(o.get(i))) return Mismatch.SHAPE;
        }
        return Mismatch.NONE;
    }
}
