package com.schemaflow.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural type descriptor. The set of variants is closed: {@link ScalarType}, {@link SequenceType},
 * {@link ShapedArrayType}, {@link MappingType}, {@link TableType} and {@link OpaqueType}.
 * Instances are immutable. Whether an observed type satisfies a declared one is decided only by
 * {@link Compatibility#isCompatible(TypeSpec, TypeSpec)}; {@code equals} exists for value semantics
 * in reports and JSON round-trips.
 */
@JsonDeserialize(using = TypeSpecDeserializer.class)
public abstract class TypeSpec {

    private static final Map<ScalarKind, ScalarType> SCALARS = new EnumMap<>(ScalarKind.class);

    static {
        for (ScalarKind kind : ScalarKind.values()) {
            SCALARS.put(kind, new ScalarType(kind));
        }
    }

    TypeSpec() {
    }

    /** Variant discriminator, serialized as {@code "type"}. */
    @JsonProperty("type")
    public abstract TypeTag getTag();

    public static ScalarType scalar(ScalarKind kind) {
        if (kind == null) {
            throw new MalformedContractException("Scalar kind is missing");
        }
        return SCALARS.get(kind);
    }

    public static ScalarType floating() {
        return scalar(ScalarKind.FLOAT);
    }

    public static ScalarType integer() {
        return scalar(ScalarKind.INTEGER);
    }

    public static ScalarType string() {
        return scalar(ScalarKind.STRING);
    }

    public static ScalarType bool() {
        return scalar(ScalarKind.BOOLEAN);
    }

    public static SequenceType sequence(TypeSpec element) {
        return new SequenceType(element);
    }

    public static ShapedArrayType shapedArray(ScalarKind elementKind, List<Dimension> dimensions) {
        return new ShapedArrayType(elementKind, dimensions);
    }

    public static ShapedArrayType shapedArray(ScalarKind elementKind, Dimension... dimensions) {
        return new ShapedArrayType(elementKind, dimensions != null ? List.of(dimensions) : null);
    }

    /**
     * Shaped array from sizes, where {@code null} marks an unconstrained dimension,
     * e.g. {@code array(FLOAT, null, 3)} for {@code [?, 3]}.
     */
    public static ShapedArrayType array(ScalarKind elementKind, Integer... sizes) {
        if (sizes == null) {
            throw new MalformedContractException("Shaped array dimensions are missing");
        }
        List<Dimension> dimensions = new ArrayList<>(sizes.length);
        for (Integer size : sizes) {
            dimensions.add(size == null ? Dimension.unconstrained() : Dimension.fixed(size));
        }
        return new ShapedArrayType(elementKind, dimensions);
    }

    public static MappingType mapping(ScalarKind keyKind, TypeSpec value) {
        return new MappingType(keyKind, value);
    }

    public static TableType table(Schema columns) {
        return new TableType(columns);
    }

    public static OpaqueType opaque(String label) {
        return new OpaqueType(label);
    }

    /** Opaque handle labelled with the class name, matching what {@link TypeInference} observes for instances. */
    public static OpaqueType opaque(Class<?> type) {
        Objects.requireNonNull(type, "type");
        return new OpaqueType(type.getName());
    }
}
