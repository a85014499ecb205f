package com.schemaflow.types;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Observed {@link TypeSpec} of runtime values. Only the type of a value is inspected, never its content
 * beyond what is needed to find element types and array extents.
 *
 * <p>{@link TypeSpec} values are returned as-is, so a payload may mix concrete values with declared types.
 */
public final class TypeInference {

    /** Label observed for {@code null}. */
    public static final String NULL_LABEL = "null";
    /** Element label observed for an empty collection when no declared type guides the inference. */
    public static final String EMPTY_LABEL = "empty";

    private TypeInference() {
    }

    /** Observed type of {@code value} without a declared type to guide element inference. */
    public static TypeSpec infer(Object value) {
        if (value == null) return TypeSpec.opaque(NULL_LABEL);
        if (value instanceof TypeSpec) return (TypeSpec) value;
        if (value instanceof SchemaTyped) return selfDescribed((SchemaTyped) value);
        ScalarKind kind = scalarKindOf(value);
        if (kind != null) return TypeSpec.scalar(kind);
        Class<?> type = value.getClass();
        if (type.isArray()) {
            ScalarKind leafKind = primitiveKindOf(leafComponentType(type));
            if (leafKind != null) {
                return primitiveArray(leafKind, value, null);
            }
            return inferSequence(Arrays.asList((Object[]) value));
        }
        if (value instanceof Collection) return inferSequence((Collection<?>) value);
        if (value instanceof Map) return inferMapping((Map<?, ?>) value);
        return TypeSpec.opaque(type);
    }

    /**
     * Observed type of {@code value}, using {@code declared} to pick the element or value type to report for
     * collections and maps: the type of the first non-conforming element, or the declared one when every element
     * conforms (an empty collection conforms).
     */
    public static TypeSpec observe(TypeSpec declared, Object value) {
        if (declared == null || value == null || value instanceof TypeSpec || value instanceof SchemaTyped) {
            return infer(value);
        }
        if (declared instanceof SequenceType) {
            Iterable<?> items = itemsOf(value);
            if (items != null) {
                TypeSpec element = ((SequenceType) declared).getElement();
                for (Object item : items) {
                    TypeSpec observed = observe(element, item);
                    if (!Compatibility.isCompatible(element, observed)) {
                        return TypeSpec.sequence(observed);
                    }
                }
                return declared;
            }
        }
        if (declared instanceof ShapedArrayType && value.getClass().isArray()) {
            ScalarKind leafKind = primitiveKindOf(leafComponentType(value.getClass()));
            if (leafKind != null) {
                return primitiveArray(leafKind, value, ((ShapedArrayType) declared).getDimensions());
            }
        }
        if (declared instanceof MappingType && value instanceof Map) {
            MappingType mapping = (MappingType) declared;
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                TypeSpec keyType = infer(e.getKey());
                if (!(keyType instanceof ScalarType)) {
                    return TypeSpec.opaque(value.getClass());
                }
                ScalarKind keyKind = ((ScalarType) keyType).getKind();
                TypeSpec valueType = observe(mapping.getValue(), e.getValue());
                if (keyKind != mapping.getKeyKind() || !Compatibility.isCompatible(mapping.getValue(), valueType)) {
                    return TypeSpec.mapping(keyKind, valueType);
                }
            }
            return declared;
        }
        return infer(value);
    }

    private static TypeSpec selfDescribed(SchemaTyped value) {
        TypeSpec type = value.typeSpec();
        if (type == null) {
            throw new IllegalStateException(value.getClass().getName() + " reported no type");
        }
        return type;
    }

    private static TypeSpec inferSequence(Collection<?> items) {
        Iterator<?> it = items.iterator();
        if (!it.hasNext()) {
            return TypeSpec.sequence(TypeSpec.opaque(EMPTY_LABEL));
        }
        return TypeSpec.sequence(infer(it.next()));
    }

    private static TypeSpec inferMapping(Map<?, ?> map) {
        Iterator<? extends Map.Entry<?, ?>> it = map.entrySet().iterator();
        if (!it.hasNext()) {
            return TypeSpec.mapping(ScalarKind.STRING, TypeSpec.opaque(EMPTY_LABEL));
        }
        Map.Entry<?, ?> first = it.next();
        TypeSpec keyType = infer(first.getKey());
        if (!(keyType instanceof ScalarType)) {
            return TypeSpec.opaque(map.getClass());
        }
        return TypeSpec.mapping(((ScalarType) keyType).getKind(), infer(first.getValue()));
    }

    private static Iterable<?> itemsOf(Object value) {
        if (value instanceof Collection) return (Collection<?>) value;
        if (value instanceof Object[]) return Arrays.asList((Object[]) value);
        return null;
    }

    private static ScalarKind scalarKindOf(Object value) {
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) return ScalarKind.FLOAT;
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) return ScalarKind.INTEGER;
        if (value instanceof CharSequence || value instanceof Character) return ScalarKind.STRING;
        if (value instanceof Boolean) return ScalarKind.BOOLEAN;
        if (value instanceof LocalDate) return ScalarKind.DATE;
        if (value instanceof LocalDateTime || value instanceof Instant
                || value instanceof OffsetDateTime || value instanceof ZonedDateTime) return ScalarKind.DATETIME;
        return null;
    }

    private static ScalarKind primitiveKindOf(Class<?> type) {
        if (type == double.class || type == float.class) return ScalarKind.FLOAT;
        if (type == int.class || type == long.class || type == short.class || type == byte.class) return ScalarKind.INTEGER;
        if (type == boolean.class) return ScalarKind.BOOLEAN;
        if (type == char.class) return ScalarKind.STRING;
        return null;
    }

    private static Class<?> leafComponentType(Class<?> arrayType) {
        Class<?> c = arrayType;
        while (c.isArray()) {
            c = c.getComponentType();
        }
        return c;
    }

    private static TypeSpec primitiveArray(ScalarKind leafKind, Object array, List<Dimension> declaredDims) {
        List<Dimension> shape = shapeOf(array, declaredDims);
        if (shape != null) {
            return TypeSpec.shapedArray(leafKind, shape);
        }
        // Ragged: rows of one level differ in length, so there is no shape. Report the rows instead.
        return TypeSpec.sequence(infer(Array.get(array, 0)));
    }

    /**
     * Walks every sub-array of each level. Returns null when the array is ragged (a level mixes lengths or holds
     * a null row). Below an empty level the extents are unknown: they are taken from {@code declaredDims} when
     * the ranks agree, otherwise reported as unconstrained.
     */
    private static List<Dimension> shapeOf(Object array, List<Dimension> declaredDims) {
        int rank = rankOf(array.getClass());
        boolean declaredRankMatches = declaredDims != null && declaredDims.size() == rank;
        List<Dimension> dims = new ArrayList<>(rank);
        List<Object> level = List.of(array);
        for (int depth = 0; depth < rank; depth++) {
            if (level.isEmpty()) {
                dims.add(declaredRankMatches ? declaredDims.get(depth) : Dimension.unconstrained());
                continue;
            }
            int length = -1;
            List<Object> next = new ArrayList<>();
            for (Object node : level) {
                if (node == null) {
                    return null;
                }
                int n = Array.getLength(node);
                if (length >= 0 && n != length) {
                    return null;
                }
                length = n;
                if (depth < rank - 1) {
                    for (int i = 0; i < n; i++) {
                        next.add(Array.get(node, i));
                    }
                }
            }
            dims.add(Dimension.fixed(length));
            level = next;
        }
        return dims;
    }

    private static int rankOf(Class<?> arrayType) {
        int rank = 0;
        Class<?> c = arrayType;
        while (c.isArray()) {
            rank++;
            c = c.getComponentType();
        }
        return rank;
    }
}
