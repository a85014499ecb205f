package com.schemaflow.types;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.schemaflow.types.ScalarKind.FLOAT;
import static com.schemaflow.types.ScalarKind.INTEGER;
import static com.schemaflow.types.ScalarKind.STRING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class TypeInferenceTest {

    private static final class FittedModel {
    }

    @Test
    void infer_scalars() {
        assertEquals(TypeSpec.floating(), TypeInference.infer(1.5));
        assertEquals(TypeSpec.floating(), TypeInference.infer(1.5f));
        assertEquals(TypeSpec.integer(), TypeInference.infer(1));
        assertEquals(TypeSpec.integer(), TypeInference.infer(1L));
        assertEquals(TypeSpec.string(), TypeInference.infer("a"));
        assertEquals(TypeSpec.bool(), TypeInference.infer(true));
        assertEquals(TypeSpec.scalar(ScalarKind.DATE), TypeInference.infer(LocalDate.of(2020, 1, 1)));
    }

    @Test
    void infer_primitiveArraysCarryConcreteShape() {
        assertEquals(TypeSpec.array(FLOAT, 3), TypeInference.infer(new double[3]));
        assertEquals(TypeSpec.array(FLOAT, 4, 2), TypeInference.infer(new double[4][2]));
        assertEquals(TypeSpec.array(INTEGER, 2, 0), TypeInference.infer(new int[2][0]));
        assertEquals(TypeSpec.array(FLOAT, 0, null), TypeInference.infer(new float[0][]));
    }

    @Test
    void infer_raggedArrayIsASequenceOfRows() {
        double[][] ragged = {{1, 2, 3}, {1, 2}, {1, 2, 3, 4, 5}};

        assertEquals(TypeSpec.sequence(TypeSpec.array(FLOAT, 3)), TypeInference.infer(ragged));
        assertEquals(TypeSpec.sequence(TypeSpec.opaque(TypeInference.NULL_LABEL)), TypeInference.infer(new int[2][]));
    }

    @Test
    void observe_emptyArrayTakesInnerExtentsFromDeclaredType() {
        assertEquals(TypeSpec.array(FLOAT, 0, 3), TypeInference.observe(TypeSpec.array(FLOAT, null, 3), new double[0][3]));
        assertEquals(TypeSpec.array(FLOAT, 0, null), TypeInference.observe(TypeSpec.array(FLOAT, null, null), new double[0][7]));
        // rank disagrees: nothing to borrow
        assertEquals(TypeSpec.array(FLOAT, 0, null), TypeInference.observe(TypeSpec.array(FLOAT, 3), new double[0][3]));
    }

    @Test
    void infer_collectionsAndMaps() {
        assertEquals(TypeSpec.sequence(TypeSpec.string()), TypeInference.infer(List.of("a", "b")));
        assertEquals(TypeSpec.sequence(TypeSpec.string()), TypeInference.infer(new String[]{"a"}));
        assertEquals(TypeSpec.mapping(STRING, TypeSpec.integer()), TypeInference.infer(Map.of("a", 1)));
    }

    @Test
    void infer_typeSpecAndSelfDescribedValuesArePassedThrough() {
        TypeSpec declared = TypeSpec.array(FLOAT, null, 3);
        assertSame(declared, TypeInference.infer(declared));

        SchemaTyped frame = () -> TypeSpec.table(Schema.of("x", TypeSpec.floating()));
        assertEquals(TypeSpec.table(Schema.of("x", TypeSpec.floating())), TypeInference.infer(frame));
    }

    @Test
    void infer_otherObjectsAreOpaqueByClassName() {
        assertEquals(TypeSpec.opaque(FittedModel.class), TypeInference.infer(new FittedModel()));
        assertEquals(TypeSpec.opaque(TypeInference.NULL_LABEL), TypeInference.infer(null));
    }

    @Test
    void observe_reportsFirstNonConformingElement() {
        TypeSpec declared = TypeSpec.sequence(TypeSpec.floating());

        assertSame(declared, TypeInference.observe(declared, List.of(1.0, 2.0)));
        assertSame(declared, TypeInference.observe(declared, List.of()));
        assertEquals(TypeSpec.sequence(TypeSpec.string()), TypeInference.observe(declared, List.of(1.0, "x", 3)));
    }

    @Test
    void observe_mappingReportsMismatchingKeyOrValue() {
        TypeSpec declared = TypeSpec.mapping(STRING, TypeSpec.floating());

        assertSame(declared, TypeInference.observe(declared, Map.of("a", 1.0)));
        assertEquals(TypeSpec.mapping(STRING, TypeSpec.integer()), TypeInference.observe(declared, Map.of("a", 1)));
        assertEquals(TypeSpec.mapping(INTEGER, TypeSpec.floating()), TypeInference.observe(declared, Map.of(7, 1.0)));
    }
}
