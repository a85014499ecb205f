package com.schemaflow.types;

import org.junit.jupiter.api.Test;

import static com.schemaflow.types.ScalarKind.FLOAT;
import static com.schemaflow.types.ScalarKind.INTEGER;
import static com.schemaflow.types.ScalarKind.STRING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompatibilityTest {

    @Test
    void scalar_kindsMustMatchExactly() {
        assertTrue(Compatibility.isCompatible(TypeSpec.floating(), TypeSpec.floating()));
        // no implicit numeric widening
        assertFalse(Compatibility.isCompatible(TypeSpec.floating(), TypeSpec.integer()));
        assertFalse(Compatibility.isCompatible(TypeSpec.integer(), TypeSpec.floating()));
    }

    @Test
    void sequence_comparesElementTypesRecursively() {
        assertTrue(Compatibility.isCompatible(
                TypeSpec.sequence(TypeSpec.sequence(TypeSpec.string())),
                TypeSpec.sequence(TypeSpec.sequence(TypeSpec.string()))));
        assertFalse(Compatibility.isCompatible(TypeSpec.sequence(TypeSpec.string()), TypeSpec.sequence(TypeSpec.integer())));
        assertFalse(Compatibility.isCompatible(TypeSpec.sequence(TypeSpec.string()), TypeSpec.string()));
    }

    @Test
    void shapedArray_unconstrainedDimensionAcceptsAnySize() {
        TypeSpec declared = TypeSpec.array(FLOAT, null, 3);

        assertTrue(Compatibility.isCompatible(declared, TypeSpec.array(FLOAT, 1, 3)));
        assertTrue(Compatibility.isCompatible(declared, TypeSpec.array(FLOAT, 5000, 3)));
        assertFalse(Compatibility.isCompatible(declared, TypeSpec.array(FLOAT, 10, 4)));
        assertEquals(Compatibility.Mismatch.SHAPE, Compatibility.mismatch(declared, TypeSpec.array(FLOAT, 10, 4)));
    }

    @Test
    void shapedArray_rankDisagreementIsShapeMismatch() {
        TypeSpec declared = TypeSpec.array(FLOAT, null, null);

        assertEquals(Compatibility.Mismatch.SHAPE, Compatibility.mismatch(declared, TypeSpec.array(FLOAT, 3)));
        assertEquals(Compatibility.Mismatch.NONE, Compatibility.mismatch(declared, TypeSpec.array(FLOAT, 3, 2)));
    }

    @Test
    void shapedArray_elementKindDisagreementIsTypeMismatch() {
        assertEquals(Compatibility.Mismatch.TYPE,
                Compatibility.mismatch(TypeSpec.array(FLOAT, 3), TypeSpec.array(INTEGER, 3)));
        assertEquals(Compatibility.Mismatch.TYPE,
                Compatibility.mismatch(TypeSpec.array(FLOAT, null, null), TypeSpec.floating()));
    }

    @Test
    void shapedArray_fixedDeclaredDimensionRejectsUnconstrainedUpstream() {
        assertFalse(Compatibility.isCompatible(TypeSpec.array(FLOAT, 10), TypeSpec.array(FLOAT, (Integer) null)));
    }

    @Test
    void mapping_comparesKeyKindAndValueType() {
        TypeSpec declared = TypeSpec.mapping(STRING, TypeSpec.floating());

        assertTrue(Compatibility.isCompatible(declared, TypeSpec.mapping(STRING, TypeSpec.floating())));
        assertFalse(Compatibility.isCompatible(declared, TypeSpec.mapping(INTEGER, TypeSpec.floating())));
        assertFalse(Compatibility.isCompatible(declared, TypeSpec.mapping(STRING, TypeSpec.integer())));
    }

    @Test
    void opaque_isNominal() {
        assertTrue(Compatibility.isCompatible(TypeSpec.opaque("LinearModel"), TypeSpec.opaque("LinearModel")));
        assertFalse(Compatibility.isCompatible(TypeSpec.opaque("LinearModel"), TypeSpec.opaque("TreeModel")));
        assertFalse(Compatibility.isCompatible(TypeSpec.opaque("LinearModel"), TypeSpec.string()));
    }

    @Test
    void table_allowsExtraColumnsButRequiresDeclaredOnes() {
        TypeSpec declared = TypeSpec.table(Schema.of("price", TypeSpec.floating()));

        assertTrue(Compatibility.isCompatible(declared,
                TypeSpec.table(Schema.of("price", TypeSpec.floating(), "city", TypeSpec.string()))));
        assertFalse(Compatibility.isCompatible(declared, TypeSpec.table(Schema.of("city", TypeSpec.string()))));
        assertFalse(Compatibility.isCompatible(declared, TypeSpec.table(Schema.of("price", TypeSpec.integer()))));
    }

    @Test
    void equivalence_requiresBothDirections() {
        assertTrue(Compatibility.isEquivalent(TypeSpec.array(FLOAT, 3), TypeSpec.array(FLOAT, 3)));
        assertFalse(Compatibility.isEquivalent(TypeSpec.array(FLOAT, (Integer) null), TypeSpec.array(FLOAT, 3)));
    }
}
