package com.schemaflow.checker;

/** Classification of a {@link Violation}. */
public enum ViolationKind {
    /** A declared key is absent from the observed payload or schema. */
    MISSING_KEY,
    /** The key is present but its base type disagrees. */
    TYPE_MISMATCH,
    /** The key is a shaped array of the right element kind but its rank or a dimension disagrees. */
    SHAPE_MISMATCH,
    /** Transform was checked for a stage whose fitted state has not been computed. */
    NOT_FITTED,
    /** A fit parameter was supplied that the contract does not declare, or for a stage that does not exist. */
    UNEXPECTED_PARAMETER,
    /** Two stages of a chain produce the same key with different types (only under FLAG_CONFLICT). */
    TYPE_CONFLICT
}
