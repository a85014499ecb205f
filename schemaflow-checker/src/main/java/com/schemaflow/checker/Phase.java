package com.schemaflow.checker;

/** Lifecycle phase of a stage; selects which requirement slot of a contract is checked. */
public enum Phase {
    FIT,
    TRANSFORM;

    String label() {
        return this == FIT ? "fit" : "transform";
    }
}
