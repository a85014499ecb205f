package com.schemaflow.types;

import java.util.Locale;

/**
 * Kind of a scalar value. Kinds are matched exactly; there is no implicit numeric widening.
 */
public enum ScalarKind {
    FLOAT,
    INTEGER,
    STRING,
    BOOLEAN,
    DATE,
    DATETIME;

    /**
     * Resolves a kind by name, case-insensitive. Accepts the common aliases
     * {@code double}, {@code int}, {@code long}, {@code str} and {@code bool}.
     *
     * @throws MalformedContractException when the name is blank or unknown
     */
    public static ScalarKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new MalformedContractException("Scalar kind is missing");
        }
        String n = name.trim().toUpperCase(Locale.ROOT);
        switch (n) {
            case "DOUBLE":
                return FLOAT;
            case "INT":
            case "LONG":
                return INTEGER;
            case "STR":
                return STRING;
            case "BOOL":
                return BOOLEAN;
            default:
                break;
        }
        try {
            return ScalarKind.valueOf(n);
        } catch (IllegalArgumentException e) {
            throw new MalformedContractException("Unknown scalar kind: " + name, e);
        }
    }

    /** Lower-case display name (e.g. {@code float}). */
    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
