package com.schemaflow.types;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One dimension constraint of a {@link ShapedArrayType}: either a fixed size or unconstrained.
 * In JSON a fixed size is a number and an unconstrained dimension is {@code null}.
 */
public final class Dimension {

    private static final Dimension UNCONSTRAINED = new Dimension(-1);

    private final int size;

    private Dimension(int size) {
        this.size = size;
    }

    /**
     * Fixed size. Zero is accepted because it is the observed extent of an empty array.
     *
     * @throws MalformedContractException when {@code size} is negative
     */
    public static Dimension fixed(int size) {
        if (size < 0) {
            throw new MalformedContractException("Fixed dimension must not be negative: " + size);
        }
        return new Dimension(size);
    }

    public static Dimension unconstrained() {
        return UNCONSTRAINED;
    }

    public boolean isUnconstrained() {
        return size < 0;
    }

    /** Fixed size; only meaningful when {@link #isUnconstrained()} is false. */
    public int getSize() {
        if (isUnconstrained()) {
            throw new IllegalStateException("Unconstrained dimension has no size");
        }
        return size;
    }

    /** Accepts {@code other} when this dimension is unconstrained or both sizes are equal. */
    public boolean accepts(Dimension other) {
        return isUnconstrained() || (!other.isUnconstrained() && size == other.size);
    }

    @JsonValue
    public Integer toJson() {
        return isUnconstrained() ? null : size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return size == ((Dimension) o).size;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(size);
    }

    @Override
    public String toString() {
        return isUnconstrained() ? "?" : Integer.toString(size);
    }
}
