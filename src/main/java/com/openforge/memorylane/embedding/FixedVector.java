package com.openforge.memorylane.embedding;

import java.util.Arrays;

/**
 * An embedding of fixed dimension, tagged with how it was produced.
 *
 * Arrays are copied on the way in and out; records compare arrays by identity,
 * so equality is redefined on the contents.
 */
public record FixedVector(float[] values, EmbeddingMode mode) {

    public FixedVector {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        values = values.clone();
    }

    public static FixedVector real(float[] values) {
        return new FixedVector(values, EmbeddingMode.REAL);
    }

    public static FixedVector mock(float[] values) {
        return new FixedVector(values, EmbeddingMode.MOCK);
    }

    @Override
    public float[] values() {
        return values.clone();
    }

    /** Read a single component without copying. */
    public float get(int index) {
        return values[index];
    }

    public int dimension() {
        return values.length;
    }

    public boolean isMock() {
        return mode == EmbeddingMode.MOCK;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FixedVector other)) return false;
        return mode == other.mode && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + mode.hashCode();
    }

    @Override
    public String toString() {
        return "FixedVector[dim=%d, mode=%s]".formatted(values.length, mode.wireName());
    }
}
