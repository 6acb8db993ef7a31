package com.chicu.breachml.ml.backend;

import java.util.Arrays;

/**
 * Один тензор параметров: плоские данные (row-major) + форма.
 */
public record TensorRecord(double[] data, long[] shape) {

    public TensorRecord {
        if (data == null || shape == null) {
            throw new IllegalArgumentException("tensor data/shape is null");
        }
        long expected = 1;
        for (long d : shape) {
            if (d <= 0) throw new IllegalArgumentException("bad tensor shape " + Arrays.toString(shape));
            expected *= d;
        }
        if (expected != data.length) {
            throw new IllegalArgumentException(
                    "tensor shape " + Arrays.toString(shape) + " needs " + expected + " values, got " + data.length);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorRecord other)) return false;
        return Arrays.equals(data, other.data) && Arrays.equals(shape, other.shape);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(data) + Arrays.hashCode(shape);
    }

    @Override
    public String toString() {
        return "TensorRecord{shape=" + Arrays.toString(shape) + "}";
    }
}
