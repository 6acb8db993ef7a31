package com.chicu.breachml.ml.backend;

import java.util.Objects;

/**
 * Плотная row-major матрица с объявленными размерами.
 * Индексы проверяются, поэтому ошибка индексации падает сразу, а не читает чужую ячейку.
 */
public final class Matrix {

    private final int rows;
    private final int cols;
    private final double[] data;

    public Matrix(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("bad matrix size " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        this.data = new double[rows * cols];
    }

    public static Matrix fromFlat(int rows, int cols, double[] flat) {
        Matrix m = new Matrix(rows, cols);
        if (flat == null || flat.length != m.data.length) {
            throw new IllegalArgumentException("matrix " + rows + "x" + cols + " needs " + m.data.length
                    + " values, got " + (flat == null ? "null" : flat.length));
        }
        System.arraycopy(flat, 0, m.data, 0, flat.length);
        return m;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public double get(int r, int c) {
        return data[index(r, c)];
    }

    public void set(int r, int c, double v) {
        data[index(r, c)] = v;
    }

    public void add(int r, int c, double delta) {
        data[index(r, c)] += delta;
    }

    public double[] toFlat() {
        return data.clone();
    }

    public Matrix copy() {
        return fromFlat(rows, cols, data);
    }

    private int index(int r, int c) {
        Objects.checkIndex(r, rows);
        Objects.checkIndex(c, cols);
        return r * cols + c;
    }
}
