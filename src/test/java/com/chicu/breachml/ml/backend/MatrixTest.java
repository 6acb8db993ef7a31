package com.chicu.breachml.ml.backend;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatrixTest {

    @Test
    void fromFlat_isRowMajor() {
        Matrix m = Matrix.fromFlat(2, 3, new double[]{0, 1, 2, 3, 4, 5});

        assertEquals(1, m.get(0, 1));
        assertEquals(3, m.get(1, 0));
        assertEquals(5, m.get(1, 2));
    }

    @Test
    void outOfBounds_shouldThrow_insteadOfReadingNeighbourCell() {
        Matrix m = new Matrix(2, 3);

        // плоский индекс 0*3+3 = 3 существует, но столбца 3 нет
        assertThrows(IndexOutOfBoundsException.class, () -> m.get(0, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> m.set(2, 0, 1.0));
        assertThrows(IndexOutOfBoundsException.class, () -> m.add(-1, 0, 1.0));
    }

    @Test
    void fromFlat_wrongLength_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> Matrix.fromFlat(2, 2, new double[3]));
        assertThrows(IllegalArgumentException.class, () -> Matrix.fromFlat(2, 2, null));
    }

    @Test
    void toFlat_andCopy_areDetached() {
        Matrix m = Matrix.fromFlat(1, 2, new double[]{1, 2});
        double[] flat = m.toFlat();
        Matrix copy = m.copy();

        flat[0] = 100;
        copy.set(0, 1, 200);

        assertEquals(1, m.get(0, 0));
        assertEquals(2, m.get(0, 1));
    }
}
