package com.chicu.breachml.ml.backend;

/**
 * Явный тег формата сериализованных весов (хранится рядом с весами).
 */
public enum WeightFormat {
    /** список тензоров {data, shape}, по одному на параметр сети */
    TENSOR_LIST,
    /** плоские row-major матрицы слоёв + bias на слой */
    DENSE_LAYERS
}
