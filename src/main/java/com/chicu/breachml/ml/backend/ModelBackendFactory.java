package com.chicu.breachml.ml.backend;

import java.util.List;

/**
 * Именованная стратегия бэкенда. Порядок бинов (@Order) = порядок fallback-цепочки.
 */
public interface ModelBackendFactory {

    String name();

    WeightFormat weightFormat();

    /** База эвристики уверенности ML-скора. */
    int confidenceBase();

    /** Скрытые слои для новой (холодной) модели этого бэкенда. */
    List<Integer> defaultHiddenLayers();

    ModelBackend create(ModelArchitecture architecture);
}
