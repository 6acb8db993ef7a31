package com.chicu.breachml.ml.backend;

import java.util.List;

/**
 * Снимок весов модели в одном из двух взаимоисключающих форматов.
 * Для TENSOR_LIST заполнен {@code tensors}, для DENSE_LAYERS - {@code layers} и {@code biases}.
 */
public record ModelWeights(
        WeightFormat format,
        List<TensorRecord> tensors,
        List<double[]> layers,
        double[] biases
) {

    public ModelWeights {
        if (format == null) throw new IllegalArgumentException("weights format is null");
        tensors = tensors == null ? List.of() : List.copyOf(tensors);
        layers = layers == null ? List.of() : List.copyOf(layers);
    }

    public static ModelWeights tensors(List<TensorRecord> tensors) {
        return new ModelWeights(WeightFormat.TENSOR_LIST, tensors, null, null);
    }

    public static ModelWeights denseLayers(List<double[]> layers, double[] biases) {
        return new ModelWeights(WeightFormat.DENSE_LAYERS, null, layers, biases);
    }

    public boolean isEmpty() {
        return format == WeightFormat.TENSOR_LIST ? tensors.isEmpty() : layers.isEmpty();
    }
}
