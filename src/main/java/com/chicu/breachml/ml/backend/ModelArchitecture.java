package com.chicu.breachml.ml.backend;

import java.util.ArrayList;
import java.util.List;

/**
 * Фиксированная архитектура: вход -> скрытые ReLU слои -> 1 sigmoid выход.
 */
public record ModelArchitecture(int inputSize, List<Integer> hiddenLayers) {

    public static final int OUTPUT_SIZE = 1;

    public ModelArchitecture {
        if (inputSize <= 0) throw new IllegalArgumentException("inputSize must be > 0");
        if (hiddenLayers == null || hiddenLayers.isEmpty()) {
            throw new IllegalArgumentException("hiddenLayers must not be empty");
        }
        for (Integer h : hiddenLayers) {
            if (h == null || h <= 0) throw new IllegalArgumentException("bad hidden layer size: " + hiddenLayers);
        }
        hiddenLayers = List.copyOf(hiddenLayers);
    }

    /** [input, hidden..., output] */
    public int[] layerSizes() {
        List<Integer> all = new ArrayList<>();
        all.add(inputSize);
        all.addAll(hiddenLayers);
        all.add(OUTPUT_SIZE);
        return all.stream().mapToInt(Integer::intValue).toArray();
    }
}
