package com.chicu.breachml.ml.backend;

/**
 * @param input  вектор фич в порядке схемы
 * @param target метка в шкале 0..100
 */
public record TrainingExample(double[] input, double target) {

    public TrainingExample {
        if (input == null) throw new IllegalArgumentException("input is null");
        if (!Double.isFinite(target) || target < 0 || target > 100) {
            throw new IllegalArgumentException("target must be within 0..100, got " + target);
        }
        input = input.clone();
    }
}
