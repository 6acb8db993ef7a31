package com.chicu.breachml.ml.backend;

import lombok.Builder;

/**
 * Гиперпараметры одного прогона.
 * batchSize и validationSplit учитывает только тензорный бэкенд.
 */
@Builder(toBuilder = true)
public record TrainingConfig(
        double learningRate,
        int epochs,
        int batchSize,
        double validationSplit
) {

    public TrainingConfig {
        if (!(learningRate > 0) || !Double.isFinite(learningRate)) {
            throw new IllegalArgumentException("learningRate must be > 0, got " + learningRate);
        }
        if (epochs <= 0) throw new IllegalArgumentException("epochs must be > 0, got " + epochs);
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0, got " + batchSize);
        if (validationSplit < 0 || validationSplit > 0.9) {
            throw new IllegalArgumentException("validationSplit must be within [0, 0.9], got " + validationSplit);
        }
    }
}
