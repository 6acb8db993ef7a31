package com.chicu.breachml.ml.training;

import lombok.Builder;

/**
 * Переопределения гиперпараметров на один прогон. null = взять из модели / дефолтов.
 */
@Builder
public record TrainingOverrides(
        Double learningRate,
        Integer epochs,
        Integer batchSize,
        Double validationSplit
) {

    public static TrainingOverrides none() {
        return new TrainingOverrides(null, null, null, null);
    }
}
