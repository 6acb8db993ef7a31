package com.chicu.breachml.ml.backend;

/**
 * Метрики одной эпохи. accuracy в процентах (0..100).
 * validation* = null, если валидационной выборки нет.
 */
public record EpochStats(
        int epoch,
        double loss,
        double accuracy,
        Double validationLoss,
        Double validationAccuracy
) {

    public static EpochStats of(int epoch, double loss, double accuracy) {
        return new EpochStats(epoch, loss, accuracy, null, null);
    }
}
