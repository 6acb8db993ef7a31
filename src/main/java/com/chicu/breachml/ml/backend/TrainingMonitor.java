package com.chicu.breachml.ml.backend;

/**
 * Колбэк обучения: вызывается после каждой эпохи, флаг отмены проверяется между эпохами.
 */
public interface TrainingMonitor {

    TrainingMonitor NONE = new TrainingMonitor() {
    };

    default void onEpoch(EpochStats stats, int totalEpochs) {
    }

    default boolean isCancelled() {
        return false;
    }
}
