package com.chicu.breachml.common.enums;

/**
 * Статус модели и прогона обучения (общий enum).
 * Для TrainingRun переходы TRAINING -> ACTIVE | FAILED финальные.
 */
public enum ModelStatus {
    TRAINING,
    ACTIVE,
    INACTIVE,
    FAILED
}
