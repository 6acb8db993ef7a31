package com.chicu.breachml.ml.registry;

import lombok.Builder;

import java.util.Map;

/**
 * Частичное обновление настроек модели: null-поля не трогаются.
 * featureWeights сливаются с текущими по имени фичи.
 */
@Builder
public record ModelSettingsUpdate(
        Double learningRate,
        Integer epochs,
        Integer batchSize,
        Map<String, Double> featureWeights
) {
}
