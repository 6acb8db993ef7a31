package com.chicu.breachml.ml.prediction;

import java.util.List;
import java.util.Map;

/**
 * @param failures entityId -> сообщение ошибки для объектов, по которым прогноз не получился
 */
public record BulkPredictionResult(List<PredictionResult> results, Map<String, String> failures) {

    public BulkPredictionResult {
        results = List.copyOf(results);
        failures = Map.copyOf(failures);
    }
}
