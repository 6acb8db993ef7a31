package com.chicu.breachml.ml.features;

import com.chicu.breachml.risk.RiskAssessment;

import java.util.Map;

public interface FeatureExtractor {

    FeatureSchema schema();

    /**
     * Фичи объекта, нормализованные примерно в [0,1].
     *
     * @param assessment уже посчитанный статистический разбор; если null - будет запрошен у скорера
     * @return имя фичи -> значение, ключи ровно как в {@link #schema()}
     */
    Map<String, Double> extract(String entityId, String organisationId, RiskAssessment assessment);
}
