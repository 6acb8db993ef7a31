package com.chicu.breachml.ml.prediction;

import com.chicu.breachml.common.enums.OutcomeType;
import com.chicu.breachml.common.enums.RiskCategory;
import com.chicu.breachml.common.enums.SourceLabel;
import com.chicu.breachml.ml.persistence.MlPredictionEntity;
import lombok.Builder;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

@Builder
public record PredictionResult(
        Long predictionId,
        Long modelId,
        String entityId,
        String organisationId,
        int statisticalScore,
        int statisticalConfidence,
        Integer mlScore,
        Integer mlConfidence,
        String mlBackend,
        int combinedScore,
        int combinedConfidence,
        RiskCategory category,
        Integer daysToBreach,
        LocalDate predictedBreachDate,
        SourceLabel sourceLabel,
        boolean test,
        Instant expiresAt,
        Map<String, Double> inputFeatures,
        OutcomeType actualOutcome,
        LocalDate actualBreachDate,
        Boolean wasAccurate
) {

    static PredictionResult from(MlPredictionEntity p, Map<String, Double> features) {
        return PredictionResult.builder()
                .predictionId(p.getId())
                .modelId(p.getModelId())
                .entityId(p.getEntityId())
                .organisationId(p.getOrganisationId())
                .statisticalScore(p.getStatisticalScore())
                .statisticalConfidence(p.getStatisticalConfidence())
                .mlScore(p.getMlScore())
                .mlConfidence(p.getMlConfidence())
                .mlBackend(p.getMlBackend())
                .combinedScore(p.getCombinedScore())
                .combinedConfidence(p.getCombinedConfidence())
                .category(p.getRiskCategory())
                .daysToBreach(p.getDaysToBreach())
                .predictedBreachDate(p.getPredictedBreachDate())
                .sourceLabel(p.getSourceLabel())
                .test(p.isTest())
                .expiresAt(p.getExpiresAt())
                .inputFeatures(features)
                .actualOutcome(p.getActualOutcome())
                .actualBreachDate(p.getActualBreachDate())
                .wasAccurate(p.getWasAccurate())
                .build();
    }
}
