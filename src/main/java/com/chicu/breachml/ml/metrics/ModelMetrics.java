package com.chicu.breachml.ml.metrics;

import com.chicu.breachml.common.enums.ModelStatus;
import com.chicu.breachml.ml.training.TrainingRunView;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * @param accuracy доля 0..1: correct / (correct + incorrect) по фидбеку, иначе trainingAccuracy / 100, иначе null
 */
@Builder
public record ModelMetrics(
        String organisationId,
        Long modelId,
        Integer version,
        ModelStatus status,
        Double accuracy,
        long totalPredictions,
        long correctPredictions,
        long feedbackCount,
        Double trainingAccuracy,
        Double validationAccuracy,
        Instant lastTrainedAt,
        FeedbackStats feedbackStats,
        boolean trainingReady,
        boolean trainingRunning,
        List<TrainingRunView> recentTrainingRuns
) {

    public ModelMetrics {
        recentTrainingRuns = recentTrainingRuns == null ? List.of() : List.copyOf(recentTrainingRuns);
        if (feedbackStats == null) feedbackStats = FeedbackStats.empty();
    }
}
